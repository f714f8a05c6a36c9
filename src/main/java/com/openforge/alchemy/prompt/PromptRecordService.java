package com.openforge.alchemy.prompt;

import com.openforge.alchemy.domain.PromptCandidate;
import com.openforge.alchemy.relationship.RelationshipService;
import com.openforge.alchemy.repository.PromptCandidateRepository;
import com.openforge.alchemy.search.SearchFilter;
import com.openforge.alchemy.store.StoreErrorKind;
import com.openforge.alchemy.store.StoreException;
import com.openforge.alchemy.store.StoreProperties;
import com.openforge.alchemy.store.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Create / read / update / delete of candidate records.
 *
 * Every public method is one transaction. Validation happens before the
 * transaction opens, so a rejected input never touches the file.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PromptRecordService {

    private final PromptCandidateRepository repository;
    private final RelationshipService       relationships;
    private final StoreTransactions         transactions;
    private final StoreProperties           properties;
    private final Clock                     clock;

    // ── Create ───────────────────────────────────────────────────────────────

    public PromptRecord create(NewPrompt in) {
        if (in == null) throw StoreException.invalid("prompt must not be null");
        requireText(in.content(), "content");
        if (in.phase() == null) throw StoreException.invalid("phase is required");
        requireText(in.provider(), "provider");
        requireText(in.model(), "model");
        checkTemperature(in.temperature());
        checkTokens(in.maxTokens(), "max_tokens");
        checkTokens(in.actualTokens(), "actual_tokens");
        checkGenerationMetadata(in.inputTokens(), in.outputTokens(), in.processingTimeMs(), in.cost());
        if (in.relevanceScore() != null) {
            double r = in.relevanceScore();
            if (!(r >= 0.0 && r <= 1.0)) {
                throw StoreException.invalid("relevance_score must be within [0, 1], got " + r);
            }
        }
        if (in.embedding() != null) {
            checkEmbedding(in.embedding(), in.embeddingModel(), in.embeddingDimensions());
        }

        PromptRecord created = transactions.write("create",
                () -> PromptRecord.from(repository.saveAndFlush(newCandidate(in))));
        log.info("[Store] Created prompt {} (phase={}, provider={}, model={}, embedding={})",
                created.id(), created.phase(), created.provider(), created.model(),
                created.hasEmbedding() ? created.embeddingModel() + "/" + created.embeddingDimensions() : "none");
        return created;
    }

    // ── Read ─────────────────────────────────────────────────────────────────

    public PromptRecord get(String id) {
        return find(id).orElseThrow(() -> StoreException.notFound("prompt", id));
    }

    public Optional<PromptRecord> find(String id) {
        if (id == null || id.isBlank()) return Optional.empty();
        return transactions.read("get", () -> repository.findById(id).map(PromptRecord::from));
    }

    public long count() {
        return transactions.read("count", repository::count);
    }

    /**
     * Records that have no vector, in id order, for the caller to re-embed.
     * Pass the last id of the previous page as {@code afterId} to continue;
     * null or blank starts from the beginning.
     */
    public List<PromptRecord> findWithoutEmbedding(String afterId, int limit) {
        int size = limit <= 0 ? SearchFilter.DEFAULT_LIMIT : Math.min(limit, SearchFilter.MAX_LIMIT);
        String from = afterId == null || afterId.isBlank() ? "" : afterId;
        return transactions.read("withoutEmbedding", () -> repository
                .findByEmbeddingDimensionsIsNullAndIdGreaterThanOrderByIdAsc(from, PageRequest.of(0, size))
                .stream()
                .map(PromptRecord::from)
                .toList());
    }

    // ── Update ───────────────────────────────────────────────────────────────

    public PromptRecord update(String id, PromptUpdate in) {
        if (in == null) throw StoreException.invalid("update must not be null");
        if (in.content() != null) requireText(in.content(), "content");
        checkTemperature(in.temperature());
        checkTokens(in.maxTokens(), "max_tokens");
        checkTokens(in.actualTokens(), "actual_tokens");
        checkGenerationMetadata(in.inputTokens(), in.outputTokens(), in.processingTimeMs(), in.cost());
        boolean clear = Boolean.TRUE.equals(in.clearEmbedding());
        if (clear && in.embedding() != null) {
            throw StoreException.invalid("clear_embedding and embedding are mutually exclusive");
        }
        if (in.embedding() != null) {
            checkEmbedding(in.embedding(), in.embeddingModel(), in.embeddingDimensions());
        }

        PromptRecord updated = transactions.write("update", () -> {
            PromptCandidate candidate = repository.findById(id)
                    .orElseThrow(() -> StoreException.notFound("prompt", id));

            if (in.content()          != null) candidate.setContent(in.content());
            if (in.temperature()      != null) candidate.setTemperature(in.temperature());
            if (in.maxTokens()        != null) candidate.setMaxTokens(in.maxTokens());
            if (in.actualTokens()     != null) candidate.setActualTokens(in.actualTokens());
            if (in.inputTokens()      != null) candidate.setInputTokens(in.inputTokens());
            if (in.outputTokens()     != null) candidate.setOutputTokens(in.outputTokens());
            if (in.processingTimeMs() != null) candidate.setProcessingTimeMs(in.processingTimeMs());
            if (in.cost()             != null) candidate.setCost(in.cost());
            if (in.tags() != null) {
                candidate.getTags().clear();
                candidate.getTags().addAll(normalizeTags(in.tags()));
            }
            if (clear) {
                candidate.clearEmbedding();
            } else if (in.embedding() != null) {
                applyEmbedding(candidate, in.embedding(), in.embeddingModel(), in.embeddingProvider());
            }
            candidate.setUpdateTime(LocalDateTime.now(clock));
            return PromptRecord.from(repository.saveAndFlush(candidate));
        });
        log.info("[Store] Updated prompt {}", id);
        return updated;
    }

    /** Bumps the usage counter and stamps the time of use. */
    public PromptRecord recordUsage(String id) {
        return transactions.write("recordUsage", () -> {
            PromptCandidate candidate = repository.findById(id)
                    .orElseThrow(() -> StoreException.notFound("prompt", id));
            LocalDateTime now = LocalDateTime.now(clock);
            candidate.setUsageCount(candidate.getUsageCount() + 1);
            candidate.setLastUsedAt(now);
            candidate.setUpdateTime(now);
            PromptRecord record = PromptRecord.from(repository.saveAndFlush(candidate));
            log.debug("[Store] Usage of {} now {}", id, record.usageCount());
            return record;
        });
    }

    // ── Delete ───────────────────────────────────────────────────────────────

    /** Removes the record and every edge that touches it. */
    public void delete(String id) {
        int edges = transactions.write("delete", () -> {
            if (id == null || !repository.existsById(id)) {
                throw StoreException.notFound("prompt", id);
            }
            int removed = relationships.removeForRecord(id);
            repository.deleteById(id);
            repository.flush();
            return removed;
        });
        log.info("[Store] Deleted prompt {} ({} relationship(s) removed)", id, edges);
    }

    /** Built fresh per attempt: a retried transaction must not reuse an entity from a rolled-back one. */
    private static PromptCandidate newCandidate(NewPrompt in) {
        PromptCandidate candidate = PromptCandidate.builder()
                .id(UUID.randomUUID().toString())
                .content(in.content())
                .phase(in.phase())
                .provider(in.provider().trim())
                .model(in.model().trim())
                .sourceType(in.sourceType())
                .inputTokens(in.inputTokens())
                .outputTokens(in.outputTokens())
                .processingTimeMs(in.processingTimeMs())
                .cost(in.cost())
                .tags(normalizeTags(in.tags()))
                .build();
        if (in.temperature()    != null) candidate.setTemperature(in.temperature());
        if (in.maxTokens()      != null) candidate.setMaxTokens(in.maxTokens());
        if (in.actualTokens()   != null) candidate.setActualTokens(in.actualTokens());
        if (in.relevanceScore() != null) candidate.setRelevanceScore(in.relevanceScore());
        if (in.embedding() != null) {
            applyEmbedding(candidate, in.embedding(), in.embeddingModel(), in.embeddingProvider());
        }
        return candidate;
    }

    // ── Validation ───────────────────────────────────────────────────────────

    private void checkEmbedding(float[] vector, String model, Integer dimensions) {
        if (vector.length == 0) throw StoreException.invalid("embedding must not be empty");
        if (model == null || model.isBlank()) {
            throw StoreException.invalid("embedding_model is required when an embedding is supplied");
        }
        if (dimensions == null || dimensions <= 0) {
            throw StoreException.invalid("embedding_dimensions must be positive when an embedding is supplied");
        }
        if (vector.length > properties.maxQueryDimensions()) {
            throw StoreException.invalid("embedding has %d dimensions, maximum is %d"
                    .formatted(vector.length, properties.maxQueryDimensions()));
        }
        if (vector.length != dimensions) {
            throw new StoreException(StoreErrorKind.CONFLICT,
                    "embedding length %d does not match embedding_dimensions %d".formatted(vector.length, dimensions));
        }
        for (float f : vector) {
            if (!Float.isFinite(f)) throw StoreException.invalid("embedding contains a non-finite component");
        }
    }

    private static void applyEmbedding(PromptCandidate candidate, float[] vector, String model, String provider) {
        candidate.setEmbedding(vector.clone());
        candidate.setEmbeddingModel(model.trim());
        candidate.setEmbeddingDimensions(vector.length);
        candidate.setEmbeddingProvider(provider == null || provider.isBlank() ? null : provider.trim());
    }

    private static void requireText(String value, String field) {
        if (value == null || value.isBlank()) throw StoreException.invalid(field + " must not be blank");
    }

    private static void checkTemperature(Double temperature) {
        if (temperature != null && !(temperature >= 0.0 && temperature <= 2.0)) {
            throw StoreException.invalid("temperature must be within [0, 2], got " + temperature);
        }
    }

    private static void checkTokens(Integer tokens, String field) {
        if (tokens != null && tokens < 0) throw StoreException.invalid(field + " must not be negative");
    }

    private static void checkGenerationMetadata(Integer inputTokens, Integer outputTokens,
                                                Long processingTimeMs, Double cost) {
        checkTokens(inputTokens, "input_tokens");
        checkTokens(outputTokens, "output_tokens");
        if (processingTimeMs != null && processingTimeMs < 0) {
            throw StoreException.invalid("processing_time_ms must not be negative");
        }
        if (cost != null && !(Double.isFinite(cost) && cost >= 0.0)) {
            throw StoreException.invalid("cost must be a non-negative number, got " + cost);
        }
    }

    static Set<String> normalizeTags(Set<String> tags) {
        Set<String> out = new LinkedHashSet<>();
        if (tags == null) return out;
        for (String t : tags) {
            if (t != null && !t.isBlank()) out.add(t.trim());
        }
        return out;
    }
}
