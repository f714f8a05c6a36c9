package com.openforge.alchemy.migration;

import com.openforge.alchemy.domain.PromptCandidate;
import com.openforge.alchemy.repository.PromptCandidateRepository;
import com.openforge.alchemy.settings.ConfigKeys;
import com.openforge.alchemy.settings.StoreConfigService;
import com.openforge.alchemy.store.StoreException;
import com.openforge.alchemy.store.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Standardizes stored vectors on one embedding model and size.
 *
 * Vectors produced by any other (model, dimensions) pair are dropped so the
 * records can be re-embedded by the caller; nothing here generates vectors.
 *
 * Progress:
 *   - batches walk the mismatched records in id order (keyset on id)
 *   - each batch commits together with a checkpoint (target + last id) in the
 *     config table, so a crash loses at most the batch in flight
 *   - a later run for the same target resumes after the checkpoint, then
 *     sweeps once more from the lowest id to catch rows written below the
 *     checkpoint in the meantime; a run for a different target starts over
 *   - the checkpoint is deleted only once a sweep from the lowest id is done
 *
 * Re-running a completed migration is a no-op.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class EmbeddingMigrationService {

    public static final int DEFAULT_BATCH_SIZE = 10;
    public static final int MAX_BATCH_SIZE     = 1000;

    private final PromptCandidateRepository repository;
    private final StoreConfigService        config;
    private final StoreTransactions         transactions;

    private record BatchResult(int cleared, String lastId) {}

    private record Pass(long cleared, int batches) {}

    public MigrationReport migrate(String targetModel, int targetDimensions, int batchSize) {
        validate(targetModel, targetDimensions);
        String model = targetModel.trim();
        int batch = batchSize <= 0 ? DEFAULT_BATCH_SIZE : Math.min(batchSize, MAX_BATCH_SIZE);
        String target = model + ":" + targetDimensions;

        String resumedFrom = null;
        String checkpointTarget = config.getString(ConfigKeys.MIGRATION_CHECKPOINT_TARGET, null);
        if (target.equals(checkpointTarget)) {
            resumedFrom = config.getString(ConfigKeys.MIGRATION_CHECKPOINT_LAST_ID, null);
            log.info("[Migration] Resuming migration to {} after id {}", target, resumedFrom);
        } else if (checkpointTarget != null) {
            log.warn("[Migration] Discarding checkpoint of unfinished migration to {}", checkpointTarget);
        } else {
            log.info("[Migration] Migrating embeddings to {} (batch size {})", target, batch);
        }

        Pass pass = sweep(resumedFrom == null ? "" : resumedFrom, model, targetDimensions, batch, target);
        long cleared = pass.cleared();
        int batches = pass.batches();
        if (resumedFrom != null) {
            // rows below the checkpoint may have been written after the interruption
            Pass catchUp = sweep("", model, targetDimensions, batch, target);
            cleared += catchUp.cleared();
            batches += catchUp.batches();
            if (catchUp.cleared() > 0) {
                log.info("[Migration] Catch-up sweep below checkpoint {} cleared {} embedding(s)", resumedFrom, catchUp.cleared());
            }
        }

        transactions.execute("migrate.finish", () -> {
            config.remove(ConfigKeys.MIGRATION_CHECKPOINT_TARGET);
            config.remove(ConfigKeys.MIGRATION_CHECKPOINT_LAST_ID);
        });
        log.info("[Migration] Migration to {} complete: {} embedding(s) cleared in {} batch(es)", target, cleared, batches);
        return new MigrationReport(model, targetDimensions, batch, false, resumedFrom, cleared, batches);
    }

    /** Counts what {@link #migrate} would clear, without touching anything. */
    public MigrationReport preview(String targetModel, int targetDimensions) {
        validate(targetModel, targetDimensions);
        String model = targetModel.trim();
        long wouldClear = transactions.read("migrate.preview",
                () -> repository.countMismatchedEmbeddings(model, targetDimensions));
        log.info("[Migration] Dry run for {}:{} → {} embedding(s) would be cleared", model, targetDimensions, wouldClear);
        return new MigrationReport(model, targetDimensions, 0, true, null, wouldClear, 0);
    }

    public boolean needsMigration(String targetModel, int targetDimensions) {
        return preview(targetModel, targetDimensions).cleared() > 0;
    }

    public EmbeddingStats getEmbeddingStats() {
        return transactions.read("embeddingStats", () -> {
            long total = repository.count();
            long withEmbeddings = repository.countByEmbeddingDimensionsIsNotNull();
            double coverage = total == 0 ? 0.0 : withEmbeddings * 100.0 / total;
            List<EmbeddingStats.ModelCount> models = repository.countByEmbeddingShape().stream()
                    .map(s -> new EmbeddingStats.ModelCount(s.getModel(), s.getDimensions(), s.getCount()))
                    .toList();
            return new EmbeddingStats(total, withEmbeddings, coverage, models);
        });
    }

    /** One keyset walk over the mismatched rows with ids above {@code fromId}. */
    private Pass sweep(String fromId, String model, int dimensions, int batch, String target) {
        String lastId = fromId;
        long cleared = 0;
        int batches = 0;
        while (true) {
            String after = lastId;
            BatchResult result = transactions.write("migrate.batch", () -> clearBatch(after, model, dimensions, batch, target));
            if (result.cleared() == 0) break;
            cleared += result.cleared();
            batches++;
            lastId = result.lastId();
            log.debug("[Migration] Batch {} cleared {} record(s), checkpoint {}", batches, result.cleared(), lastId);
            if (result.cleared() < batch) break;
        }
        return new Pass(cleared, batches);
    }

    private BatchResult clearBatch(String afterId, String model, int dimensions, int batch, String target) {
        List<PromptCandidate> rows = repository.findMismatchedEmbeddings(afterId, model, dimensions, PageRequest.of(0, batch));
        if (rows.isEmpty()) return new BatchResult(0, afterId);

        rows.forEach(PromptCandidate::clearEmbedding);
        repository.saveAllAndFlush(rows);

        String lastId = rows.get(rows.size() - 1).getId();
        config.set(ConfigKeys.MIGRATION_CHECKPOINT_TARGET, target);
        config.set(ConfigKeys.MIGRATION_CHECKPOINT_LAST_ID, lastId);
        return new BatchResult(rows.size(), lastId);
    }

    private static void validate(String model, int dimensions) {
        if (model == null || model.isBlank()) throw StoreException.invalid("target model must not be blank");
        if (dimensions <= 0) throw StoreException.invalid("target dimensions must be positive, got " + dimensions);
    }
}
