package com.openforge.alchemy.search;

import com.openforge.alchemy.domain.PromptCandidate;
import com.openforge.alchemy.prompt.PromptRecord;
import com.openforge.alchemy.repository.PromptCandidateRepository;
import com.openforge.alchemy.store.StoreException;
import com.openforge.alchemy.store.StoreProperties;
import com.openforge.alchemy.store.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

/**
 * Brute-force nearest-neighbour search over stored vectors.
 *
 * Flow:
 *   1. validate the query vector and threshold
 *   2. page through records with matching dimensionality + filter, in id order,
 *      one short read transaction per page (scan-page-size rows at a time)
 *   3. score each row by cosine similarity; keep the best {@code limit} in a
 *      min-heap so memory stays O(limit + page)
 *   4. emit survivors highest first; equal scores put the newer record first
 *
 * Records without a vector, or with a vector of another length, are never
 * compared.
 *
 * Results are not one snapshot: each page sees the latest commit, so writes
 * landing mid-scan may be reflected in later pages only.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SemanticSearchService {

    private final PromptCandidateRepository repository;
    private final StoreTransactions         transactions;
    private final StoreProperties           properties;

    private record Scored(PromptRecord record, double similarity) {}

    /** Best match first: higher similarity, then newer, then lower id. */
    private static final Comparator<Scored> BEST_FIRST = Comparator
            .comparingDouble(Scored::similarity).reversed()
            .thenComparing(s -> s.record().createdAt(), Comparator.nullsLast(Comparator.reverseOrder()))
            .thenComparing(s -> s.record().id());

    public SemanticSearchResult search(SemanticQuery query) {
        validate(query);
        float[] vector  = query.vector();
        SearchFilter filter = query.filter();
        int limit       = filter.effectiveLimit();
        int pageSize    = Math.max(1, properties.scanPageSize());

        Specification<PromptCandidate> base = SearchSpecifications.matching(filter)
                .and(SearchSpecifications.embeddedWith(vector.length));

        // Worst retained candidate sits on top so it can be evicted in O(log k).
        PriorityQueue<Scored> heap = new PriorityQueue<>(limit + 1, BEST_FIRST.reversed());
        String lastId  = null;
        int    scanned = 0;
        while (true) {
            Specification<PromptCandidate> page = base.and(SearchSpecifications.idAfter(lastId));
            List<PromptCandidate> rows = transactions.read("semanticSearch", () ->
                    repository.findAll(page, PageRequest.of(0, pageSize, Sort.by("id"))).getContent());
            if (rows.isEmpty()) break;

            for (PromptCandidate row : rows) {
                float[] stored = row.getEmbedding();
                if (stored == null || stored.length != vector.length) continue;
                double sim = VectorMath.cosine(vector, stored);
                if (sim < query.minSimilarity()) continue;

                Scored scored = new Scored(PromptRecord.from(row), sim);
                heap.offer(scored);
                if (heap.size() > limit) heap.poll();
            }
            scanned += rows.size();
            lastId = rows.get(rows.size() - 1).getId();
            if (rows.size() < pageSize) break;
        }

        List<Scored> ordered = new ArrayList<>(heap);
        ordered.sort(BEST_FIRST);
        List<PromptRecord> records = ordered.stream().map(Scored::record).toList();
        List<Double> similarities  = ordered.stream().map(Scored::similarity).toList();

        log.debug("[Search] semantic dims={} min={} scanned={} → {} result(s)",
                vector.length, query.minSimilarity(), scanned, records.size());
        return new SemanticSearchResult(records, similarities);
    }

    private void validate(SemanticQuery query) {
        if (query == null || query.vector() == null || query.vector().length == 0) {
            throw StoreException.invalid("query vector must not be empty");
        }
        if (query.vector().length > properties.maxQueryDimensions()) {
            throw StoreException.invalid("query vector has %d dimensions, maximum is %d"
                    .formatted(query.vector().length, properties.maxQueryDimensions()));
        }
        if (!VectorMath.allFinite(query.vector())) {
            throw StoreException.invalid("query vector contains NaN or infinite components");
        }
        double min = query.minSimilarity();
        if (!(min >= 0.0 && min <= 1.0)) {
            throw StoreException.invalid("min_similarity must be within [0, 1], got " + min);
        }
    }
}
