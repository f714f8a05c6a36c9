package com.openforge.alchemy.search;

import com.openforge.alchemy.prompt.PromptRecord;

import java.util.List;

/**
 * Parallel lists: {@code similarities.get(i)} is the cosine similarity of
 * {@code records.get(i)} to the query. Ordered by similarity, highest first.
 */
public record SemanticSearchResult(List<PromptRecord> records, List<Double> similarities) {

    public static SemanticSearchResult empty() {
        return new SemanticSearchResult(List.of(), List.of());
    }

    public int size() {
        return records.size();
    }
}
