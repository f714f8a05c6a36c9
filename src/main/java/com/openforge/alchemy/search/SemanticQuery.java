package com.openforge.alchemy.search;

/**
 * @param vector        query embedding; only records whose stored vector has
 *                      the same number of dimensions are compared
 * @param minSimilarity inclusive cosine threshold in [0, 1]
 * @param filter        metadata predicates and result limit; null means none
 */
public record SemanticQuery(float[] vector, double minSimilarity, SearchFilter filter) {

    public SemanticQuery {
        if (filter == null) filter = SearchFilter.none();
    }
}
