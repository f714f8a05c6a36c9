package com.openforge.alchemy.search;

import com.openforge.alchemy.domain.Phase;
import lombok.Builder;

import java.time.LocalDateTime;
import java.util.Set;

/**
 * Conjunction of optional predicates; a null (or empty) field does not
 * constrain the result.
 *
 * @param tags            matches records carrying at least one of these tags
 * @param createdAfter    inclusive lower bound on creation time
 * @param limit           {@code <= 0} means {@link #DEFAULT_LIMIT}; clamped to {@link #MAX_LIMIT}
 * @param contentContains case-insensitive substring of the content
 * @param minRelevance    inclusive lower bound on relevance score
 */
@Builder(toBuilder = true)
public record SearchFilter(
        Phase         phase,
        String        provider,
        String        model,
        Set<String>   tags,
        LocalDateTime createdAfter,
        int           limit,
        String        contentContains,
        Double        minRelevance
) {

    public static final int DEFAULT_LIMIT = 20;
    public static final int MAX_LIMIT     = 500;

    public static SearchFilter none() {
        return SearchFilter.builder().build();
    }

    public int effectiveLimit() {
        if (limit <= 0) return DEFAULT_LIMIT;
        return Math.min(limit, MAX_LIMIT);
    }
}
