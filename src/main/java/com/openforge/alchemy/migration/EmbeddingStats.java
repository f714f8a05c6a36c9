package com.openforge.alchemy.migration;

import java.util.List;

/**
 * Snapshot of how the stored vectors are distributed across embedding models.
 *
 * @param coveragePercent share of records that carry a vector, 0–100
 * @param models          one entry per (model, dimensions) pair, most common first
 */
public record EmbeddingStats(long total, long withEmbeddings, double coveragePercent, List<ModelCount> models) {

    public record ModelCount(String model, int dimensions, long count) {}

    /** True when some stored vector was produced by anything other than the given model and size. */
    public boolean needsMigration(String model, int dimensions) {
        return models.stream().anyMatch(m -> !(m.model().equals(model) && m.dimensions() == dimensions));
    }
}
