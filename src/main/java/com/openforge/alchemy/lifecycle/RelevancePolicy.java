package com.openforge.alchemy.lifecycle;

import java.time.Duration;
import java.time.LocalDateTime;

/**
 * Relevance of a record as a blend of recency and usage:
 *
 *   recency = 2^(-ageDays / halfLifeDays)      1 when new, halves every half-life
 *   usage   = u / (u + saturation)             0 when unused, → 1 as u grows
 *   score   = (1 - w) · recency + w · usage    clamped to [0, 1]
 *
 * Non-increasing in age, non-decreasing in usage count.
 */
public record RelevancePolicy(double halfLifeDays, double usageWeight, double usageSaturation) {

    public static final double DEFAULT_HALF_LIFE_DAYS   = 30;
    public static final double DEFAULT_USAGE_WEIGHT     = 0.3;
    public static final double DEFAULT_USAGE_SATURATION = 5;

    private static final double MILLIS_PER_DAY = 86_400_000d;

    public RelevancePolicy {
        if (!(halfLifeDays > 0) || !Double.isFinite(halfLifeDays)) halfLifeDays = DEFAULT_HALF_LIFE_DAYS;
        if (!(usageWeight >= 0 && usageWeight <= 1)) usageWeight = DEFAULT_USAGE_WEIGHT;
        if (!(usageSaturation > 0) || !Double.isFinite(usageSaturation)) usageSaturation = DEFAULT_USAGE_SATURATION;
    }

    public static RelevancePolicy defaults() {
        return new RelevancePolicy(DEFAULT_HALF_LIFE_DAYS, DEFAULT_USAGE_WEIGHT, DEFAULT_USAGE_SATURATION);
    }

    public double score(LocalDateTime createdAt, int usageCount, LocalDateTime now) {
        double ageDays = createdAt == null ? 0 : Math.max(0, Duration.between(createdAt, now).toMillis() / MILLIS_PER_DAY);
        double recency = Math.pow(2, -ageDays / halfLifeDays);
        int u = Math.max(0, usageCount);
        double usage = u / (u + usageSaturation);
        double score = (1 - usageWeight) * recency + usageWeight * usage;
        return Math.max(0.0, Math.min(1.0, score));
    }
}
