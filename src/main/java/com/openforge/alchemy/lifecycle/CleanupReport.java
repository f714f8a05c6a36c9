package com.openforge.alchemy.lifecycle;

/**
 * Outcome of one capacity cleanup.
 *
 * @param countBefore      records present when the run started
 * @param countAfter       records left (equal to countBefore on a dry run)
 * @param maxPrompts       ceiling that triggers eviction
 * @param minRelevance     records below this are counted in {@code belowFloor}
 * @param protectThreshold records at or above this are never evicted
 * @param targetCount      ceiling minus headroom; eviction stops here
 * @param deleted          evicted records, or those that would be on a dry run
 * @param belowFloor       how many of {@code deleted} scored under minRelevance
 * @param ceilingReached   whether countBefore exceeded maxPrompts
 */
public record CleanupReport(
        boolean dryRun,
        long    countBefore,
        long    countAfter,
        int     maxPrompts,
        double  minRelevance,
        double  protectThreshold,
        long    targetCount,
        int     deleted,
        int     belowFloor,
        boolean ceilingReached
) {}
