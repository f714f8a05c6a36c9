package com.openforge.alchemy.migration;

/**
 * @param resumedFrom last id of the interrupted run this one continued, or null
 * @param cleared     records whose vector was dropped (would be, on a dry run)
 * @param batches     committed batches; 0 on a dry run
 */
public record MigrationReport(
        String  targetModel,
        int     targetDimensions,
        int     batchSize,
        boolean dryRun,
        String  resumedFrom,
        long    cleared,
        int     batches
) {}
