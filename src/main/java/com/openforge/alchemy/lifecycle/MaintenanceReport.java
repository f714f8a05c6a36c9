package com.openforge.alchemy.lifecycle;

import java.time.LocalDateTime;

/**
 * @param relevanceUpdated records whose score changed; null when the step was skipped
 * @param cleanup          null when the step was skipped
 */
public record MaintenanceReport(
        boolean       dryRun,
        Integer       relevanceUpdated,
        CleanupReport cleanup,
        LocalDateTime startedAt,
        long          durationMs
) {}
