package com.openforge.alchemy.lifecycle;

/**
 * @param updateRelevance recompute every record's relevance score first
 * @param cleanup         then evict down to capacity
 * @param dryRun          report what would change, write nothing
 */
public record MaintenanceOptions(boolean updateRelevance, boolean cleanup, boolean dryRun) {

    public static MaintenanceOptions full() {
        return new MaintenanceOptions(true, true, false);
    }

    public static MaintenanceOptions preview() {
        return new MaintenanceOptions(true, true, true);
    }
}
