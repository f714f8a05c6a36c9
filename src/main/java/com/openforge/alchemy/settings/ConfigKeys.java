package com.openforge.alchemy.settings;

/**
 * Names of the persisted policy keys in {@code store_config}.
 */
public final class ConfigKeys {

    private ConfigKeys() {}

    public static final String MAX_PROMPTS              = "max_prompts";
    public static final String MIN_RELEVANCE_SCORE      = "min_relevance_score";
    public static final String PROTECT_RELEVANCE_SCORE  = "protect_relevance_score";
    public static final String CLEANUP_HEADROOM         = "cleanup_headroom";

    public static final String RELEVANCE_HALF_LIFE_DAYS   = "relevance_half_life_days";
    public static final String RELEVANCE_USAGE_WEIGHT     = "relevance_usage_weight";
    public static final String RELEVANCE_USAGE_SATURATION = "relevance_usage_saturation";

    /** "model:dimensions" of an interrupted embedding migration. */
    public static final String MIGRATION_CHECKPOINT_TARGET  = "migration.checkpoint.target";
    /** Last record id fully processed by that migration. */
    public static final String MIGRATION_CHECKPOINT_LAST_ID = "migration.checkpoint.last_id";
}
