package com.openforge.alchemy.store;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * Store-level settings.
 *
 * application.yml:
 *
 * alchemy:
 *   store:
 *     path: ./data/prompts.db
 *     max-query-dimensions: 8192
 *     scan-page-size: 500
 *     lifecycle:
 *       max-prompts: 1000
 *       min-relevance-score: 0.3
 *       protect-relevance-score: 0.8
 *       half-life-days: 30
 *       usage-weight: 0.3
 *       usage-saturation: 5
 *       cleanup-headroom: 0
 *
 * The lifecycle block only seeds the persisted config table on first start;
 * once a key exists in the table, the table wins.
 */
@ConfigurationProperties(prefix = "alchemy.store")
public record StoreProperties(
        @DefaultValue("./data/prompts.db") String path,
        @DefaultValue("8192")              int    maxQueryDimensions,
        @DefaultValue("500")               int    scanPageSize,
        @DefaultValue                      Lifecycle lifecycle
) {

    public record Lifecycle(
            @DefaultValue("1000") int    maxPrompts,
            @DefaultValue("0.3")  double minRelevanceScore,
            @DefaultValue("0.8")  double protectRelevanceScore,
            @DefaultValue("30")   double halfLifeDays,
            @DefaultValue("0.3")  double usageWeight,
            @DefaultValue("5")    double usageSaturation,
            @DefaultValue("0")    int    cleanupHeadroom
    ) {}
}
