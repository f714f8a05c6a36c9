package com.openforge.alchemy.stats;

import com.openforge.alchemy.domain.Phase;
import com.openforge.alchemy.domain.RelationshipType;
import com.openforge.alchemy.migration.EmbeddingStats;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * @param totalCost               sum of reported generation costs; records without one count as 0
 * @param averageProcessingTimeMs over records that reported a time; null when none did
 */
public record StoreStatistics(
        long                          totalPrompts,
        long                          promptsWithEmbeddings,
        double                        embeddingCoveragePercent,
        double                        averageRelevance,
        long                          totalInputTokens,
        long                          totalOutputTokens,
        double                        totalCost,
        Double                        averageProcessingTimeMs,
        Map<Phase, Long>              byPhase,
        Map<String, Long>             byProvider,
        long                          totalRelationships,
        Map<RelationshipType, Long>   relationshipsByType,
        EmbeddingStats                embeddings,
        Map<String, String>           config,
        int                           schemaVersion,
        LocalDateTime                 collectedAt
) {}
