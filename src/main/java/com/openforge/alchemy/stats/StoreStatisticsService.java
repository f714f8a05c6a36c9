package com.openforge.alchemy.stats;

import com.openforge.alchemy.domain.Phase;
import com.openforge.alchemy.domain.RelationshipType;
import com.openforge.alchemy.migration.EmbeddingMigrationService;
import com.openforge.alchemy.migration.EmbeddingStats;
import com.openforge.alchemy.relationship.RelationshipService;
import com.openforge.alchemy.repository.PromptCandidateRepository;
import com.openforge.alchemy.settings.StoreConfigService;
import com.openforge.alchemy.store.SchemaManager;
import com.openforge.alchemy.store.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Store-wide counters, gathered inside one read transaction so the numbers
 * agree with each other.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class StoreStatisticsService {

    private final PromptCandidateRepository prompts;
    private final RelationshipService       relationships;
    private final EmbeddingMigrationService embeddings;
    private final StoreConfigService        config;
    private final SchemaManager             schema;
    private final StoreTransactions         transactions;
    private final Clock                     clock;

    public StoreStatistics collect() {
        StoreStatistics stats = transactions.read("statistics", () -> {
            EmbeddingStats embeddingStats = embeddings.getEmbeddingStats();

            Map<Phase, Long> byPhase = new EnumMap<>(Phase.class);
            for (Phase p : Phase.values()) byPhase.put(p, 0L);
            prompts.countByPhase().forEach(c -> byPhase.put(c.getPhase(), c.getCount()));

            Map<String, Long> byProvider = new LinkedHashMap<>();
            prompts.countByProvider().forEach(c -> byProvider.put(c.getProvider(), c.getCount()));

            Map<RelationshipType, Long> byType = relationships.statsByType();
            long totalRelationships = byType.values().stream().mapToLong(Long::longValue).sum();

            Double avg = prompts.averageRelevance();
            PromptCandidateRepository.GenerationTotals generation = prompts.generationTotals();
            return new StoreStatistics(
                    embeddingStats.total(),
                    embeddingStats.withEmbeddings(),
                    embeddingStats.coveragePercent(),
                    avg == null ? 0.0 : avg,
                    orZero(generation.getInputTokens()),
                    orZero(generation.getOutputTokens()),
                    generation.getCost() == null ? 0.0 : generation.getCost(),
                    generation.getAverageProcessingTimeMs(),
                    byPhase,
                    byProvider,
                    totalRelationships,
                    byType,
                    embeddingStats,
                    config.all(),
                    schema.currentVersion(),
                    LocalDateTime.now(clock));
        });
        log.debug("[Store] Statistics: {} prompt(s), {} relationship(s)", stats.totalPrompts(), stats.totalRelationships());
        return stats;
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
