package com.openforge.alchemy.prompt;

import com.openforge.alchemy.domain.Phase;
import com.openforge.alchemy.domain.PromptCandidate;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Read-side snapshot of a candidate; detached from the persistence context,
 * safe to hand to any caller.
 */
public record PromptRecord(
        String        id,
        String        content,
        Phase         phase,
        String        provider,
        String        model,
        double        temperature,
        int           maxTokens,
        int           actualTokens,
        Integer       inputTokens,
        Integer       outputTokens,
        Long          processingTimeMs,
        Double        cost,
        List<String>  tags,
        float[]       embedding,
        String        embeddingModel,
        String        embeddingProvider,
        Integer       embeddingDimensions,
        double        relevanceScore,
        int           usageCount,
        LocalDateTime lastUsedAt,
        String        sourceType,
        LocalDateTime createdAt,
        LocalDateTime updatedAt
) {

    public static PromptRecord from(PromptCandidate c) {
        return new PromptRecord(
                c.getId(),
                c.getContent(),
                c.getPhase(),
                c.getProvider(),
                c.getModel(),
                c.getTemperature(),
                c.getMaxTokens(),
                c.getActualTokens(),
                c.getInputTokens(),
                c.getOutputTokens(),
                c.getProcessingTimeMs(),
                c.getCost(),
                c.getTags().stream().sorted().toList(),
                c.getEmbedding() == null ? null : c.getEmbedding().clone(),
                c.getEmbeddingModel(),
                c.getEmbeddingProvider(),
                c.getEmbeddingDimensions(),
                c.getRelevanceScore(),
                c.getUsageCount(),
                c.getLastUsedAt(),
                c.getSourceType(),
                c.getCreateTime(),
                c.getUpdateTime()
        );
    }

    public boolean hasEmbedding() {
        return embedding != null;
    }
}
