package com.openforge.alchemy.prompt;

import lombok.Builder;

import java.util.Set;

/**
 * Partial update: null means "leave unchanged". A non-null {@code embedding}
 * replaces the whole embedding triple and is validated like on create;
 * {@code clearEmbedding} drops it instead.
 */
@Builder
public record PromptUpdate(
        String      content,
        Set<String> tags,
        Double      temperature,
        Integer     maxTokens,
        Integer     actualTokens,
        Integer     inputTokens,
        Integer     outputTokens,
        Long        processingTimeMs,
        Double      cost,
        float[]     embedding,
        String      embeddingModel,
        String      embeddingProvider,
        Integer     embeddingDimensions,
        Boolean     clearEmbedding
) {}
