package com.openforge.alchemy.prompt;

import com.openforge.alchemy.domain.Phase;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.Builder;

import java.util.Set;

/**
 * Input for {@link PromptRecordService#create}. Nullable numeric fields fall
 * back to the column defaults (temperature 0.7, max tokens 2000, actual
 * tokens 0, relevance 1.0). Generation metadata (input/output tokens,
 * processing time, cost) stays null when not reported.
 */
@Builder
public record NewPrompt(
        @NotBlank String  content,
        @NotNull  Phase   phase,
        @NotBlank String  provider,
        @NotBlank String  model,
        Double            temperature,
        Integer           maxTokens,
        Integer           actualTokens,
        Integer           inputTokens,
        Integer           outputTokens,
        Long              processingTimeMs,
        Double            cost,
        Set<String>       tags,
        float[]           embedding,
        String            embeddingModel,
        String            embeddingProvider,
        Integer           embeddingDimensions,
        Double            relevanceScore,
        String            sourceType
) {}
