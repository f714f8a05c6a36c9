package com.openforge.alchemy.domain;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * One generated text candidate together with its metadata and optional
 * semantic vector.
 *
 * Key design notes:
 *
 *  embedding            packed float32 BLOB; null means "not embedded yet".
 *                       Whenever it is non-null, embeddingModel and
 *                       embeddingDimensions describe it and
 *                       embeddingDimensions == embedding.length. When it is
 *                       null all three embedding columns are null too.
 *
 *  relevanceScore       bounded to [0, 1]. Seeded at creation, afterwards
 *                       rewritten only by the lifecycle decay pass; drives
 *                       eviction order.
 *
 *  usageCount           only ever incremented.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(name = "prompts")
public class PromptCandidate extends BaseEntity {

    /** UUID assigned by the store on create. */
    @Id
    @Column(name = "id", nullable = false, updatable = false, length = 36)
    private String id;

    @Column(name = "content", nullable = false, columnDefinition = "TEXT")
    private String content;

    @Convert(converter = EnumColumnConverters.PhaseConverter.class)
    @Column(name = "phase", nullable = false, length = 32)
    private Phase phase;

    /** openai | anthropic | google | ollama | openrouter | grok … */
    @Column(name = "provider", nullable = false, length = 64)
    private String provider;

    @Column(name = "model", nullable = false, length = 128)
    private String model;

    @Builder.Default
    @Column(name = "temperature", nullable = false)
    private double temperature = 0.7;

    @Builder.Default
    @Column(name = "max_tokens", nullable = false)
    private int maxTokens = 2000;

    @Builder.Default
    @Column(name = "actual_tokens", nullable = false)
    private int actualTokens = 0;

    @Column(name = "input_tokens")
    private Integer inputTokens;

    @Column(name = "output_tokens")
    private Integer outputTokens;

    /** Wall-clock time the provider took to produce the content. */
    @Column(name = "processing_time_ms")
    private Long processingTimeMs;

    /** Provider-reported cost of the generation call, in USD. */
    @Column(name = "cost")
    private Double cost;

    /** generated | optimized | manual | derived */
    @Column(name = "source_type", length = 32)
    private String sourceType;

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "prompt_tags", joinColumns = @JoinColumn(name = "prompt_id"))
    @Column(name = "tag", nullable = false, length = 128)
    private Set<String> tags = new LinkedHashSet<>();

    @Convert(converter = EmbeddingConverter.class)
    @Column(name = "embedding", columnDefinition = "BLOB")
    private float[] embedding;

    @Column(name = "embedding_model", length = 128)
    private String embeddingModel;

    @Column(name = "embedding_provider", length = 64)
    private String embeddingProvider;

    @Column(name = "embedding_dimensions")
    private Integer embeddingDimensions;

    @Builder.Default
    @Column(name = "relevance_score", nullable = false)
    private double relevanceScore = 1.0;

    @Builder.Default
    @Column(name = "usage_count", nullable = false)
    private int usageCount = 0;

    @Column(name = "last_used_at")
    private LocalDateTime lastUsedAt;

    public boolean hasEmbedding() {
        return embedding != null;
    }

    /** Drops the vector and everything describing it. */
    public void clearEmbedding() {
        this.embedding = null;
        this.embeddingModel = null;
        this.embeddingProvider = null;
        this.embeddingDimensions = null;
    }
}
