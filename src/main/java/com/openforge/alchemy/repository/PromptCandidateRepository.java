package com.openforge.alchemy.repository;

import com.openforge.alchemy.domain.Phase;
import com.openforge.alchemy.domain.PromptCandidate;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface PromptCandidateRepository
        extends JpaRepository<PromptCandidate, String>, JpaSpecificationExecutor<PromptCandidate> {

    /** Keyset page over the whole table in stable id order. */
    List<PromptCandidate> findByIdGreaterThanOrderByIdAsc(String lastId, Pageable page);

    /** Eviction order: least relevant first, oldest first among equals. */
    List<PromptCandidate> findByRelevanceScoreLessThanOrderByRelevanceScoreAscCreateTimeAscIdAsc(
            double threshold, Pageable page);

    long countByEmbeddingDimensionsIsNotNull();

    /** Re-embedding queue: records without a vector, keyset-paged by id. */
    List<PromptCandidate> findByEmbeddingDimensionsIsNullAndIdGreaterThanOrderByIdAsc(String lastId, Pageable page);

    // ── Migration ────────────────────────────────────────────────────────────

    @Query("""
            select p from PromptCandidate p
            where p.id > :lastId
              and p.embeddingDimensions is not null
              and (p.embeddingModel <> :model or p.embeddingDimensions <> :dimensions)
            order by p.id asc""")
    List<PromptCandidate> findMismatchedEmbeddings(@Param("lastId") String lastId,
                                                   @Param("model") String model,
                                                   @Param("dimensions") int dimensions,
                                                   Pageable page);

    @Query("""
            select count(p) from PromptCandidate p
            where p.embeddingDimensions is not null
              and (p.embeddingModel <> :model or p.embeddingDimensions <> :dimensions)""")
    long countMismatchedEmbeddings(@Param("model") String model, @Param("dimensions") int dimensions);

    // ── Statistics ───────────────────────────────────────────────────────────

    interface EmbeddingShapeCount {
        String getModel();
        Integer getDimensions();
        Long getCount();
    }

    interface PhaseCount {
        Phase getPhase();
        Long getCount();
    }

    interface ProviderCount {
        String getProvider();
        Long getCount();
    }

    @Query("""
            select p.embeddingModel as model, p.embeddingDimensions as dimensions, count(p) as count
            from PromptCandidate p
            where p.embeddingDimensions is not null
            group by p.embeddingModel, p.embeddingDimensions
            order by count(p) desc, p.embeddingModel asc""")
    List<EmbeddingShapeCount> countByEmbeddingShape();

    @Query("select p.phase as phase, count(p) as count from PromptCandidate p group by p.phase")
    List<PhaseCount> countByPhase();

    @Query("""
            select p.provider as provider, count(p) as count
            from PromptCandidate p
            group by p.provider
            order by count(p) desc, p.provider asc""")
    List<ProviderCount> countByProvider();

    interface GenerationTotals {
        Long getInputTokens();
        Long getOutputTokens();
        Double getCost();
        Double getAverageProcessingTimeMs();
    }

    @Query("""
            select sum(p.inputTokens) as inputTokens, sum(p.outputTokens) as outputTokens,
                   sum(p.cost) as cost, avg(p.processingTimeMs) as averageProcessingTimeMs
            from PromptCandidate p""")
    GenerationTotals generationTotals();

    @Query("select avg(p.relevanceScore) from PromptCandidate p")
    Double averageRelevance();
}
