package com.openforge.alchemy.repository;

import com.openforge.alchemy.domain.PromptRelationship;
import com.openforge.alchemy.domain.RelationshipType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface PromptRelationshipRepository extends JpaRepository<PromptRelationship, Long> {

    Optional<PromptRelationship> findBySourceIdAndTargetIdAndRelationshipType(
            String sourceId, String targetId, RelationshipType relationshipType);

    @Query("""
            select r from PromptRelationship r
            where r.sourceId = :promptId or r.targetId = :promptId
            order by r.createTime desc, r.id desc""")
    List<PromptRelationship> findTouching(@Param("promptId") String promptId);

    @Modifying(flushAutomatically = true)
    @Query("delete from PromptRelationship r where r.sourceId = :promptId or r.targetId = :promptId")
    int deleteTouching(@Param("promptId") String promptId);

    interface TypeCount {
        RelationshipType getType();
        Long getCount();
    }

    @Query("select r.relationshipType as type, count(r) as count from PromptRelationship r group by r.relationshipType")
    List<TypeCount> countByType();
}
