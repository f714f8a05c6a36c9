package com.openforge.alchemy.relationship;

import com.openforge.alchemy.domain.PromptRelationship;
import com.openforge.alchemy.domain.RelationshipType;

import java.time.LocalDateTime;

public record RelationshipRecord(
        Long             id,
        String           sourceId,
        String           targetId,
        RelationshipType type,
        double           strength,
        String           context,
        LocalDateTime    createdAt,
        LocalDateTime    updatedAt
) {

    public static RelationshipRecord from(PromptRelationship r) {
        return new RelationshipRecord(r.getId(), r.getSourceId(), r.getTargetId(), r.getRelationshipType(),
                r.getStrength(), r.getContext(), r.getCreateTime(), r.getUpdateTime());
    }
}
