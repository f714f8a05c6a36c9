package com.openforge.alchemy.relationship;

import com.openforge.alchemy.domain.PromptRelationship;
import com.openforge.alchemy.domain.RelationshipType;
import com.openforge.alchemy.repository.PromptCandidateRepository;
import com.openforge.alchemy.repository.PromptRelationshipRepository;
import com.openforge.alchemy.store.StoreException;
import com.openforge.alchemy.store.StoreTransactions;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Directed, typed, weighted edges between candidate records.
 *
 * (source, target, type) is unique: relating the same triple again rewrites
 * strength and context in place rather than adding a parallel edge.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RelationshipService {

    public static final double DEFAULT_STRENGTH = 0.5;

    private final PromptRelationshipRepository relationships;
    private final PromptCandidateRepository    prompts;
    private final StoreTransactions            transactions;

    /**
     * @param strength null means {@link #DEFAULT_STRENGTH}
     */
    public RelationshipRecord addRelationship(String sourceId, String targetId, RelationshipType type,
                                              Double strength, String context) {
        if (sourceId == null || sourceId.isBlank() || targetId == null || targetId.isBlank()) {
            throw StoreException.invalid("source_id and target_id are required");
        }
        if (type == null) throw StoreException.invalid("relationship_type is required");
        if (sourceId.equals(targetId)) throw StoreException.invalid("a prompt cannot be related to itself: " + sourceId);
        double s = strength == null ? DEFAULT_STRENGTH : strength;
        if (!(s >= 0.0 && s <= 1.0)) throw StoreException.invalid("strength must be within [0, 1], got " + s);

        RelationshipRecord saved = transactions.write("relate", () -> {
            if (!prompts.existsById(sourceId)) throw StoreException.notFound("prompt", sourceId);
            if (!prompts.existsById(targetId)) throw StoreException.notFound("prompt", targetId);

            PromptRelationship edge = relationships
                    .findBySourceIdAndTargetIdAndRelationshipType(sourceId, targetId, type)
                    .orElseGet(() -> PromptRelationship.builder()
                            .sourceId(sourceId)
                            .targetId(targetId)
                            .relationshipType(type)
                            .build());
            edge.setStrength(s);
            edge.setContext(context);
            return RelationshipRecord.from(relationships.saveAndFlush(edge));
        });
        log.info("[Store] Related {} -[{} {}]-> {}", sourceId, type, s, targetId);
        return saved;
    }

    /** Overload accepting the wire spelling of the type ("derived_from", "similar-to" …). */
    public RelationshipRecord addRelationship(String sourceId, String targetId, String type,
                                              Double strength, String context) {
        RelationshipType parsed;
        try {
            parsed = RelationshipType.fromValue(type);
        } catch (IllegalArgumentException e) {
            throw StoreException.invalid(e.getMessage());
        }
        return addRelationship(sourceId, targetId, parsed, strength, context);
    }

    /**
     * Deletes every edge where {@code promptId} is source or target.
     * Joins the caller's transaction when there is one.
     */
    public int removeForRecord(String promptId) {
        return transactions.write("removeRelationships", () -> relationships.deleteTouching(promptId));
    }

    /** Edges where the record is either endpoint, newest first. */
    public List<RelationshipRecord> relationshipsOf(String promptId) {
        return transactions.read("relationshipsOf", () -> {
            if (!prompts.existsById(promptId)) throw StoreException.notFound("prompt", promptId);
            return relationships.findTouching(promptId).stream().map(RelationshipRecord::from).toList();
        });
    }

    /** Count per type; types without edges are reported as 0. */
    public Map<RelationshipType, Long> statsByType() {
        return transactions.read("relationshipStats", () -> {
            Map<RelationshipType, Long> out = new EnumMap<>(RelationshipType.class);
            for (RelationshipType t : RelationshipType.values()) out.put(t, 0L);
            relationships.countByType().forEach(c -> out.put(c.getType(), c.getCount()));
            return out;
        });
    }

    public long count() {
        return transactions.read("relationshipCount", relationships::count);
    }
}
