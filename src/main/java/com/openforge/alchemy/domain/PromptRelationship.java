package com.openforge.alchemy.domain;

import jakarta.persistence.*;
import lombok.*;

/**
 * Directed, typed, weighted edge source → target between two candidates.
 *
 * Both endpoints reference prompts(id) with ON DELETE CASCADE; the record
 * delete path additionally sweeps edges explicitly inside its transaction,
 * so integrity does not depend on the connection having foreign keys enabled.
 */
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Entity
@Table(
    name = "prompt_relationships",
    uniqueConstraints = @UniqueConstraint(
            name = "uq_relationship",
            columnNames = {"source_id", "target_id", "relationship_type"})
)
public class PromptRelationship extends BaseEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_id", nullable = false, length = 36)
    private String sourceId;

    @Column(name = "target_id", nullable = false, length = 36)
    private String targetId;

    @Convert(converter = EnumColumnConverters.RelationshipTypeConverter.class)
    @Column(name = "relationship_type", nullable = false, length = 32)
    private RelationshipType relationshipType;

    /** 0.0 – 1.0 */
    @Builder.Default
    @Column(name = "strength", nullable = false)
    private double strength = 0.5;

    /** Free-text explanation of why the edge exists. */
    @Column(name = "context", columnDefinition = "TEXT")
    private String context;
}
