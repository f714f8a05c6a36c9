package com.openforge.alchemy.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;
import java.util.stream.Collectors;

/** Closed set of edge kinds between two candidates. */
public enum RelationshipType {

    DERIVED_FROM,
    SIMILAR_TO,
    INSPIRED_BY,
    MERGED_WITH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Accepts {@code derived_from}, {@code derived-from} or {@code DERIVED_FROM}.
     *
     * @throws IllegalArgumentException for anything outside the enumeration
     */
    @JsonCreator
    public static RelationshipType fromValue(String raw) {
        if (raw != null) {
            String normalized = raw.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            for (RelationshipType t : values()) {
                if (t.name().equals(normalized)) return t;
            }
        }
        throw new IllegalArgumentException("invalid relationship_type '%s'. Must be one of: %s"
                .formatted(raw, Arrays.stream(values()).map(RelationshipType::value).collect(Collectors.joining(", "))));
    }

    @Override
    public String toString() {
        return value();
    }
}
