package com.openforge.alchemy.domain;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Column mappings that keep the on-disk spelling of enums stable
 * ("prima-materia", "derived_from") regardless of Java constant names.
 */
public final class EnumColumnConverters {

    private EnumColumnConverters() {}

    @Converter
    public static class PhaseConverter implements AttributeConverter<Phase, String> {

        @Override
        public String convertToDatabaseColumn(Phase phase) {
            return phase == null ? null : phase.value();
        }

        @Override
        public Phase convertToEntityAttribute(String column) {
            return column == null ? null : Phase.fromValue(column);
        }
    }

    @Converter
    public static class RelationshipTypeConverter implements AttributeConverter<RelationshipType, String> {

        @Override
        public String convertToDatabaseColumn(RelationshipType type) {
            return type == null ? null : type.value();
        }

        @Override
        public RelationshipType convertToEntityAttribute(String column) {
            return column == null ? null : RelationshipType.fromValue(column);
        }
    }
}
