package com.openforge.alchemy.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Pipeline stage that produced a candidate.
 *
 * PRIMA_MATERIA raw idea, first draft
 * SOLUTIO       dissolved into natural, human wording
 * COAGULATIO    crystallized into its precise final form
 *
 * The older names idea / human / precision are still accepted on input.
 */
public enum Phase {

    PRIMA_MATERIA("prima-materia", "idea"),
    SOLUTIO("solutio", "human"),
    COAGULATIO("coagulatio", "precision");

    private final String value;
    private final String legacyName;

    Phase(String value, String legacyName) {
        this.value = value;
        this.legacyName = legacyName;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * @throws IllegalArgumentException for an unknown name
     */
    @JsonCreator
    public static Phase fromValue(String raw) {
        if (raw == null) {
            throw new IllegalArgumentException("phase must not be null");
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        for (Phase p : values()) {
            if (p.value.equals(normalized) || p.legacyName.equals(normalized)) {
                return p;
            }
        }
        throw new IllegalArgumentException("unknown phase: " + raw);
    }

    @Override
    public String toString() {
        return value;
    }
}
