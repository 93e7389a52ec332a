package com.ideatrack.backend.domain;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import com.ideatrack.backend.error.ValidationException;

import java.util.Arrays;
import java.util.Locale;

/**
 * How a child idea improves on its parent.
 */
public enum RefinementType {
    CLARIFICATION,      // made the idea clearer
    TECHNICAL_DEPTH,    // added implementation details
    EXPANSION,          // broadened the scope
    PIVOT,              // changed direction
    VALIDATION,         // added evidence / research
    GENERAL_IMPROVEMENT;

    @JsonValue
    public String wire() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RefinementType from(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("refinementType is required");
        }
        String norm = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(t -> t.name().equals(norm))
                .findFirst()
                .orElseThrow(() -> new ValidationException(
                        "refinementType must be one of " + Arrays.toString(wireNames())));
    }

    private static String[] wireNames() {
        return Arrays.stream(values()).map(RefinementType::wire).toArray(String[]::new);
    }
}
