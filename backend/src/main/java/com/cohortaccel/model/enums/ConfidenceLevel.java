package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Confidence reported by the concept resolver for a code mapping.
 */
public enum ConfidenceLevel {
    HIGH("high", 3),
    MEDIUM("medium", 2),
    LOW("low", 1);

    private final String value;
    private final int rank;

    ConfidenceLevel(String value, int rank) {
        this.value = value;
        this.rank = rank;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isAtLeast(ConfidenceLevel other) {
        return other == null || rank >= other.rank;
    }

    public static ConfidenceLevel fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ConfidenceLevel level : values()) {
            if (level.value.equalsIgnoreCase(value)) {
                return level;
            }
        }
        throw new IllegalArgumentException("Unknown ConfidenceLevel: " + value);
    }
}
