package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Whether a predicate admits subjects into the cohort or removes them from it.
 */
public enum Polarity {
    INCLUSION("inclusion"),
    EXCLUSION("exclusion");

    private final String value;

    Polarity(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static Polarity fromValue(String value) {
        for (Polarity polarity : values()) {
            if (polarity.value.equalsIgnoreCase(value)) {
                return polarity;
            }
        }
        throw new IllegalArgumentException("Unknown Polarity: " + value);
    }
}
