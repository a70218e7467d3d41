package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How far a predicate can be enforced from real-world data.
 */
public enum Verifiability {
    RWD("rwd"),
    PARTIAL_RWD("partial_rwd"),
    NON_RWD("non_rwd");

    private final String value;

    Verifiability(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isQueryable() {
        return this != NON_RWD;
    }

    public static Verifiability fromValue(String value) {
        for (Verifiability v : values()) {
            if (v.value.equalsIgnoreCase(value)) {
                return v;
            }
        }
        throw new IllegalArgumentException("Unknown Verifiability: " + value);
    }
}
