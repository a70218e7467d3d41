package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Derivation rules for an index date.
 */
public enum AnchorKind {
    ENROLLMENT_START("enrollment_start"),
    FIRST_QUALIFYING_EVENT("first_qualifying_event"),
    FIXED_DATE("fixed_date");

    private final String value;

    AnchorKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static AnchorKind fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (AnchorKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown AnchorKind: " + value);
    }
}
