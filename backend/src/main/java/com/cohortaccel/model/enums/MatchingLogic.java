package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How resolved code values are matched against source code columns.
 */
public enum MatchingLogic {
    EXACT("exact"),
    WILDCARD("wildcard"),
    HIERARCHY("hierarchy"),
    INGREDIENT("ingredient");

    private final String value;

    MatchingLogic(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static MatchingLogic fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (MatchingLogic logic : values()) {
            if (logic.value.equalsIgnoreCase(value)) {
                return logic;
            }
        }
        throw new IllegalArgumentException("Unknown MatchingLogic: " + value);
    }
}
