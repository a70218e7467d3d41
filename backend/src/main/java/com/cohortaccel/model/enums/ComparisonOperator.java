package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Comparison operators for value and count constraints.
 */
public enum ComparisonOperator {
    GREATER_OR_EQUAL(">="),
    LESS_OR_EQUAL("<="),
    GREATER(">"),
    LESS("<"),
    EQUAL("="),
    BETWEEN("between");

    private final String value;

    ComparisonOperator(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isRange() {
        return this == BETWEEN;
    }

    public static ComparisonOperator fromValue(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        for (ComparisonOperator op : values()) {
            if (op.value.equalsIgnoreCase(trimmed)) {
                return op;
            }
        }
        if ("==".equals(trimmed)) {
            return EQUAL;
        }
        throw new IllegalArgumentException("Unknown ComparisonOperator: " + value);
    }
}
