package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Classification of a failed query execution.
 * Repairable kinds are eligible for the bounded recompile-and-retry loop.
 */
public enum ExecutionErrorKind {
    SYNTAX_ERROR("syntax_error", true),
    SCHEMA_ERROR("schema_error", true),
    TIMEOUT("timeout", true),
    SAFETY_VIOLATION("safety_violation", false),
    DATABASE_ERROR("database_error", false);

    private final String value;
    private final boolean repairable;

    ExecutionErrorKind(String value, boolean repairable) {
        this.value = value;
        this.repairable = repairable;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isRepairable() {
        return repairable;
    }
}
