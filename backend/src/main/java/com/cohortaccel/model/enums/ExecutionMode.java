package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionMode {
    COUNT("count"),
    PREVIEW("preview");

    private final String value;

    ExecutionMode(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
