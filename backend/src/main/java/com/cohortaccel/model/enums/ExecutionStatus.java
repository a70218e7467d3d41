package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum ExecutionStatus {
    OK("ok"),
    ERROR("error");

    private final String value;

    ExecutionStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
