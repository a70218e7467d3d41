package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Non-fatal conditions flagged on an otherwise successful execution or funnel.
 */
public enum FunnelWarningKind {
    EMPTY_COHORT("empty_cohort"),
    SUSPICIOUS_DROP("suspicious_drop"),
    HUGE_COHORT("huge_cohort");

    private final String value;

    FunnelWarningKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
