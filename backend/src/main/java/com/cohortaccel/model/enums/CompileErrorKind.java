package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

public enum CompileErrorKind {
    MISSING_CATALOG_MAPPING("missing_catalog_mapping"),
    UNRESOLVED_REQUIRED_PREDICATE("unresolved_required_predicate"),
    INVALID_TEMPORAL_REFERENCE("invalid_temporal_reference");

    private final String value;

    CompileErrorKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
