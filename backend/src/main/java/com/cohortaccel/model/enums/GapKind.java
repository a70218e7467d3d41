package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Reasons a predicate is carried as documentation instead of as a query fragment.
 */
public enum GapKind {
    UNRESOLVED_CONCEPT("unresolved_concept", true),
    RESOLUTION_TIMEOUT("resolution_timeout", true),
    NON_RWD("non_rwd", true),
    NEEDS_DEFINITION("needs_definition", true),
    MISSING_CATALOG_DATA("missing_catalog_data", true),
    ASSUMPTION("assumption", false);

    private final String value;
    private final boolean skipsCompilation;

    GapKind(String value, boolean skipsCompilation) {
        this.value = value;
        this.skipsCompilation = skipsCompilation;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean skipsCompilation() {
        return skipsCompilation;
    }

    public static GapKind fromValue(String value) {
        if (value == null) {
            return ASSUMPTION;
        }
        for (GapKind kind : values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown GapKind: " + value);
    }
}
