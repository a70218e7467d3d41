package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Clinical data domains a predicate can draw from.
 * Each domain maps onto one source table through the catalog.
 */
public enum ClinicalDomain {
    DEMOGRAPHIC("demographic", false),
    DIAGNOSIS("diagnosis", true),
    PROCEDURE("procedure", true),
    DRUG("drug", true),
    LAB("lab", true),
    ENROLLMENT("enrollment", false),
    OBSERVATION("observation", true);

    private final String value;
    private final boolean codeBased;

    ClinicalDomain(String value, boolean codeBased) {
        this.value = value;
        this.codeBased = codeBased;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * True when predicates in this domain select events by code and therefore
     * need a concept resolution before they can be compiled.
     */
    public boolean isCodeBased() {
        return codeBased;
    }

    public static ClinicalDomain fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (ClinicalDomain domain : values()) {
            if (domain.value.equalsIgnoreCase(value)) {
                return domain;
            }
        }
        throw new IllegalArgumentException("Unknown ClinicalDomain: " + value);
    }
}
