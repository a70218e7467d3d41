package com.cohortaccel.model.enums;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Terminologies a concept can be resolved into.
 * LOCAL covers dataset-specific values (e.g. gender codes on the person table).
 */
public enum CodeSystem {
    ICD10CM("ICD10CM", "http://hl7.org/fhir/sid/icd-10-cm"),
    ICD9CM("ICD9CM", "http://hl7.org/fhir/sid/icd-9-cm"),
    CPT("CPT", "http://www.ama-assn.org/go/cpt"),
    HCPCS("HCPCS", "https://www.cms.gov/Medicare/Coding/HCPCSReleaseCodeSets"),
    NDC("NDC", "http://hl7.org/fhir/sid/ndc"),
    RXNORM("RxNorm", "http://www.nlm.nih.gov/research/umls/rxnorm"),
    LOINC("LOINC", "http://loinc.org"),
    SNOMED("SNOMED", "http://snomed.info/sct"),
    LOCAL("local", null);

    private final String code;
    private final String uri;

    CodeSystem(String code, String uri) {
        this.code = code;
        this.uri = uri;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    public String getUri() {
        return uri;
    }

    public static CodeSystem fromCode(String code) {
        if (code == null) {
            return null;
        }
        for (CodeSystem system : values()) {
            if (system.code.equalsIgnoreCase(code)) {
                return system;
            }
        }
        throw new IllegalArgumentException("Unknown CodeSystem: " + code);
    }
}
