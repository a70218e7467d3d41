package com.cohortaccel.model.criteria;

import com.cohortaccel.model.enums.CodeSystem;
import com.cohortaccel.model.enums.ConfidenceLevel;
import com.cohortaccel.model.enums.MatchingLogic;

import java.util.List;

/**
 * A secondary code mapping offered by the concept resolver, with its trade-offs.
 * Never compiled unless the caller explicitly promotes it to the primary resolution.
 */
public record AlternativeMapping(
    List<String> codeValues,
    CodeSystem codeSystem,
    MatchingLogic matchingLogic,
    String description,
    List<String> pros,
    List<String> cons,
    ConfidenceLevel confidence
) {
    public AlternativeMapping {
        codeValues = codeValues == null ? List.of() : List.copyOf(codeValues);
        pros = pros == null ? List.of() : List.copyOf(pros);
        cons = cons == null ? List.of() : List.copyOf(cons);
    }
}
