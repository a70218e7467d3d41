package com.cohortaccel.model.criteria;

import com.cohortaccel.model.enums.GapKind;

/**
 * A predicate that is documented but not enforced by the query, or an
 * assumption the operator should review.
 */
public record Gap(
    String predicateId,
    GapKind kind,
    String issue,
    String proposedResolution,
    boolean requiresUserInput
) {
    public Gap {
        if (predicateId == null || predicateId.isBlank()) {
            throw new IllegalArgumentException("Gap requires a predicate id");
        }
        if (kind == null) {
            kind = GapKind.ASSUMPTION;
        }
    }
}
