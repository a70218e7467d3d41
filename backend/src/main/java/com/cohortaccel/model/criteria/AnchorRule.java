package com.cohortaccel.model.criteria;

import com.cohortaccel.model.enums.AnchorKind;

import java.time.LocalDate;

/**
 * Named rule deriving a per-subject reference date.
 * FIRST_QUALIFYING_EVENT anchors on the earliest event matching {@code predicateId}'s codes.
 */
public record AnchorRule(
    String name,
    AnchorKind kind,
    String description,
    String predicateId,
    LocalDate fixedDate
) {
    public AnchorRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Anchor rule requires a name");
        }
        if (kind == null) {
            kind = AnchorKind.ENROLLMENT_START;
        }
        if (kind == AnchorKind.FIRST_QUALIFYING_EVENT && (predicateId == null || predicateId.isBlank())) {
            throw new IllegalArgumentException("Anchor '" + name + "' needs the predicate whose first event it uses");
        }
        if (kind == AnchorKind.FIXED_DATE && fixedDate == null) {
            throw new IllegalArgumentException("Anchor '" + name + "' needs a fixed date");
        }
    }

    public static AnchorRule enrollmentStart(String name) {
        return new AnchorRule(name, AnchorKind.ENROLLMENT_START, "Enrollment start date", null, null);
    }

    public static AnchorRule firstQualifyingEvent(String name, String predicateId) {
        return new AnchorRule(name, AnchorKind.FIRST_QUALIFYING_EVENT,
            "First qualifying event of " + predicateId, predicateId, null);
    }
}
