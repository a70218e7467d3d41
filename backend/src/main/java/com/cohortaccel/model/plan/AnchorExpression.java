package com.cohortaccel.model.plan;

import com.cohortaccel.model.enums.AnchorKind;

/**
 * Compiled anchor CTE yielding one {@code (subject_id, anchor_date)} row per subject.
 */
public record AnchorExpression(
    String name,
    String cteName,
    AnchorKind kind,
    String body
) {}
