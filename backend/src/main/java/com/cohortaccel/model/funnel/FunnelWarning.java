package com.cohortaccel.model.funnel;

import com.cohortaccel.model.enums.FunnelWarningKind;

/**
 * Non-fatal flag attached to a result. {@code predicateId} is the step that
 * triggered it, or "final" for cohort-level flags.
 */
public record FunnelWarning(
    FunnelWarningKind kind,
    String predicateId,
    String message
) {}
