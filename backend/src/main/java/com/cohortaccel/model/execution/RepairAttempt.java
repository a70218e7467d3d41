package com.cohortaccel.model.execution;

import com.cohortaccel.model.enums.ExecutionErrorKind;
import com.cohortaccel.model.plan.PlanDiff;

import java.util.List;

/**
 * Audit record of one recompile-and-retry attempt.
 */
public record RepairAttempt(
    int attempt,
    ExecutionErrorKind errorKind,
    String errorMessage,
    List<String> failingPredicateIds,
    PlanDiff diff
) {
    public RepairAttempt {
        failingPredicateIds = failingPredicateIds == null ? List.of() : List.copyOf(failingPredicateIds);
    }
}
