package com.cohortaccel.service.pipeline;

import com.cohortaccel.model.criteria.CriteriaSet;
import com.cohortaccel.model.criteria.Gap;
import com.cohortaccel.model.enums.PipelineStage;
import com.cohortaccel.model.execution.ExecutionResult;
import com.cohortaccel.model.execution.RepairAttempt;
import com.cohortaccel.model.funnel.FunnelReport;
import com.cohortaccel.model.funnel.FunnelWarning;
import com.cohortaccel.model.plan.QueryPlan;

import java.util.List;

/**
 * Snapshot of a session handed to callers. Plan, execution and funnel are
 * {@code null} until the corresponding stage has run.
 */
public record ResultBundle(
    String sessionId,
    PipelineStage stage,
    CriteriaSet criteriaSet,
    QueryPlan plan,
    ExecutionResult execution,
    FunnelReport funnel,
    List<Gap> gaps,
    List<FunnelWarning> warnings,
    List<String> assumptions,
    List<RepairAttempt> repairAttempts,
    List<StageFailure> failures,
    List<StageTransition> transitions
) {
    public ResultBundle {
        gaps = List.copyOf(gaps);
        warnings = List.copyOf(warnings);
        assumptions = List.copyOf(assumptions);
        repairAttempts = List.copyOf(repairAttempts);
        failures = List.copyOf(failures);
        transitions = List.copyOf(transitions);
    }

    public boolean isFinalized() {
        return stage == PipelineStage.FINALIZED;
    }
}
