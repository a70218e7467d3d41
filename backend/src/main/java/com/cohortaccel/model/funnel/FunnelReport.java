package com.cohortaccel.model.funnel;

import java.util.List;
import java.util.Set;

public record FunnelReport(
    String planId,
    Set<String> enabledPredicateIds,
    List<FunnelStep> steps,
    List<FunnelWarning> warnings
) {
    public FunnelReport {
        enabledPredicateIds = Set.copyOf(enabledPredicateIds);
        steps = List.copyOf(steps);
        warnings = List.copyOf(warnings);
    }

    public long baseCount() {
        return steps.isEmpty() ? 0 : steps.get(0).count();
    }

    public long finalCount() {
        return steps.isEmpty() ? 0 : steps.get(steps.size() - 1).count();
    }
}
