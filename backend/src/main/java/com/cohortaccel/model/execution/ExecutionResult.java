package com.cohortaccel.model.execution;

import com.cohortaccel.model.enums.ExecutionErrorKind;
import com.cohortaccel.model.enums.ExecutionMode;
import com.cohortaccel.model.enums.ExecutionStatus;
import com.cohortaccel.model.funnel.FunnelWarning;

import java.util.List;
import java.util.Map;

/**
 * Outcome of running a plan. Query failures are reported here, never thrown.
 */
public record ExecutionResult(
    ExecutionStatus status,
    ExecutionMode mode,
    int planVersion,
    long rowCount,
    double timingMs,
    ExecutionErrorKind errorKind,
    String errorMessage,
    List<Map<String, Object>> previewRows,
    List<FunnelWarning> flags,
    List<String> warnings
) {
    public ExecutionResult {
        previewRows = previewRows == null ? List.of() : List.copyOf(previewRows);
        flags = flags == null ? List.of() : List.copyOf(flags);
        warnings = warnings == null ? List.of() : List.copyOf(warnings);
    }

    public static ExecutionResult ok(ExecutionMode mode, int planVersion, long rowCount, double timingMs,
                                     List<Map<String, Object>> previewRows, List<FunnelWarning> flags,
                                     List<String> warnings) {
        return new ExecutionResult(ExecutionStatus.OK, mode, planVersion, rowCount, timingMs,
            null, null, previewRows, flags, warnings);
    }

    public static ExecutionResult error(ExecutionMode mode, int planVersion, double timingMs,
                                        ExecutionErrorKind kind, String message) {
        return new ExecutionResult(ExecutionStatus.ERROR, mode, planVersion, 0, timingMs,
            kind, message, List.of(), List.of(), List.of());
    }

    public boolean isOk() {
        return status == ExecutionStatus.OK;
    }
}
