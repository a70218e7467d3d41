package com.cohortaccel.model.funnel;

/**
 * One row of the attrition report.
 * Percentages are 0-100 with one decimal; both are 0 when their denominator is 0.
 */
public record FunnelStep(
    String stepLabel,
    String predicateId,
    long count,
    double percentOfBase,
    long dropCount,
    double dropPercent
) {
    public static final String BASE = "base";
    public static final String FINAL = "final";

    public boolean isBase() {
        return BASE.equals(predicateId);
    }

    public boolean isFinal() {
        return FINAL.equals(predicateId);
    }
}
