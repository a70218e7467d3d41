package com.cohortaccel.model.criteria;

/**
 * Time window relative to a named anchor.
 * <p>
 * Either a day-bounded interval {@code [anchor - beforeDays, anchor + afterDays]}
 * (a missing side counts as zero days) or a named period via {@code during},
 * never both.
 */
public record TemporalWindow(
    String reference,
    Integer beforeDays,
    Integer afterDays,
    String during
) {
    public TemporalWindow {
        if (reference == null || reference.isBlank()) {
            throw new IllegalArgumentException("Temporal window requires an anchor reference");
        }
        if (beforeDays != null && beforeDays < 0) {
            throw new IllegalArgumentException("before_days must be non-negative: " + beforeDays);
        }
        if (afterDays != null && afterDays < 0) {
            throw new IllegalArgumentException("after_days must be non-negative: " + afterDays);
        }
        boolean hasDays = beforeDays != null || afterDays != null;
        boolean hasPeriod = during != null && !during.isBlank();
        if (hasDays && hasPeriod) {
            throw new IllegalArgumentException(
                "Temporal window cannot combine a named period with day bounds");
        }
        if (!hasDays && !hasPeriod) {
            throw new IllegalArgumentException(
                "Temporal window needs before_days, after_days or a named period");
        }
        if (!hasPeriod) {
            during = null;
        }
    }

    public static TemporalWindow lookback(String reference, int days) {
        return new TemporalWindow(reference, days, 0, null);
    }

    public static TemporalWindow period(String reference, String during) {
        return new TemporalWindow(reference, null, null, during);
    }

    public boolean isNamedPeriod() {
        return during != null;
    }

    public int beforeDaysOrZero() {
        return beforeDays != null ? beforeDays : 0;
    }

    public int afterDaysOrZero() {
        return afterDays != null ? afterDays : 0;
    }
}
