package com.cohortaccel.model.criteria;

import com.cohortaccel.model.enums.ComparisonOperator;

/**
 * Constraint on how many qualifying events a subject has.
 * <p>
 * With a {@code proportion}, the count applies to all candidate events and the
 * subject additionally needs {@code ceil(proportion * total)} events that satisfy
 * the predicate's value constraint.
 */
public record CountConstraint(
    ComparisonOperator operator,
    int count,
    Integer upperCount,
    Integer withinDays,
    Double proportion
) {
    public CountConstraint {
        if (operator == null) {
            throw new IllegalArgumentException("Count constraint requires an operator");
        }
        if (count < 0) {
            throw new IllegalArgumentException("Count must be non-negative: " + count);
        }
        if (operator.isRange()) {
            if (upperCount == null || upperCount < count) {
                throw new IllegalArgumentException("'between' count range must be ordered low <= high");
            }
        } else if (upperCount != null) {
            throw new IllegalArgumentException("Only 'between' accepts a count range");
        }
        if (withinDays != null && withinDays <= 0) {
            throw new IllegalArgumentException("within_days must be positive: " + withinDays);
        }
        if (proportion != null && (proportion.isNaN() || proportion <= 0.0 || proportion > 1.0)) {
            throw new IllegalArgumentException("proportion must be in (0, 1]: " + proportion);
        }
    }

    public static CountConstraint atLeast(int count) {
        return new CountConstraint(ComparisonOperator.GREATER_OR_EQUAL, count, null, null, null);
    }

    public boolean hasProportion() {
        return proportion != null;
    }
}
