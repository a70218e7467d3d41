package com.cohortaccel.model.criteria;

import com.cohortaccel.model.enums.ComparisonOperator;

import java.math.BigDecimal;

/**
 * Numeric constraint on an attribute or a measured value.
 * {@code between} is a closed range and requires {@code low <= high}.
 */
public record ValueConstraint(
    ComparisonOperator operator,
    BigDecimal value,
    BigDecimal upperValue,
    String unit
) {
    public ValueConstraint {
        if (operator == null) {
            throw new IllegalArgumentException("Value constraint requires an operator");
        }
        if (value == null) {
            throw new IllegalArgumentException("Value constraint requires a value");
        }
        if (operator.isRange()) {
            if (upperValue == null) {
                throw new IllegalArgumentException("'between' requires a two-element range");
            }
            if (value.compareTo(upperValue) > 0) {
                throw new IllegalArgumentException(
                    "'between' range must be ordered low <= high: [" + value + ", " + upperValue + "]");
            }
        } else if (upperValue != null) {
            throw new IllegalArgumentException("Only 'between' accepts a range value");
        }
    }

    public static ValueConstraint of(ComparisonOperator operator, double value, String unit) {
        return new ValueConstraint(operator, BigDecimal.valueOf(value), null, unit);
    }

    public static ValueConstraint between(double low, double high, String unit) {
        return new ValueConstraint(
            ComparisonOperator.BETWEEN, BigDecimal.valueOf(low), BigDecimal.valueOf(high), unit);
    }

    public ValueConstraint withValues(BigDecimal low, BigDecimal high, String newUnit) {
        return new ValueConstraint(operator, low, operator.isRange() ? high : null, newUnit);
    }
}
