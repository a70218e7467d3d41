package com.cohortaccel.service.compiler;

import com.cohortaccel.config.CohortProperties;
import com.cohortaccel.model.criteria.ValueConstraint;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.util.Locale;
import java.util.Map;

/**
 * Converts lab and observation thresholds into the configured standard unit
 * ({@code standard = value * factor + offset}).
 */
@Component
public class LabUnitNormalizer {

    private final CohortProperties properties;

    public LabUnitNormalizer(CohortProperties properties) {
        this.properties = properties;
    }

    /**
     * @param assumption set when the threshold was converted or its unit could
     *                   not be checked, otherwise {@code null}
     */
    public record Normalized(ValueConstraint constraint, String assumption) {}

    public Normalized normalize(String concept, ValueConstraint constraint) {
        if (constraint == null || constraint.unit() == null || constraint.unit().isBlank()) {
            return new Normalized(constraint, null);
        }
        CohortProperties.UnitRule rule = findRule(concept);
        if (rule == null) {
            return new Normalized(constraint, String.format(
                "No unit rule for '%s'; threshold used as stated in %s", concept, constraint.unit()));
        }
        String unit = constraint.unit().trim();
        if (unit.equalsIgnoreCase(rule.getStandardUnit())) {
            return new Normalized(constraint, null);
        }
        CohortProperties.Conversion conversion = rule.getConversions().entrySet().stream()
            .filter(e -> e.getKey().equalsIgnoreCase(unit))
            .map(Map.Entry::getValue)
            .findFirst()
            .orElse(null);
        if (conversion == null) {
            return new Normalized(constraint, String.format(
                "Unit '%s' for '%s' has no conversion to %s; threshold used as stated",
                unit, concept, rule.getStandardUnit()));
        }

        BigDecimal low = convert(constraint.value(), conversion);
        BigDecimal high = constraint.upperValue() != null ? convert(constraint.upperValue(), conversion) : null;
        ValueConstraint converted = constraint.withValues(low, high, rule.getStandardUnit());
        return new Normalized(converted, String.format(
            "Converted '%s' threshold from %s to %s (x%s %+.4f)",
            concept, unit, rule.getStandardUnit(), conversion.getFactor(), conversion.getOffset()));
    }

    private CohortProperties.UnitRule findRule(String concept) {
        if (concept == null) {
            return null;
        }
        String key = concept.trim().toLowerCase(Locale.ROOT);
        return properties.getUnits().entrySet().stream()
            .filter(e -> e.getKey().equalsIgnoreCase(key) || key.contains(e.getKey().toLowerCase(Locale.ROOT)))
            .map(Map.Entry::getValue)
            .findFirst()
            .orElse(null);
    }

    private BigDecimal convert(BigDecimal value, CohortProperties.Conversion conversion) {
        return value.multiply(BigDecimal.valueOf(conversion.getFactor()), MathContext.DECIMAL64)
            .add(BigDecimal.valueOf(conversion.getOffset()))
            .setScale(4, RoundingMode.HALF_UP)
            .stripTrailingZeros();
    }
}
