package com.cohortaccel.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.*;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.*;

/**
 * Settings bound from {@code cohort.*}. Java defaults match application.yml so
 * services can also be built directly in tests.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "cohort")
public class CohortProperties {

    @Valid
    private Pipeline pipeline = new Pipeline();

    @Valid
    private Execution execution = new Execution();

    @Valid
    private Concepts concepts = new Concepts();

    @Valid
    private Catalog catalog = new Catalog();

    /** Named periods for {@code temporal_window.during}, keyed by period name. */
    @Valid
    private Map<String, Period> periods = defaultPeriods();

    /** Lab/observation unit normalisation, keyed by lower-cased concept label. */
    @Valid
    private Map<String, UnitRule> units = new LinkedHashMap<>();

    @Data
    public static class Pipeline {
        @Min(0)
        private int maxRepairAttempts = 3;

        @NotEmpty
        private List<String> approvalTokens = new ArrayList<>(
            List.of("finalize", "approve", "good", "ship it", "done"));
    }

    @Data
    public static class Execution {
        @NotNull
        private Duration queryTimeout = Duration.ofSeconds(30);

        @Min(1)
        @Max(1000)
        private int previewRowLimit = 10;

        @Min(1)
        private long hugeCohortCeiling = 1_000_000L;

        @DecimalMin(value = "0.0", inclusive = false)
        @DecimalMax("1.0")
        private double suspiciousDropThreshold = 0.95;
    }

    @Data
    public static class Concepts {
        @NotNull
        private Duration resolutionTimeout = Duration.ofSeconds(20);

        @Min(1)
        private int maxCodes = 50;
    }

    @Data
    public static class Catalog {
        @Valid
        private Population population = new Population();

        @Valid
        private Map<String, Domain> domains = new LinkedHashMap<>();
    }

    @Data
    public static class Population {
        @NotBlank
        private String table = "patients";

        @NotBlank
        private String subjectColumn = "patient_id";

        private String enrollmentStartColumn = "enrollment_start_date";
        private String enrollmentEndColumn = "enrollment_end_date";
        private String birthDateColumn = "date_of_birth";
    }

    @Data
    public static class Domain {
        @NotBlank
        private String table;

        private String subjectColumn = "patient_id";
        private List<String> codeColumns = new ArrayList<>();
        private String dateColumn;
        private String endDateColumn;
        private String valueColumn;
        private String unitColumn;
        private List<String> attributeColumns = new ArrayList<>();
        private String codeSystem;
        private String referenceTable;
        private String referenceCodeColumn;
        private String referenceDescriptionColumn;
        private String referenceGroupColumn;
    }

    @Data
    public static class Period {
        @Min(0)
        private int beforeDays;

        @Min(0)
        private int afterDays;

        public Period() {
        }

        public Period(int beforeDays, int afterDays) {
            this.beforeDays = beforeDays;
            this.afterDays = afterDays;
        }
    }

    @Data
    public static class UnitRule {
        @NotBlank
        private String standardUnit;

        /** Source unit to affine conversion into the standard unit. */
        private Map<String, Conversion> conversions = new LinkedHashMap<>();
    }

    @Data
    public static class Conversion {
        private double factor = 1.0;
        private double offset = 0.0;

        public Conversion() {
        }

        public Conversion(double factor, double offset) {
            this.factor = factor;
            this.offset = offset;
        }
    }

    private static Map<String, Period> defaultPeriods() {
        Map<String, Period> periods = new LinkedHashMap<>();
        periods.put("baseline", new Period(365, 0));
        periods.put("follow_up", new Period(0, 365));
        return periods;
    }
}
