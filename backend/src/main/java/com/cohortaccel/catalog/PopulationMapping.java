package com.cohortaccel.catalog;

/**
 * Where the subject population lives: one row per subject, with optional
 * enrollment and birth-date columns.
 */
public record PopulationMapping(
    String table,
    String subjectColumn,
    String enrollmentStartColumn,
    String enrollmentEndColumn,
    String birthDateColumn
) {
    public PopulationMapping {
        if (table == null || table.isBlank() || subjectColumn == null || subjectColumn.isBlank()) {
            throw new IllegalArgumentException("Population mapping requires a table and a subject column");
        }
    }

    public boolean hasEnrollment() {
        return enrollmentStartColumn != null && enrollmentEndColumn != null;
    }
}
