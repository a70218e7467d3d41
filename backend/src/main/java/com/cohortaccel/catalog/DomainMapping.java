package com.cohortaccel.catalog;

import com.cohortaccel.config.CohortProperties;
import com.cohortaccel.model.enums.ClinicalDomain;

import java.util.List;

/**
 * Physical location of one clinical domain: event table, the columns holding
 * codes, dates and values, and the optional reference table used for
 * hierarchy and ingredient matching.
 */
public record DomainMapping(
    ClinicalDomain domain,
    String table,
    String subjectColumn,
    List<String> codeColumns,
    String dateColumn,
    String endDateColumn,
    String valueColumn,
    String unitColumn,
    List<String> attributeColumns,
    String codeSystem,
    String referenceTable,
    String referenceCodeColumn,
    String referenceDescriptionColumn,
    String referenceGroupColumn
) {
    public DomainMapping {
        codeColumns = codeColumns == null ? List.of() : List.copyOf(codeColumns);
        attributeColumns = attributeColumns == null ? List.of() : List.copyOf(attributeColumns);
    }

    public static DomainMapping from(ClinicalDomain domain, CohortProperties.Domain settings) {
        return new DomainMapping(
            domain,
            settings.getTable(),
            settings.getSubjectColumn(),
            settings.getCodeColumns(),
            settings.getDateColumn(),
            settings.getEndDateColumn(),
            settings.getValueColumn(),
            settings.getUnitColumn(),
            settings.getAttributeColumns(),
            settings.getCodeSystem(),
            settings.getReferenceTable(),
            settings.getReferenceCodeColumn(),
            settings.getReferenceDescriptionColumn(),
            settings.getReferenceGroupColumn()
        );
    }

    public boolean hasReferenceTable() {
        return referenceTable != null && referenceCodeColumn != null;
    }
}
