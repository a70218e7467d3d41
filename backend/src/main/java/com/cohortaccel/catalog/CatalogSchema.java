package com.cohortaccel.catalog;

import com.cohortaccel.model.enums.ClinicalDomain;

import java.util.*;

/**
 * Read-only snapshot of the clinical data store: tables with their columns and
 * row counts, where the population lives, and which table serves each domain.
 * Table and column lookups are case-insensitive.
 */
public record CatalogSchema(
    List<TableInfo> tables,
    PopulationMapping population,
    Map<ClinicalDomain, DomainMapping> domainMappings
) {
    public CatalogSchema {
        tables = tables == null ? List.of() : List.copyOf(tables);
        domainMappings = domainMappings == null ? Map.of() : Map.copyOf(domainMappings);
        if (population == null) {
            throw new IllegalArgumentException("Catalog requires a population mapping");
        }
    }

    public Optional<TableInfo> table(String name) {
        return tables.stream().filter(t -> t.name().equalsIgnoreCase(name)).findFirst();
    }

    public boolean hasTable(String name) {
        return table(name).isPresent();
    }

    public boolean hasColumn(String tableName, String column) {
        return table(tableName).map(t -> t.hasColumn(column)).orElse(false);
    }

    public Optional<DomainMapping> domainMapping(ClinicalDomain domain) {
        return Optional.ofNullable(domainMappings.get(domain));
    }
}
