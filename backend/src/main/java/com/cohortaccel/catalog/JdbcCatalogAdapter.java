package com.cohortaccel.catalog;

import com.cohortaccel.config.CohortProperties;
import com.cohortaccel.model.enums.ClinicalDomain;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.ConnectionCallback;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.DatabaseMetaData;
import java.sql.ResultSet;
import java.util.*;

/**
 * Catalog read live from JDBC metadata. Domain mappings come from
 * {@code cohort.catalog.domains}; a mapping whose table is absent from the
 * data store is left out so the compiler reports it as missing.
 */
@Slf4j
@Component
public class JdbcCatalogAdapter implements CatalogAdapter {

    private final JdbcTemplate jdbcTemplate;
    private final CohortProperties properties;

    public JdbcCatalogAdapter(JdbcTemplate jdbcTemplate, CohortProperties properties) {
        this.jdbcTemplate = jdbcTemplate;
        this.properties = properties;
    }

    @Override
    public CatalogSchema getSchema() {
        List<TableInfo> tables = readTables();

        CohortProperties.Population population = properties.getCatalog().getPopulation();
        PopulationMapping populationMapping = new PopulationMapping(
            population.getTable(),
            population.getSubjectColumn(),
            population.getEnrollmentStartColumn(),
            population.getEnrollmentEndColumn(),
            population.getBirthDateColumn()
        );

        Map<ClinicalDomain, DomainMapping> mappings = new EnumMap<>(ClinicalDomain.class);
        properties.getCatalog().getDomains().forEach((key, settings) -> {
            ClinicalDomain domain = ClinicalDomain.fromValue(key);
            boolean present = tables.stream().anyMatch(t -> t.name().equalsIgnoreCase(settings.getTable()));
            if (present) {
                mappings.put(domain, DomainMapping.from(domain, settings));
            } else {
                log.warn("Domain {} is mapped to table {} which the data store does not have", key, settings.getTable());
            }
        });

        log.info("Catalog loaded: {} tables, {} domain mappings", tables.size(), mappings.size());
        return new CatalogSchema(tables, populationMapping, mappings);
    }

    private List<TableInfo> readTables() {
        Map<String, List<ColumnInfo>> columnsByTable = jdbcTemplate.execute((ConnectionCallback<Map<String, List<ColumnInfo>>>) con -> {
            DatabaseMetaData metaData = con.getMetaData();
            String schema = con.getSchema();
            Map<String, List<ColumnInfo>> result = new LinkedHashMap<>();
            try (ResultSet rs = metaData.getColumns(con.getCatalog(), schema, "%", "%")) {
                while (rs.next()) {
                    String table = rs.getString("TABLE_NAME");
                    result.computeIfAbsent(table, t -> new ArrayList<>()).add(new ColumnInfo(
                        rs.getString("COLUMN_NAME").toLowerCase(Locale.ROOT),
                        rs.getString("TYPE_NAME"),
                        rs.getInt("NULLABLE") != DatabaseMetaData.columnNoNulls
                    ));
                }
            }
            return result;
        });

        List<TableInfo> tables = new ArrayList<>();
        if (columnsByTable == null) {
            return tables;
        }
        columnsByTable.forEach((table, columns) -> {
            Long rowCount = jdbcTemplate.queryForObject("select count(*) from " + table, Long.class);
            tables.add(new TableInfo(table.toLowerCase(Locale.ROOT), columns, rowCount != null ? rowCount : 0L));
        });
        return tables;
    }
}
