package com.cohortaccel.catalog;

import java.util.List;

public record TableInfo(
    String name,
    List<ColumnInfo> columns,
    long rowCount
) {
    public TableInfo {
        columns = columns == null ? List.of() : List.copyOf(columns);
    }

    public boolean hasColumn(String column) {
        return column != null && columns.stream().anyMatch(c -> c.name().equalsIgnoreCase(column));
    }
}
