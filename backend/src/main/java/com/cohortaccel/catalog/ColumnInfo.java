package com.cohortaccel.catalog;

public record ColumnInfo(
    String name,
    String type,
    boolean nullable
) {}
