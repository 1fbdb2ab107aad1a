package com.example.datadestruction.models;

import java.util.Objects;

/**
 * Fully resolved coordinates of a table rows are deleted from. The physical table name is
 * {@code project.dataset.table}; {@code keyColumn} names the string attribute holding the
 * participant identifier.
 */
public record TargetTable(
        String project,
        String dataset,
        String table,
        String keyColumn
) {

    public TargetTable {
        requireNonBlank(project, "project");
        requireNonBlank(dataset, "dataset");
        requireNonBlank(table, "table");
        requireNonBlank(keyColumn, "keyColumn");
    }

    public String physicalName() {
        return project + "." + dataset + "." + table;
    }

    @Override
    public String toString() {
        return physicalName();
    }

    private static void requireNonBlank(String value, String name) {
        Objects.requireNonNull(value, name);
        if (value.isBlank()) {
            throw new IllegalArgumentException(name + " must be non-blank");
        }
    }
}
