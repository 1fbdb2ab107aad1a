package com.example.datadestruction.models;

import java.util.Objects;

/**
 * Deletion target a protocol name is allowed to reach. The project is not part of the record:
 * it comes from the deployment environment when the target is resolved.
 */
public record ProtocolConfig(
        String name,
        String dataset,
        String table,
        String keyColumn
) {

    public ProtocolConfig {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(dataset, "dataset");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(keyColumn, "keyColumn");
    }

    public TargetTable in(String project) {
        return new TargetTable(project, dataset, table, keyColumn);
    }
}
