package com.tablesmith.core.migration.operations;

import java.util.Objects;

/**
 * Raw SQL, emitted as a single batch without further processing.
 */
public record SqlOp(String sql) implements MigrationOperation {
    public SqlOp {
        Objects.requireNonNull(sql, "sql");
    }
}
