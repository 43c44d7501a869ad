package com.tablesmith.core.migration.operations;

public record DropPrimaryKeyOp(String schema, String table, String name) implements MigrationOperation {
}
