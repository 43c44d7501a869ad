package com.tablesmith.core.migration.operations;

public record DropColumnOp(String schema, String table, String name) implements MigrationOperation {
}
