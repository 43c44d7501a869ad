package com.tablesmith.core.migration.operations;

public record DropCheckOp(String schema, String table, String name) implements MigrationOperation {
}
