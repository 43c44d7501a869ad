package com.tablesmith.core.migration.operations;

public record DropIndexOp(String schema, String table, String name) implements MigrationOperation {
}
