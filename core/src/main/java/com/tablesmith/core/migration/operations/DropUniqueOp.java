package com.tablesmith.core.migration.operations;

public record DropUniqueOp(String schema, String table, String name) implements MigrationOperation {
}
