package com.tablesmith.core.migration.operations;

public record DropTableOp(String schema, String name) implements MigrationOperation {
}
