package com.tablesmith.core.migration.operations;

public record DropViewOp(String schema, String name) implements MigrationOperation {
}
