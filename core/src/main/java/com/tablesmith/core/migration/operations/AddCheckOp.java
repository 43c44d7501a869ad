package com.tablesmith.core.migration.operations;

public record AddCheckOp(String schema, String table, String name, String expression) implements MigrationOperation {
}
