package com.tablesmith.core.migration.operations;

public record DropForeignKeyOp(String schema, String table, String name) implements MigrationOperation {
}
