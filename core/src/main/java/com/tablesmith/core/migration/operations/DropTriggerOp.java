package com.tablesmith.core.migration.operations;

public record DropTriggerOp(String schema, String name) implements MigrationOperation {
}
