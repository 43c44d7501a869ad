package com.tablesmith.core.migration.operations;

public record DropRoutineOp(String schema, String name, RoutineKind kind) implements MigrationOperation {
}
