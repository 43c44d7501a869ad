package com.tablesmith.core.migration.operations;

/**
 * A stored procedure or function. The definition is executed as written, after batch splitting.
 */
public record CreateOrAlterRoutineOp(
        String schema,
        String name,
        RoutineKind kind,
        String definitionSql
) implements MigrationOperation {
}
