package com.tablesmith.core.migration.operations;

public record CreateOrAlterTriggerOp(String schema, String name, String definitionSql) implements MigrationOperation {
}
