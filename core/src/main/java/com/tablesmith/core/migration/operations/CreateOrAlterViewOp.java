package com.tablesmith.core.migration.operations;

/**
 * @param definitionSql full view script; may hold several batches separated by {@code GO}
 */
public record CreateOrAlterViewOp(String schema, String name, String definitionSql) implements MigrationOperation {
}
