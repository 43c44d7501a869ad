package com.tablesmith.core.migration.operations;

import com.tablesmith.core.schema.DbColumn;
import com.tablesmith.core.types.ColumnType;

/**
 * Adds a column, or describes one column of a {@link CreateTableOp}.
 *
 * @param startWith   identity seed, or {@code null} for the dialect default
 * @param incrementBy identity increment, or {@code null} for the dialect default
 */
public record AddColumnOp(
        String schema,
        String table,
        String name,
        ColumnType type,
        boolean nullable,
        Object defaultValue,
        boolean incrementalKey,
        Long startWith,
        Long incrementBy
) implements MigrationOperation {

    public AddColumnOp(String schema, String table, String name, ColumnType type, boolean nullable, Object defaultValue) {
        this(schema, table, name, type, nullable, defaultValue, false, null, null);
    }

    public static AddColumnOp of(String schema, String table, DbColumn column) {
        return new AddColumnOp(
                schema,
                table,
                column.name(),
                column.type(),
                column.nullable(),
                column.defaultValue(),
                column.incrementalKey(),
                column.startWith(),
                column.incrementBy()
        );
    }
}
