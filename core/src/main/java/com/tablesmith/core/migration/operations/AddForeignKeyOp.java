package com.tablesmith.core.migration.operations;

import com.tablesmith.core.schema.ReferentialAction;

import java.util.List;

/**
 * Adds a foreign key. Generators always emit these after every other batch of the same run so the
 * referenced table exists by the time the constraint is created.
 */
public record AddForeignKeyOp(
        String schema,
        String table,
        String name,
        List<String> columns,
        String refSchema,
        String refTable,
        List<String> refColumns,
        ReferentialAction onDelete,
        ReferentialAction onUpdate
) implements MigrationOperation {
    public AddForeignKeyOp {
        columns = List.copyOf(columns);
        refColumns = List.copyOf(refColumns);
        if (columns.size() != refColumns.size()) {
            throw new IllegalArgumentException("Foreign key " + name + " maps " + columns.size()
                    + " column(s) to " + refColumns.size() + " referenced column(s)");
        }
        onDelete = onDelete == null ? ReferentialAction.NO_ACTION : onDelete;
        onUpdate = onUpdate == null ? ReferentialAction.NO_ACTION : onUpdate;
    }
}
