package com.tablesmith.core.migration.operations;

import java.util.List;

public record CreateIndexOp(
        String schema,
        String table,
        String name,
        List<String> columns,
        boolean unique
) implements MigrationOperation {
    public CreateIndexOp {
        columns = List.copyOf(columns);
    }
}
