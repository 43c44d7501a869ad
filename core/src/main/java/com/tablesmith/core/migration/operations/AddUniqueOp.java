package com.tablesmith.core.migration.operations;

import java.util.List;

public record AddUniqueOp(String schema, String table, String name, List<String> columns) implements MigrationOperation {
    public AddUniqueOp {
        columns = List.copyOf(columns);
    }
}
