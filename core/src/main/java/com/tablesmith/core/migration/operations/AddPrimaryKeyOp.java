package com.tablesmith.core.migration.operations;

import java.util.List;

public record AddPrimaryKeyOp(String schema, String table, String name, List<String> columns) implements MigrationOperation {
    public AddPrimaryKeyOp {
        columns = List.copyOf(columns);
    }
}
