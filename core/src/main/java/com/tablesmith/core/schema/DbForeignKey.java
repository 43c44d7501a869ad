package com.tablesmith.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DbForeignKey(
        @JsonProperty("name") String name,
        @JsonProperty("columns") List<String> columns,
        @JsonProperty("refSchema") String refSchema,
        @JsonProperty("refTable") String refTable,
        @JsonProperty("refColumns") List<String> refColumns,
        @JsonProperty("onDelete") ReferentialAction onDelete,
        @JsonProperty("onUpdate") ReferentialAction onUpdate
) {
    public DbForeignKey {
        columns = List.copyOf(columns);
        refColumns = List.copyOf(refColumns);
        if (columns.size() != refColumns.size()) {
            throw new IllegalArgumentException("Foreign key " + name + " has " + columns.size()
                    + " columns but references " + refColumns.size());
        }
        onDelete = onDelete == null ? ReferentialAction.NO_ACTION : onDelete;
        onUpdate = onUpdate == null ? ReferentialAction.NO_ACTION : onUpdate;
    }
}
