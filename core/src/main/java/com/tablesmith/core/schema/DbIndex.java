package com.tablesmith.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DbIndex(
        @JsonProperty("name") String name,
        @JsonProperty("columns") List<String> columns,
        @JsonProperty("unique") boolean unique
) {
    public DbIndex {
        columns = List.copyOf(columns);
    }
}
