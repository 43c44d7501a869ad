package com.tablesmith.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DbUnique(
        @JsonProperty("name") String name,
        @JsonProperty("columns") List<String> columns
) {
    public DbUnique {
        columns = List.copyOf(columns);
    }
}
