package com.tablesmith.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record DbPrimaryKey(
        @JsonProperty("name") String name,
        @JsonProperty("columns") List<String> columns
) {
    public DbPrimaryKey {
        columns = List.copyOf(columns);
    }
}
