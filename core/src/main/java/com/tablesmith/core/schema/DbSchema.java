package com.tablesmith.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

public final class DbSchema {
    private final String name;
    private final Map<String, DbTable> tables = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    public DbSchema(String name) {
        this.name = name;
    }

    @JsonProperty("name")
    public String name() {
        return name;
    }

    @JsonProperty("tables")
    public Map<String, DbTable> tables() {
        return Collections.unmodifiableMap(tables);
    }

    public DbTable getOrAddTable(String tableName, Class<?> source) {
        return tables.computeIfAbsent(tableName, n -> new DbTable(name, n, source));
    }
}
