package com.tablesmith.core.schema;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Root of the in-memory schema description. Schema and table lookups are case-insensitive.
 */
public final class SchemaModel {
    private final Map<String, DbSchema> schemas = new TreeMap<>(String.CASE_INSENSITIVE_ORDER);

    @JsonProperty("schemas")
    public Map<String, DbSchema> schemas() {
        return Collections.unmodifiableMap(schemas);
    }

    public DbSchema getOrAddSchema(String name) {
        return schemas.computeIfAbsent(name, DbSchema::new);
    }

    public List<DbTable> allTables() {
        return schemas.values().stream()
                .flatMap(s -> s.tables().values().stream())
                .collect(Collectors.toList());
    }

    public Optional<DbTable> findTable(String schema, String table) {
        DbSchema s = schemas.get(schema);
        return s == null ? Optional.empty() : Optional.ofNullable(s.tables().get(table));
    }

    @Override
    public String toString() {
        return "SchemaModel[schemas=" + schemas.size() + ", tables=" + allTables().size() + "]";
    }
}
