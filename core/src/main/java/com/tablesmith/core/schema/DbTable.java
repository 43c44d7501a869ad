package com.tablesmith.core.schema;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.tablesmith.core.SchemaDefinitionException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.stream.Stream;

public final class DbTable {
    private final String schema;
    private final String name;
    private final Class<?> source;
    private final List<DbColumn> columns = new ArrayList<>();
    private DbPrimaryKey primaryKey;
    private final List<DbUnique> uniques = new ArrayList<>();
    private final List<DbCheck> checks = new ArrayList<>();
    private final List<DbIndex> indexes = new ArrayList<>();
    private final List<DbForeignKey> foreignKeys = new ArrayList<>();

    public DbTable(String schema, String name, Class<?> source) {
        this.schema = schema;
        this.name = name;
        this.source = source;
    }

    @JsonProperty("schema")
    public String schema() {
        return schema;
    }

    @JsonProperty("name")
    public String name() {
        return name;
    }

    /**
     * The entity class this table was built from. Only used in diagnostics.
     */
    @JsonIgnore
    public Class<?> source() {
        return source;
    }

    @JsonIgnore
    public String qualifiedName() {
        return schema + "." + name;
    }

    @JsonProperty("columns")
    public List<DbColumn> columns() {
        return Collections.unmodifiableList(columns);
    }

    @JsonProperty("primaryKey")
    public DbPrimaryKey primaryKey() {
        return primaryKey;
    }

    @JsonProperty("uniques")
    public List<DbUnique> uniques() {
        return Collections.unmodifiableList(uniques);
    }

    @JsonProperty("checks")
    public List<DbCheck> checks() {
        return Collections.unmodifiableList(checks);
    }

    @JsonProperty("indexes")
    public List<DbIndex> indexes() {
        return Collections.unmodifiableList(indexes);
    }

    @JsonProperty("foreignKeys")
    public List<DbForeignKey> foreignKeys() {
        return Collections.unmodifiableList(foreignKeys);
    }

    public Optional<DbColumn> findColumn(String columnName) {
        return columns.stream()
                .filter(c -> c.name().equalsIgnoreCase(columnName))
                .findFirst();
    }

    public DbTable addColumn(DbColumn column) {
        if (findColumn(column.name()).isPresent()) {
            throw new SchemaDefinitionException("Duplicate column '" + column.name() + "' in table " + qualifiedName()
                    + " (source: " + describeSource() + ")");
        }
        columns.add(column);
        return this;
    }

    public DbTable setPrimaryKey(DbPrimaryKey primaryKey) {
        if (this.primaryKey != null) {
            throw new SchemaDefinitionException("Table " + qualifiedName() + " already has primary key "
                    + this.primaryKey.name());
        }
        this.primaryKey = primaryKey;
        return this;
    }

    public DbTable addUnique(DbUnique unique) {
        requireFreeName("unique constraint", unique.name(), uniques.stream().map(DbUnique::name));
        uniques.add(unique);
        return this;
    }

    public DbTable addCheck(DbCheck check) {
        requireFreeName("check constraint", check.name(), checks.stream().map(DbCheck::name));
        checks.add(check);
        return this;
    }

    public DbTable addIndex(DbIndex index) {
        requireFreeName("index", index.name(), indexes.stream().map(DbIndex::name));
        indexes.add(index);
        return this;
    }

    public DbTable addForeignKey(DbForeignKey foreignKey) {
        requireFreeName("foreign key", foreignKey.name(), foreignKeys.stream().map(DbForeignKey::name));
        foreignKeys.add(foreignKey);
        return this;
    }

    private void requireFreeName(String kind, String candidate, Stream<String> taken) {
        if (taken.anyMatch(candidate::equalsIgnoreCase)) {
            throw new SchemaDefinitionException("Duplicate " + kind + " name '" + candidate + "' in table "
                    + qualifiedName() + " (source: " + describeSource() + ")");
        }
    }

    private String describeSource() {
        return source == null ? "<none>" : source.getName();
    }

    @Override
    public String toString() {
        return "DbTable[" + qualifiedName() + ", columns=" + columns.size() + "]";
    }
}
