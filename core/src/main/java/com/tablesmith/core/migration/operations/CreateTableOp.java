package com.tablesmith.core.migration.operations;

import com.tablesmith.core.schema.DbTable;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Creates a table together with its constraints. The primary key is created inline; uniques,
 * checks and indexes follow the table; foreign keys are deferred like standalone
 * {@link AddForeignKeyOp}s.
 */
public record CreateTableOp(
        String schema,
        String name,
        List<AddColumnOp> columns,
        AddPrimaryKeyOp primaryKey,
        List<AddUniqueOp> uniques,
        List<AddCheckOp> checks,
        List<CreateIndexOp> indexes,
        List<AddForeignKeyOp> foreignKeys
) implements MigrationOperation {

    public CreateTableOp {
        columns = List.copyOf(columns);
        uniques = List.copyOf(uniques);
        checks = List.copyOf(checks);
        indexes = List.copyOf(indexes);
        foreignKeys = List.copyOf(foreignKeys);
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("Table " + schema + "." + name + " must have at least one column");
        }
    }

    /**
     * Translates a modelled table into the equivalent create operation.
     */
    public static CreateTableOp from(DbTable table) {
        String schema = table.schema();
        String name = table.name();
        return new CreateTableOp(
                schema,
                name,
                table.columns().stream()
                        .map(c -> AddColumnOp.of(schema, name, c))
                        .collect(Collectors.toList()),
                table.primaryKey() == null
                        ? null
                        : new AddPrimaryKeyOp(schema, name, table.primaryKey().name(), table.primaryKey().columns()),
                table.uniques().stream()
                        .map(u -> new AddUniqueOp(schema, name, u.name(), u.columns()))
                        .collect(Collectors.toList()),
                table.checks().stream()
                        .map(c -> new AddCheckOp(schema, name, c.name(), c.expression()))
                        .collect(Collectors.toList()),
                table.indexes().stream()
                        .map(i -> new CreateIndexOp(schema, name, i.name(), i.columns(), i.unique()))
                        .collect(Collectors.toList()),
                table.foreignKeys().stream()
                        .map(fk -> new AddForeignKeyOp(schema, name, fk.name(), fk.columns(),
                                fk.refSchema(), fk.refTable(), fk.refColumns(), fk.onDelete(), fk.onUpdate()))
                        .collect(Collectors.toList())
        );
    }
}
