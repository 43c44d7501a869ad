package com.tablesmith.core.migration;

import com.tablesmith.core.migration.operations.AddCheckOp;
import com.tablesmith.core.migration.operations.AddColumnOp;
import com.tablesmith.core.migration.operations.AddForeignKeyOp;
import com.tablesmith.core.migration.operations.AddPrimaryKeyOp;
import com.tablesmith.core.migration.operations.AddUniqueOp;
import com.tablesmith.core.migration.operations.CreateIndexOp;
import com.tablesmith.core.migration.operations.CreateOrAlterRoutineOp;
import com.tablesmith.core.migration.operations.CreateOrAlterTriggerOp;
import com.tablesmith.core.migration.operations.CreateOrAlterViewOp;
import com.tablesmith.core.migration.operations.CreateTableOp;
import com.tablesmith.core.migration.operations.DropCheckOp;
import com.tablesmith.core.migration.operations.DropColumnOp;
import com.tablesmith.core.migration.operations.DropForeignKeyOp;
import com.tablesmith.core.migration.operations.DropIndexOp;
import com.tablesmith.core.migration.operations.DropPrimaryKeyOp;
import com.tablesmith.core.migration.operations.DropRoutineOp;
import com.tablesmith.core.migration.operations.DropTableOp;
import com.tablesmith.core.migration.operations.DropTriggerOp;
import com.tablesmith.core.migration.operations.DropUniqueOp;
import com.tablesmith.core.migration.operations.DropViewOp;
import com.tablesmith.core.migration.operations.MigrationOperation;
import com.tablesmith.core.migration.operations.RoutineKind;
import com.tablesmith.core.migration.operations.SqlOp;
import com.tablesmith.core.schema.DbTable;
import com.tablesmith.core.schema.ReferentialAction;
import com.tablesmith.core.types.ColumnType;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.Consumer;

/**
 * Records the operations of one migration in call order.
 *
 * <pre>{@code
 * migration.createTable("dbo", "Users", t -> t
 *         .identity("Id", ColumnType.int32())
 *         .column("Email", ColumnType.string(200), false)
 *         .primaryKey("PK_Users", "Id")
 *         .unique("UQ_Users_Email", "Email"));
 * }</pre>
 */
public class MigrationBuilder {
    private final List<MigrationOperation> operations = new ArrayList<>();

    public List<MigrationOperation> operations() {
        return List.copyOf(operations);
    }

    public MigrationBuilder add(MigrationOperation operation) {
        operations.add(operation);
        return this;
    }

    public MigrationBuilder createTable(String schema, String name, Consumer<CreateTableBuilder> table) {
        CreateTableBuilder builder = new CreateTableBuilder(schema, name);
        table.accept(builder);
        return add(builder.build());
    }

    public MigrationBuilder createTable(DbTable table) {
        return add(CreateTableOp.from(table));
    }

    public MigrationBuilder dropTable(String schema, String name) {
        return add(new DropTableOp(schema, name));
    }

    public MigrationBuilder addColumn(String schema, String table, String name, ColumnType type, boolean nullable) {
        return add(new AddColumnOp(schema, table, name, type, nullable, null));
    }

    public MigrationBuilder addColumn(String schema, String table, String name, ColumnType type, boolean nullable,
                                      Object defaultValue) {
        return add(new AddColumnOp(schema, table, name, type, nullable, defaultValue));
    }

    public MigrationBuilder dropColumn(String schema, String table, String name) {
        return add(new DropColumnOp(schema, table, name));
    }

    public MigrationBuilder addPrimaryKey(String schema, String table, String name, String... columns) {
        return add(new AddPrimaryKeyOp(schema, table, name, Arrays.asList(columns)));
    }

    public MigrationBuilder dropPrimaryKey(String schema, String table, String name) {
        return add(new DropPrimaryKeyOp(schema, table, name));
    }

    public MigrationBuilder addUnique(String schema, String table, String name, String... columns) {
        return add(new AddUniqueOp(schema, table, name, Arrays.asList(columns)));
    }

    public MigrationBuilder dropUnique(String schema, String table, String name) {
        return add(new DropUniqueOp(schema, table, name));
    }

    public MigrationBuilder addCheck(String schema, String table, String name, String expression) {
        return add(new AddCheckOp(schema, table, name, expression));
    }

    public MigrationBuilder dropCheck(String schema, String table, String name) {
        return add(new DropCheckOp(schema, table, name));
    }

    public MigrationBuilder createIndex(String schema, String table, String name, boolean unique, String... columns) {
        return add(new CreateIndexOp(schema, table, name, Arrays.asList(columns), unique));
    }

    public MigrationBuilder dropIndex(String schema, String table, String name) {
        return add(new DropIndexOp(schema, table, name));
    }

    public MigrationBuilder addForeignKey(String schema, String table, String name, String column,
                                         String refSchema, String refTable, String refColumn,
                                         ReferentialAction onDelete) {
        return add(new AddForeignKeyOp(schema, table, name, List.of(column), refSchema, refTable, List.of(refColumn),
                onDelete, ReferentialAction.NO_ACTION));
    }

    public MigrationBuilder dropForeignKey(String schema, String table, String name) {
        return add(new DropForeignKeyOp(schema, table, name));
    }

    public MigrationBuilder createOrAlterView(String schema, String name, String sql) {
        return add(new CreateOrAlterViewOp(schema, name, sql));
    }

    public MigrationBuilder dropView(String schema, String name) {
        return add(new DropViewOp(schema, name));
    }

    public MigrationBuilder createOrAlterProcedure(String schema, String name, String sql) {
        return add(new CreateOrAlterRoutineOp(schema, name, RoutineKind.PROCEDURE, sql));
    }

    public MigrationBuilder createOrAlterScalarFunction(String schema, String name, String sql) {
        return add(new CreateOrAlterRoutineOp(schema, name, RoutineKind.SCALAR_FUNCTION, sql));
    }

    public MigrationBuilder createOrAlterTableFunction(String schema, String name, String sql) {
        return add(new CreateOrAlterRoutineOp(schema, name, RoutineKind.TABLE_FUNCTION, sql));
    }

    public MigrationBuilder dropRoutine(String schema, String name, RoutineKind kind) {
        return add(new DropRoutineOp(schema, name, kind));
    }

    public MigrationBuilder createOrAlterTrigger(String schema, String name, String sql) {
        return add(new CreateOrAlterTriggerOp(schema, name, sql));
    }

    public MigrationBuilder dropTrigger(String schema, String name) {
        return add(new DropTriggerOp(schema, name));
    }

    public MigrationBuilder sql(String sql) {
        return add(new SqlOp(sql));
    }

    public static class CreateTableBuilder {
        private final String schema;
        private final String name;
        private final List<AddColumnOp> columns = new ArrayList<>();
        private AddPrimaryKeyOp primaryKey;
        private final List<AddUniqueOp> uniques = new ArrayList<>();
        private final List<AddCheckOp> checks = new ArrayList<>();
        private final List<CreateIndexOp> indexes = new ArrayList<>();
        private final List<AddForeignKeyOp> foreignKeys = new ArrayList<>();

        private CreateTableBuilder(String schema, String name) {
            this.schema = schema;
            this.name = name;
        }

        public CreateTableBuilder column(String column, ColumnType type) {
            return column(column, type, true, null);
        }

        public CreateTableBuilder column(String column, ColumnType type, boolean nullable) {
            return column(column, type, nullable, null);
        }

        public CreateTableBuilder column(String column, ColumnType type, boolean nullable, Object defaultValue) {
            columns.add(new AddColumnOp(schema, name, column, type, nullable, defaultValue));
            return this;
        }

        /**
         * A non-nullable, database-generated key column starting at 1.
         */
        public CreateTableBuilder identity(String column, ColumnType type) {
            return identity(column, type, 1L, 1L);
        }

        public CreateTableBuilder identity(String column, ColumnType type, long startWith, long incrementBy) {
            columns.add(new AddColumnOp(schema, name, column, type, false, null, true, startWith, incrementBy));
            return this;
        }

        public CreateTableBuilder primaryKey(String constraint, String... keyColumns) {
            if (primaryKey != null) {
                throw new IllegalStateException("Table " + schema + "." + name + " already has primary key "
                        + primaryKey.name());
            }
            primaryKey = new AddPrimaryKeyOp(schema, name, constraint, Arrays.asList(keyColumns));
            return this;
        }

        public CreateTableBuilder unique(String constraint, String... uniqueColumns) {
            uniques.add(new AddUniqueOp(schema, name, constraint, Arrays.asList(uniqueColumns)));
            return this;
        }

        public CreateTableBuilder check(String constraint, String expression) {
            checks.add(new AddCheckOp(schema, name, constraint, expression));
            return this;
        }

        public CreateTableBuilder index(String index, boolean unique, String... indexColumns) {
            indexes.add(new CreateIndexOp(schema, name, index, Arrays.asList(indexColumns), unique));
            return this;
        }

        public CreateTableBuilder foreignKey(String constraint, String column, String refSchema, String refTable,
                                             String refColumn, ReferentialAction onDelete) {
            foreignKeys.add(new AddForeignKeyOp(schema, name, constraint, List.of(column), refSchema, refTable,
                    List.of(refColumn), onDelete, ReferentialAction.NO_ACTION));
            return this;
        }

        CreateTableOp build() {
            return new CreateTableOp(schema, name, columns, primaryKey, uniques, checks, indexes, foreignKeys);
        }
    }
}
