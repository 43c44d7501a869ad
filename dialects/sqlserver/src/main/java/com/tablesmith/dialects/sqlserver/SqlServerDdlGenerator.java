package com.tablesmith.dialects.sqlserver;

import com.tablesmith.core.migration.SchemaSqlGenerator;
import com.tablesmith.core.migration.operations.AddColumnOp;
import com.tablesmith.core.schema.DbCheck;
import com.tablesmith.core.schema.DbColumn;
import com.tablesmith.core.schema.DbForeignKey;
import com.tablesmith.core.schema.DbIndex;
import com.tablesmith.core.schema.DbSchema;
import com.tablesmith.core.schema.DbTable;
import com.tablesmith.core.schema.DbUnique;
import com.tablesmith.core.schema.SchemaModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

import static com.tablesmith.dialects.sqlserver.SqlServerDialect.columnDefinition;
import static com.tablesmith.dialects.sqlserver.SqlServerDialect.escapeLiteral;
import static com.tablesmith.dialects.sqlserver.SqlServerDialect.foreignKeyClause;
import static com.tablesmith.dialects.sqlserver.SqlServerDialect.literal;
import static com.tablesmith.dialects.sqlserver.SqlServerDialect.qualify;
import static com.tablesmith.dialects.sqlserver.SqlServerDialect.quote;
import static com.tablesmith.dialects.sqlserver.SqlServerDialect.quoteAll;

/**
 * Bootstrap DDL for a whole {@link SchemaModel}.
 *
 * <p>Every batch is guarded by an existence check, so the output can be run any number of times.
 * Batches come out as: schemas, tables (with inline primary keys), then per table its uniques,
 * checks and indexes, and finally every foreign key. Schemas and tables are ordered by name,
 * ignoring case. Existing objects are never altered or dropped.
 */
public class SqlServerDdlGenerator implements SchemaSqlGenerator {
    private static final Logger logger = LoggerFactory.getLogger(SqlServerDdlGenerator.class);

    private static final Comparator<DbTable> TABLE_ORDER =
            Comparator.comparing(DbTable::qualifiedName, String.CASE_INSENSITIVE_ORDER);

    @Override
    public List<String> generate(SchemaModel model) {
        List<String> batches = new ArrayList<>();

        List<DbSchema> schemas = model.schemas().values().stream()
                .sorted(Comparator.comparing(DbSchema::name, String.CASE_INSENSITIVE_ORDER))
                .collect(Collectors.toList());
        List<DbTable> tables = model.allTables().stream()
                .sorted(TABLE_ORDER)
                .collect(Collectors.toList());

        for (DbSchema schema : schemas) {
            batches.add(createSchema(schema.name()));
        }

        for (DbTable table : tables) {
            batches.add(createTable(table));
        }

        for (DbTable table : tables) {
            for (DbUnique unique : table.uniques()) {
                batches.add(addUnique(table, unique));
            }
            for (DbCheck check : table.checks()) {
                batches.add(addCheck(table, check));
            }
            for (DbIndex index : table.indexes()) {
                batches.add(createIndex(table, index));
            }
        }

        for (DbTable table : tables) {
            for (DbForeignKey fk : table.foreignKeys()) {
                batches.add(addForeignKey(table, fk));
            }
        }

        logger.debug("Generated {} bootstrap batches for {}", batches.size(), model);
        return batches;
    }

    static String createSchema(String schema) {
        return "IF NOT EXISTS (SELECT 1 FROM sys.schemas WHERE name = " + literal(schema) + ")\n"
                + "    EXEC(N'CREATE SCHEMA " + escapeLiteral(quote(schema)) + "');";
    }

    private static String createTable(DbTable table) {
        StringBuilder sql = new StringBuilder()
                .append("IF OBJECT_ID(").append(objectName(table)).append(", N'U') IS NULL\n")
                .append("BEGIN\n")
                .append("    CREATE TABLE ").append(qualify(table.schema(), table.name())).append("\n")
                .append("    (\n");

        List<DbColumn> columns = table.columns();
        for (int i = 0; i < columns.size(); i++) {
            DbColumn column = columns.get(i);
            String defaultName = "DF_" + table.name() + "_" + column.name();
            sql.append("        ").append(columnDefinition(AddColumnOp.of(table.schema(), table.name(), column), defaultName));
            if (i < columns.size() - 1 || table.primaryKey() != null) {
                sql.append(',');
            }
            sql.append('\n');
        }

        if (table.primaryKey() != null) {
            sql.append("        CONSTRAINT ").append(quote(table.primaryKey().name()))
                    .append(" PRIMARY KEY (").append(quoteAll(table.primaryKey().columns())).append(")\n");
        }

        return sql.append("    );\n").append("END").toString();
    }

    private static String addUnique(DbTable table, DbUnique unique) {
        return guarded(
                "SELECT 1 FROM sys.key_constraints WHERE name = " + literal(unique.name())
                        + " AND parent_object_id = OBJECT_ID(" + objectName(table) + ")",
                "ALTER TABLE " + qualify(table.schema(), table.name())
                        + " ADD CONSTRAINT " + quote(unique.name()) + " UNIQUE (" + quoteAll(unique.columns()) + ");");
    }

    private static String addCheck(DbTable table, DbCheck check) {
        return guarded(
                "SELECT 1 FROM sys.check_constraints WHERE name = " + literal(check.name())
                        + " AND parent_object_id = OBJECT_ID(" + objectName(table) + ")",
                "ALTER TABLE " + qualify(table.schema(), table.name())
                        + " ADD CONSTRAINT " + quote(check.name()) + " CHECK (" + check.expression() + ");");
    }

    private static String createIndex(DbTable table, DbIndex index) {
        return guarded(
                "SELECT 1 FROM sys.indexes WHERE name = " + literal(index.name())
                        + " AND object_id = OBJECT_ID(" + objectName(table) + ")",
                "CREATE " + (index.unique() ? "UNIQUE " : "") + "INDEX " + quote(index.name())
                        + " ON " + qualify(table.schema(), table.name()) + " (" + quoteAll(index.columns()) + ");");
    }

    private static String addForeignKey(DbTable table, DbForeignKey fk) {
        return guarded(
                "SELECT 1 FROM sys.foreign_keys WHERE name = " + literal(fk.name())
                        + " AND parent_object_id = OBJECT_ID(" + objectName(table) + ")",
                "ALTER TABLE " + qualify(table.schema(), table.name()) + " "
                        + foreignKeyClause(fk.name(), fk.columns(), fk.refSchema(), fk.refTable(), fk.refColumns(),
                        fk.onDelete(), fk.onUpdate()) + ";");
    }

    private static String guarded(String existsQuery, String statement) {
        return "IF NOT EXISTS (" + existsQuery + ")\n"
                + "BEGIN\n"
                + "    " + statement + "\n"
                + "END";
    }

    // N'[schema].[table]' for OBJECT_ID
    private static String objectName(DbTable table) {
        return literal(qualify(table.schema(), table.name()));
    }
}
