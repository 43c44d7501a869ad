package com.tablesmith.dialects.sqlserver;

import com.tablesmith.core.UnsupportedMigrationOperationException;
import com.tablesmith.core.migration.MigrationSqlGenerator;
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
import com.tablesmith.core.migration.operations.SqlOp;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

import static com.tablesmith.dialects.sqlserver.SqlServerDialect.columnDefinition;
import static com.tablesmith.dialects.sqlserver.SqlServerDialect.foreignKeyClause;
import static com.tablesmith.dialects.sqlserver.SqlServerDialect.qualify;
import static com.tablesmith.dialects.sqlserver.SqlServerDialect.quote;
import static com.tablesmith.dialects.sqlserver.SqlServerDialect.quoteAll;

/**
 * Incremental generation: one or more batches per operation, in input order, with every foreign
 * key (standalone or declared by a {@link CreateTableOp}) held back and appended at the end.
 */
public class SqlServerMigrationSqlGenerator implements MigrationSqlGenerator {
    private static final Logger logger = LoggerFactory.getLogger(SqlServerMigrationSqlGenerator.class);

    private final SqlServerScriptSplitter splitter;

    public SqlServerMigrationSqlGenerator(SqlServerScriptSplitter splitter) {
        this.splitter = splitter;
    }

    public SqlServerMigrationSqlGenerator() {
        this(new SqlServerScriptSplitter(SqlServerScriptSplitter.DEFAULT_SEPARATOR));
    }

    @Override
    public List<String> generate(List<MigrationOperation> operations) {
        List<String> batches = new ArrayList<>();
        List<AddForeignKeyOp> deferred = new ArrayList<>();

        for (MigrationOperation operation : operations) {
            translate(operation, batches, deferred);
        }

        for (AddForeignKeyOp fk : deferred) {
            batches.add(addForeignKey(fk));
        }

        logger.debug("Generated {} batches from {} operations ({} deferred foreign keys)",
                batches.size(), operations.size(), deferred.size());
        return batches;
    }

    private void translate(MigrationOperation operation, List<String> batches, List<AddForeignKeyOp> deferred) {
        if (operation instanceof SqlOp op) {
            batches.add(op.sql());
        } else if (operation instanceof CreateTableOp op) {
            batches.add(createTable(op));
            op.uniques().forEach(u -> batches.add(addUnique(u)));
            op.checks().forEach(c -> batches.add(addCheck(c)));
            op.indexes().forEach(i -> batches.add(createIndex(i)));
            deferred.addAll(op.foreignKeys());
        } else if (operation instanceof DropTableOp op) {
            batches.add("DROP TABLE " + qualify(op.schema(), op.name()) + ";");
        } else if (operation instanceof AddColumnOp op) {
            batches.add("ALTER TABLE " + qualify(op.schema(), op.table()) + " ADD " + columnDefinition(op, null) + ";");
        } else if (operation instanceof DropColumnOp op) {
            batches.add("ALTER TABLE " + qualify(op.schema(), op.table()) + " DROP COLUMN " + quote(op.name()) + ";");
        } else if (operation instanceof AddPrimaryKeyOp op) {
            batches.add("ALTER TABLE " + qualify(op.schema(), op.table()) + " ADD CONSTRAINT " + quote(op.name())
                    + " PRIMARY KEY (" + quoteAll(op.columns()) + ");");
        } else if (operation instanceof DropPrimaryKeyOp op) {
            batches.add(dropConstraint(op.schema(), op.table(), op.name()));
        } else if (operation instanceof AddUniqueOp op) {
            batches.add(addUnique(op));
        } else if (operation instanceof DropUniqueOp op) {
            batches.add(dropConstraint(op.schema(), op.table(), op.name()));
        } else if (operation instanceof AddCheckOp op) {
            batches.add(addCheck(op));
        } else if (operation instanceof DropCheckOp op) {
            batches.add(dropConstraint(op.schema(), op.table(), op.name()));
        } else if (operation instanceof CreateIndexOp op) {
            batches.add(createIndex(op));
        } else if (operation instanceof DropIndexOp op) {
            batches.add("DROP INDEX " + quote(op.name()) + " ON " + qualify(op.schema(), op.table()) + ";");
        } else if (operation instanceof AddForeignKeyOp op) {
            deferred.add(op);
        } else if (operation instanceof DropForeignKeyOp op) {
            batches.add(dropConstraint(op.schema(), op.table(), op.name()));
        } else if (operation instanceof CreateOrAlterViewOp op) {
            batches.addAll(splitter.splitBatches(op.definitionSql()));
        } else if (operation instanceof DropViewOp op) {
            batches.add("DROP VIEW " + qualify(op.schema(), op.name()) + ";");
        } else if (operation instanceof CreateOrAlterRoutineOp op) {
            batches.addAll(splitter.splitBatches(op.definitionSql()));
        } else if (operation instanceof DropRoutineOp op) {
            batches.add("DROP " + routineKeyword(op) + " " + qualify(op.schema(), op.name()) + ";");
        } else if (operation instanceof CreateOrAlterTriggerOp op) {
            batches.addAll(splitter.splitBatches(op.definitionSql()));
        } else if (operation instanceof DropTriggerOp op) {
            batches.add("DROP TRIGGER " + qualify(op.schema(), op.name()) + ";");
        } else {
            throw new UnsupportedMigrationOperationException(operation);
        }
    }

    private static String createTable(CreateTableOp op) {
        StringBuilder sql = new StringBuilder()
                .append("CREATE TABLE ").append(qualify(op.schema(), op.name())).append("\n")
                .append("(\n");

        List<AddColumnOp> columns = op.columns();
        for (int i = 0; i < columns.size(); i++) {
            sql.append("    ").append(columnDefinition(columns.get(i), null));
            if (i < columns.size() - 1 || op.primaryKey() != null) {
                sql.append(',');
            }
            sql.append('\n');
        }

        if (op.primaryKey() != null) {
            sql.append("    CONSTRAINT ").append(quote(op.primaryKey().name()))
                    .append(" PRIMARY KEY (").append(quoteAll(op.primaryKey().columns())).append(")\n");
        }

        return sql.append(");").toString();
    }

    private static String addUnique(AddUniqueOp op) {
        return "ALTER TABLE " + qualify(op.schema(), op.table()) + " ADD CONSTRAINT " + quote(op.name())
                + " UNIQUE (" + quoteAll(op.columns()) + ");";
    }

    private static String addCheck(AddCheckOp op) {
        return "ALTER TABLE " + qualify(op.schema(), op.table()) + " ADD CONSTRAINT " + quote(op.name())
                + " CHECK (" + op.expression() + ");";
    }

    private static String createIndex(CreateIndexOp op) {
        return "CREATE " + (op.unique() ? "UNIQUE " : "") + "INDEX " + quote(op.name())
                + " ON " + qualify(op.schema(), op.table()) + " (" + quoteAll(op.columns()) + ");";
    }

    private static String addForeignKey(AddForeignKeyOp op) {
        return "ALTER TABLE " + qualify(op.schema(), op.table()) + " "
                + foreignKeyClause(op.name(), op.columns(), op.refSchema(), op.refTable(), op.refColumns(),
                op.onDelete(), op.onUpdate()) + ";";
    }

    private static String dropConstraint(String schema, String table, String name) {
        return "ALTER TABLE " + qualify(schema, table) + " DROP CONSTRAINT " + quote(name) + ";";
    }

    private static String routineKeyword(DropRoutineOp op) {
        switch (op.kind()) {
            case SCALAR_FUNCTION:
            case TABLE_FUNCTION:
                return "FUNCTION";
            default:
                return "PROCEDURE";
        }
    }
}
