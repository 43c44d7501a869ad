package com.tablesmith.dialects.sqlserver;

import com.tablesmith.core.migration.MigrationHistoryRepository;
import com.tablesmith.core.migration.MigrationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

/**
 * History ledger stored in a table (by default {@code dbo.__TablesmithMigrationsHistory}). Rows are
 * only ever inserted.
 */
public class SqlServerMigrationHistoryRepository implements MigrationHistoryRepository {
    private static final Logger logger = LoggerFactory.getLogger(SqlServerMigrationHistoryRepository.class);

    public static final String DEFAULT_SCHEMA = "dbo";
    public static final String DEFAULT_TABLE = "__TablesmithMigrationsHistory";

    private static final int LEDGER_TIMEOUT_SECONDS = 30;

    private final MigrationSession session;
    private final String schema;
    private final String table;

    public SqlServerMigrationHistoryRepository(MigrationSession session, String schema, String table) {
        this.session = session;
        this.schema = schema == null ? DEFAULT_SCHEMA : schema;
        this.table = table == null ? DEFAULT_TABLE : table;
    }

    public SqlServerMigrationHistoryRepository(MigrationSession session) {
        this(session, DEFAULT_SCHEMA, DEFAULT_TABLE);
    }

    @Override
    public void ensureCreated() {
        session.executeNonQuery(SqlServerTemplates.render("history/ensure-schema.sql", Map.of(
                "schema", schema,
                "createSchema", "CREATE SCHEMA " + SqlServerDialect.quote(schema)
        )), LEDGER_TIMEOUT_SECONDS);

        session.executeNonQuery(SqlServerTemplates.render("history/ensure-table.sql", Map.of(
                "schema", schema,
                "table", table,
                "qualifiedTable", SqlServerDialect.qualify(schema, table),
                "primaryKey", "PK_" + table
        )), LEDGER_TIMEOUT_SECONDS);

        logger.info("Migration history ledger {}.{} is ready", schema, table);
    }

    @Override
    public SortedSet<String> getAppliedIds() {
        String sql = SqlServerTemplates.render("history/applied-ids.sql", Map.of("schema", schema, "table", table));
        return new TreeSet<>(session.queryStrings(sql, LEDGER_TIMEOUT_SECONDS));
    }

    @Override
    public void insert(String migrationId, String name, String productVersion, Instant appliedAtUtc) {
        Objects.requireNonNull(migrationId, "migrationId");
        Objects.requireNonNull(name, "name of migration " + migrationId);
        Objects.requireNonNull(productVersion, "productVersion of migration " + migrationId);
        Objects.requireNonNull(appliedAtUtc, "appliedAtUtc of migration " + migrationId);
        LocalDateTime utc = LocalDateTime.ofInstant(appliedAtUtc, ZoneOffset.UTC);
        String sql = SqlServerTemplates.render("history/insert.sql", Map.of(
                "schema", schema,
                "table", table,
                "migrationId", migrationId,
                "name", name,
                "productVersion", productVersion,
                "appliedAtUtc", SqlServerDialect.DATETIME2_FORMAT.format(utc)
        ));
        session.executeNonQuery(sql, LEDGER_TIMEOUT_SECONDS);
        logger.debug("Recorded migration {} in {}.{}", migrationId, schema, table);
    }
}
