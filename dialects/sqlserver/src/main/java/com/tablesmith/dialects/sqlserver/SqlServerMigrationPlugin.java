package com.tablesmith.dialects.sqlserver;

import com.tablesmith.core.TablesmithException;
import com.tablesmith.core.migration.Migration;
import com.tablesmith.core.migration.MigrationReport;
import com.tablesmith.core.migration.Migrator;
import com.tablesmith.core.migration.MigratorOptions;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Wires the SQL Server pieces into a {@link Migrator}. Connection pools are shared per JDBC URL
 * until {@link #cleanUp()}.
 */
public class SqlServerMigrationPlugin implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SqlServerMigrationPlugin.class);

    private final Map<String, HikariDataSource> dataSources = new HashMap<>();

    /**
     * Runs pending migrations against the configured database on a dedicated session. The lock,
     * the ledger and every batch share that session's connection.
     */
    public MigrationReport migrate(SqlServerConfig config, MigratorOptions options,
                                   Collection<? extends Migration> migrations) {
        if (config.createDatabase) {
            DatabaseEnsureResult ensured = SqlServerDatabaseBootstrap.tryEnsureDatabaseExists(config);
            logger.info("Database {}: {}", ensured.database(), ensured.status());
            if (!ensured.usable()) {
                throw new TablesmithException("Database " + ensured.database() + " is not usable: "
                        + ensured.status(), ensured.error());
            }
        }

        try (SqlServerMigrationSession session = SqlServerMigrationSession.open(getOrCreateDataSource(config))) {
            return createMigrator(session, config, options).migrate(migrations);
        }
    }

    public Migrator createMigrator(SqlServerMigrationSession session, SqlServerConfig config, MigratorOptions options) {
        return new Migrator(
                new SqlServerMigrationSqlGenerator(),
                new SqlServerMigrationHistoryRepository(session, config.historySchema, config.historyTable),
                new SqlServerMigrationLockProvider(session, config.lockTimeoutMs),
                new SqlServerMigrationExecutor(session),
                options
        );
    }

    DataSource getOrCreateDataSource(SqlServerConfig config) {
        if (config.jdbcUrl == null || config.jdbcUrl.isBlank()) {
            throw new TablesmithException("A JDBC URL is required");
        }

        return dataSources.computeIfAbsent(config.jdbcUrl, k -> {
            HikariConfig hikariConfig = new HikariConfig();
            hikariConfig.setJdbcUrl(config.jdbcUrl);
            hikariConfig.setPoolName("tablesmith-migrations");

            if (config.username != null) {
                hikariConfig.setUsername(config.username);
            }
            if (config.password != null) {
                hikariConfig.setPassword(config.password);
            }

            hikariConfig.setMaximumPoolSize(config.maxPoolSize);
            hikariConfig.setMinimumIdle(0);

            return new HikariDataSource(hikariConfig);
        });
    }

    public void cleanUp() {
        for (HikariDataSource dataSource : dataSources.values()) {
            dataSource.close();
        }
        dataSources.clear();
    }

    @Override
    public void close() {
        cleanUp();
    }
}
