package com.tablesmith.dialects.sqlserver;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.Locale;
import java.util.Map;

/**
 * Creates the target database when it does not exist yet and the login is allowed to.
 *
 * <p>Nothing here throws: every outcome, including failures, is reported as a
 * {@link DatabaseEnsureResult} so callers can decide whether to go on.
 */
public class SqlServerDatabaseBootstrap {
    private static final Logger logger = LoggerFactory.getLogger(SqlServerDatabaseBootstrap.class);

    /** "Cannot open database requested by the login." */
    static final int CANNOT_OPEN_DATABASE = 4060;

    private static final String MASTER = "master";
    private static final int OPEN_RETRIES = 2;
    private static final long RETRY_DELAY_MS = 150;

    @FunctionalInterface
    public interface ConnectionOpener {
        Connection open(String jdbcUrl) throws SQLException;
    }

    private final ConnectionOpener opener;

    public SqlServerDatabaseBootstrap(ConnectionOpener opener) {
        this.opener = opener;
    }

    public static DatabaseEnsureResult tryEnsureDatabaseExists(SqlServerConfig config) {
        return new SqlServerDatabaseBootstrap(url -> DriverManager.getConnection(url, config.username, config.password))
                .ensure(config.jdbcUrl);
    }

    public DatabaseEnsureResult ensure(String jdbcUrl) {
        String database = databaseName(jdbcUrl);
        if (database == null || database.isBlank()) {
            return new DatabaseEnsureResult(DatabaseEnsureStatus.FAILED, "<empty>",
                    new IllegalArgumentException("JDBC URL must name a database (databaseName=...): " + jdbcUrl));
        }

        SQLException openError = tryOpen(jdbcUrl);
        if (openError == null) {
            return new DatabaseEnsureResult(DatabaseEnsureStatus.ALREADY_EXISTS, database);
        }
        if (openError.getErrorCode() != CANNOT_OPEN_DATABASE) {
            return new DatabaseEnsureResult(DatabaseEnsureStatus.FAILED, database, openError);
        }

        logger.info("Database {} is not reachable; trying to create it through {}", database, MASTER);

        String masterUrl = withDatabase(jdbcUrl, MASTER);
        try (Connection master = opener.open(masterUrl)) {
            if (!exists(master, database)) {
                try (Statement stmt = master.createStatement()) {
                    stmt.execute(SqlServerTemplates.render("database/create.sql", Map.of("database", database)));
                } catch (SQLException e) {
                    return new DatabaseEnsureResult(DatabaseEnsureStatus.SKIPPED_NO_CREATE_PERMISSION, database, e);
                }
                logger.info("Created database {}", database);
            }
        } catch (SQLException e) {
            return new DatabaseEnsureResult(DatabaseEnsureStatus.SKIPPED_NO_MASTER_ACCESS, database, e);
        }

        for (int attempt = 0; attempt < OPEN_RETRIES; attempt++) {
            if (tryOpen(jdbcUrl) == null) {
                return new DatabaseEnsureResult(DatabaseEnsureStatus.CREATED, database);
            }
            try {
                Thread.sleep(RETRY_DELAY_MS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return new DatabaseEnsureResult(DatabaseEnsureStatus.FAILED, database, e);
            }
        }

        return new DatabaseEnsureResult(DatabaseEnsureStatus.FAILED, database,
                new IllegalStateException("Database '" + database + "' exists but cannot be opened after "
                        + OPEN_RETRIES + " attempts"));
    }

    private SQLException tryOpen(String jdbcUrl) {
        try (Connection ignored = opener.open(jdbcUrl)) {
            return null;
        } catch (SQLException e) {
            return e;
        }
    }

    private static boolean exists(Connection master, String database) throws SQLException {
        try (Statement stmt = master.createStatement();
             ResultSet rs = stmt.executeQuery(SqlServerTemplates.render("database/exists.sql", Map.of("database", database)))) {
            return rs.next() && rs.getInt(1) == 1;
        }
    }

    /**
     * Reads {@code databaseName} (or its alias {@code database}) from a
     * {@code jdbc:sqlserver://host;prop=value;...} URL.
     */
    static String databaseName(String jdbcUrl) {
        for (String part : jdbcUrl.split(";")) {
            int eq = part.indexOf('=');
            if (eq < 0) {
                continue;
            }
            String key = part.substring(0, eq).strip().toLowerCase(Locale.ROOT);
            if (key.equals("databasename") || key.equals("database")) {
                return part.substring(eq + 1).strip();
            }
        }
        return null;
    }

    static String withDatabase(String jdbcUrl, String database) {
        StringBuilder url = new StringBuilder();
        boolean replaced = false;
        for (String part : jdbcUrl.split(";")) {
            int eq = part.indexOf('=');
            String key = eq < 0 ? "" : part.substring(0, eq).strip().toLowerCase(Locale.ROOT);
            if (key.equals("databasename") || key.equals("database")) {
                part = part.substring(0, eq + 1) + database;
                replaced = true;
            }
            if (url.length() > 0) {
                url.append(';');
            }
            url.append(part);
        }
        if (!replaced) {
            url.append(";databaseName=").append(database);
        }
        return url.toString();
    }
}
