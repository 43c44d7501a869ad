package com.tablesmith.dialects.sqlserver;

import com.tablesmith.core.TablesmithException;
import com.tablesmith.core.migration.MigrationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;

/**
 * Owns one JDBC connection for the length of a migration run. The advisory lock, the history
 * ledger and the migration batches all go through the same session, so a session-owned
 * {@code sp_getapplock} is held by the connection that does the work.
 */
public class SqlServerMigrationSession implements MigrationSession {
    private static final Logger logger = LoggerFactory.getLogger(SqlServerMigrationSession.class);

    private final Connection connection;
    private boolean inTransaction;
    private volatile Statement current;
    private volatile boolean cancelRequested;

    public SqlServerMigrationSession(Connection connection) {
        this.connection = connection;
    }

    public static SqlServerMigrationSession open(DataSource dataSource) {
        try {
            return new SqlServerMigrationSession(dataSource.getConnection());
        } catch (SQLException e) {
            throw new TablesmithException("Failed to open migration connection", e);
        }
    }

    public static SqlServerMigrationSession open(String jdbcUrl, String username, String password) {
        try {
            return new SqlServerMigrationSession(DriverManager.getConnection(jdbcUrl, username, password));
        } catch (SQLException e) {
            throw new TablesmithException("Failed to open migration connection to " + jdbcUrl, e);
        }
    }

    @Override
    public void beginTransaction() {
        if (inTransaction) {
            throw new IllegalStateException("A transaction is already active on this session");
        }
        try {
            connection.setAutoCommit(false);
            inTransaction = true;
        } catch (SQLException e) {
            throw new TablesmithException("Failed to begin transaction", e);
        }
    }

    @Override
    public void commit() {
        if (!inTransaction) {
            throw new IllegalStateException("No active transaction to commit");
        }
        try {
            connection.commit();
            connection.setAutoCommit(true);
            inTransaction = false;
        } catch (SQLException e) {
            throw new TablesmithException("Failed to commit transaction", e);
        }
    }

    @Override
    public void rollback() {
        if (!inTransaction) {
            return;
        }
        inTransaction = false;
        try {
            connection.rollback();
        } catch (SQLException e) {
            logger.warn("Rollback failed; the original error is still reported", e);
        }
        try {
            connection.setAutoCommit(true);
        } catch (SQLException e) {
            logger.warn("Failed to restore autocommit after rollback", e);
        }
    }

    @Override
    public boolean isInTransaction() {
        return inTransaction;
    }

    @Override
    public int executeNonQuery(String sql, int timeoutSeconds) {
        try (Statement stmt = prepare(timeoutSeconds)) {
            boolean isResultSet = stmt.execute(sql);
            int affected = 0;
            while (true) {
                if (isResultSet) {
                    try (ResultSet ignored = stmt.getResultSet()) {
                        // drained so later errors in the batch surface
                    }
                } else {
                    int count = stmt.getUpdateCount();
                    if (count == -1) {
                        break;
                    }
                    affected += count;
                }
                isResultSet = stmt.getMoreResults();
            }
            return affected;
        } catch (SQLException e) {
            throw failed(sql, e);
        } finally {
            current = null;
        }
    }

    @Override
    public Object executeScalar(String sql, int timeoutSeconds) {
        try (Statement stmt = prepare(timeoutSeconds)) {
            try (ResultSet rs = firstResultSet(stmt, sql)) {
                if (rs == null || !rs.next()) {
                    return null;
                }
                return rs.getObject(1);
            }
        } catch (SQLException e) {
            throw failed(sql, e);
        } finally {
            current = null;
        }
    }

    @Override
    public List<String> queryStrings(String sql, int timeoutSeconds) {
        try (Statement stmt = prepare(timeoutSeconds)) {
            List<String> values = new ArrayList<>();
            try (ResultSet rs = firstResultSet(stmt, sql)) {
                while (rs != null && rs.next()) {
                    values.add(rs.getString(1));
                }
            }
            return values;
        } catch (SQLException e) {
            throw failed(sql, e);
        } finally {
            current = null;
        }
    }

    /**
     * Cancels the statement in flight, if any. Safe to call from another thread.
     */
    @Override
    public void cancel() {
        cancelRequested = true;
        Statement stmt = current;
        if (stmt == null) {
            return;
        }
        try {
            stmt.cancel();
        } catch (SQLException e) {
            logger.warn("Failed to cancel running statement", e);
        }
    }

    @Override
    public void close() {
        rollback();
        try {
            connection.close();
        } catch (SQLException e) {
            throw new TablesmithException("Failed to close migration connection", e);
        }
    }

    private Statement prepare(int timeoutSeconds) throws SQLException {
        if (cancelRequested) {
            cancelRequested = false;
            rollback();
            throw new CancellationException("Migration session was cancelled");
        }
        Statement stmt = connection.createStatement();
        stmt.setQueryTimeout(timeoutSeconds);
        current = stmt;
        return stmt;
    }

    private static ResultSet firstResultSet(Statement stmt, String sql) throws SQLException {
        boolean isResultSet = stmt.execute(sql);
        while (!isResultSet) {
            if (stmt.getUpdateCount() == -1) {
                return null;
            }
            isResultSet = stmt.getMoreResults();
        }
        return stmt.getResultSet();
    }

    private RuntimeException failed(String sql, SQLException e) {
        rollback();
        if (cancelRequested) {
            cancelRequested = false;
            CancellationException cancelled = new CancellationException("Batch cancelled:\n" + sql);
            cancelled.initCause(e);
            return cancelled;
        }
        return new TablesmithException("SQL batch failed (error " + e.getErrorCode() + "): " + e.getMessage()
                + System.lineSeparator() + sql, e);
    }
}
