package com.tablesmith.core.migration;

import java.util.List;

/**
 * A single database connection with at most one active transaction.
 *
 * <p>Implementations are not thread-safe, except for {@link #cancel()}, which may be called from
 * another thread to abort the statement currently running.
 */
public interface MigrationSession extends AutoCloseable {

    /**
     * @throws IllegalStateException if a transaction is already active
     */
    void beginTransaction();

    void commit();

    /**
     * Rolls back the active transaction, if any. Failures while rolling back are logged and
     * swallowed so they never hide the error that triggered the rollback.
     */
    void rollback();

    boolean isInTransaction();

    int executeNonQuery(String sql, int timeoutSeconds);

    Object executeScalar(String sql, int timeoutSeconds);

    /**
     * Reads the first column of every row as a string.
     */
    List<String> queryStrings(String sql, int timeoutSeconds);

    void cancel();

    @Override
    void close();
}
