package com.tablesmith.dialects.sqlserver;

import com.tablesmith.core.MigrationLockException;
import com.tablesmith.core.TablesmithException;
import com.tablesmith.core.migration.MigrationLock;
import com.tablesmith.core.migration.MigrationLockProvider;
import com.tablesmith.core.migration.MigrationSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Exclusive, session-owned application lock via {@code sp_getapplock}. The lock lives as long as
 * the session's connection, so it is also released if the process dies.
 */
public class SqlServerMigrationLockProvider implements MigrationLockProvider {
    private static final Logger logger = LoggerFactory.getLogger(SqlServerMigrationLockProvider.class);

    public static final int DEFAULT_TIMEOUT_MS = 30_000;

    private final MigrationSession session;
    private final int timeoutMs;

    public SqlServerMigrationLockProvider(MigrationSession session, int timeoutMs) {
        this.session = session;
        this.timeoutMs = timeoutMs;
    }

    public SqlServerMigrationLockProvider(MigrationSession session) {
        this(session, DEFAULT_TIMEOUT_MS);
    }

    @Override
    public MigrationLock acquire(String scope) {
        String sql = SqlServerTemplates.render("lock/acquire.sql", Map.of("scope", scope, "timeoutMs", timeoutMs));
        // the statement must outlive the lock wait
        int statementTimeoutSeconds = timeoutMs / 1000 + 30;

        Object result;
        try {
            result = session.executeScalar(sql, statementTimeoutSeconds);
        } catch (TablesmithException e) {
            throw new MigrationLockException(scope, "Failed to request migration lock '" + scope + "'", e);
        }

        if (result == null) {
            throw new MigrationLockException(scope, "sp_getapplock returned no result for '" + scope + "'");
        }
        int code = ((Number) result).intValue();
        if (code < 0) {
            throw new MigrationLockException(scope, "sp_getapplock failed for '" + scope + "', code=" + code
                    + " (" + describe(code) + ")");
        }

        logger.info("Acquired migration lock '{}'", scope);
        return new SqlServerMigrationLock(session, scope);
    }

    private static String describe(int code) {
        switch (code) {
            case -1:
                return "timed out after waiting";
            case -2:
                return "request cancelled";
            case -3:
                return "chosen as deadlock victim";
            default:
                return "parameter or call error";
        }
    }

    private static final class SqlServerMigrationLock implements MigrationLock {
        private final MigrationSession session;
        private final String scope;
        private boolean released;

        private SqlServerMigrationLock(MigrationSession session, String scope) {
            this.session = session;
            this.scope = scope;
        }

        @Override
        public String scope() {
            return scope;
        }

        @Override
        public void close() {
            if (released) {
                return;
            }
            released = true;
            session.executeNonQuery(SqlServerTemplates.render("lock/release.sql", Map.of("scope", scope)), 30);
            logger.info("Released migration lock '{}'", scope);
        }
    }
}
