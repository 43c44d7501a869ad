package com.tablesmith.dialects.sqlserver;

import com.tablesmith.core.migration.MigrationSession;
import com.tablesmith.core.migration.TransactionalMigrationExecutor;

public class SqlServerMigrationExecutor implements TransactionalMigrationExecutor {
    private final MigrationSession session;

    public SqlServerMigrationExecutor(MigrationSession session) {
        this.session = session;
    }

    @Override
    public void executeBatch(String sql, int timeoutSeconds) {
        session.executeNonQuery(sql, timeoutSeconds);
    }

    @Override
    public void beginTransaction() {
        session.beginTransaction();
    }

    @Override
    public void commit() {
        session.commit();
    }

    @Override
    public void rollback() {
        session.rollback();
    }
}
