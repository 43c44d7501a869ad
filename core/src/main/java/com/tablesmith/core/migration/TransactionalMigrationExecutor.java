package com.tablesmith.core.migration;

public interface TransactionalMigrationExecutor extends MigrationExecutor {
    void beginTransaction();

    void commit();

    void rollback();
}
