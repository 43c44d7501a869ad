package com.tablesmith.core.migration;

public interface MigrationExecutor {
    void executeBatch(String sql, int timeoutSeconds);
}
