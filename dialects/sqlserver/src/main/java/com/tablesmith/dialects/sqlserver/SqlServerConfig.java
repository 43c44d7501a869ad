package com.tablesmith.dialects.sqlserver;

/**
 * Connection and ledger settings for a SQL Server migration target.
 */
public class SqlServerConfig {
    public String jdbcUrl;
    public String username;
    public String password;
    public int maxPoolSize = 2;
    public int lockTimeoutMs = SqlServerMigrationLockProvider.DEFAULT_TIMEOUT_MS;
    public String historySchema = SqlServerMigrationHistoryRepository.DEFAULT_SCHEMA;
    public String historyTable = SqlServerMigrationHistoryRepository.DEFAULT_TABLE;
    public boolean createDatabase;
}
