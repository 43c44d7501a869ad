package com.tablesmith.core.migration;

public interface MigrationLockProvider {
    /**
     * Blocks until the exclusive lock for {@code scope} is held.
     *
     * @throws com.tablesmith.core.MigrationLockException on timeout or when the database refuses the lock
     */
    MigrationLock acquire(String scope);
}
