package com.tablesmith.core.migration;

/**
 * A held advisory lock. Closing it more than once has no further effect.
 */
public interface MigrationLock extends AutoCloseable {
    String scope();

    @Override
    void close();
}
