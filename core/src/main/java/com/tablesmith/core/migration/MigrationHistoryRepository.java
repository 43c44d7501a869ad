package com.tablesmith.core.migration;

import java.time.Instant;
import java.util.SortedSet;

/**
 * Append-only ledger of applied migrations.
 */
public interface MigrationHistoryRepository {
    void ensureCreated();

    SortedSet<String> getAppliedIds();

    void insert(String migrationId, String name, String productVersion, Instant appliedAtUtc);
}
