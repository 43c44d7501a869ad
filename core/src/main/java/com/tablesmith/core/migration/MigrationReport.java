package com.tablesmith.core.migration;

import java.util.List;

/**
 * Outcome of a successful run.
 *
 * @param applied ids applied by this run, in the order they ran
 * @param skipped ids that were already in the history ledger
 */
public record MigrationReport(List<String> applied, List<String> skipped) {
    public MigrationReport {
        applied = List.copyOf(applied);
        skipped = List.copyOf(skipped);
    }

    public boolean upToDate() {
        return applied.isEmpty();
    }
}
