package com.tablesmith.core.migration;

import com.tablesmith.core.migration.operations.MigrationOperation;

import java.util.List;

public interface MigrationSqlGenerator {
    /**
     * Translates operations, in order, into SQL batches ready to execute one at a time.
     * Foreign keys are emitted after every other batch.
     */
    List<String> generate(List<MigrationOperation> operations);
}
