package com.tablesmith.core;

import com.tablesmith.core.migration.operations.MigrationOperation;

/**
 * Raised by a SQL generator that has no translation for an operation variant.
 */
public class UnsupportedMigrationOperationException extends TablesmithException {
    private final Class<?> operationType;

    public UnsupportedMigrationOperationException(MigrationOperation operation) {
        super("Operation not supported: " + (operation == null ? "null" : operation.getClass().getSimpleName()));
        this.operationType = operation == null ? null : operation.getClass();
    }

    public Class<?> getOperationType() {
        return operationType;
    }
}
