package com.tablesmith.core.migration.operations;

/**
 * Extension point for operations outside the built-in set. A generator that does not recognise
 * an implementation rejects it with an
 * {@link com.tablesmith.core.UnsupportedMigrationOperationException}.
 */
public non-sealed interface CustomOperation extends MigrationOperation {
}
