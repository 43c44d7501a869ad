package com.tablesmith.dialects.sqlserver;

public enum DatabaseEnsureStatus {
    ALREADY_EXISTS,
    CREATED,
    /** The target database is missing and {@code master} could not be opened. */
    SKIPPED_NO_MASTER_ACCESS,
    /** The login may not create databases. */
    SKIPPED_NO_CREATE_PERMISSION,
    FAILED
}
