package com.tablesmith.core;

/**
 * Raised when the migration advisory lock cannot be obtained. The run must not go on.
 */
public class MigrationLockException extends TablesmithException {
    private final String scope;

    public MigrationLockException(String scope, String message) {
        super(message);
        this.scope = scope;
    }

    public MigrationLockException(String scope, String message, Throwable cause) {
        super(message, cause);
        this.scope = scope;
    }

    public String getScope() {
        return scope;
    }
}
