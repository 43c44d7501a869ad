package com.tablesmith.core;

/**
 * Raised after a migration's transaction has been rolled back because one of its batches failed.
 */
public class MigrationExecutionException extends TablesmithException {
    private final String migrationId;
    private final int batchIndex;
    private final String batch;

    public MigrationExecutionException(String migrationId, int batchIndex, String batch, Throwable cause) {
        super(describe(migrationId, batchIndex, batch, cause), cause);
        this.migrationId = migrationId;
        this.batchIndex = batchIndex;
        this.batch = batch;
    }

    public String getMigrationId() {
        return migrationId;
    }

    /**
     * @return zero-based index of the failing batch, or -1 when the failure happened outside a batch
     */
    public int getBatchIndex() {
        return batchIndex;
    }

    public String getBatch() {
        return batch;
    }

    private static String describe(String migrationId, int batchIndex, String batch, Throwable cause) {
        StringBuilder sb = new StringBuilder("Migration '").append(migrationId).append("' failed");
        if (batchIndex >= 0) {
            sb.append(" at batch ").append(batchIndex + 1);
        }
        if (cause != null && cause.getMessage() != null) {
            sb.append(": ").append(cause.getMessage());
        }
        if (batch != null) {
            sb.append(System.lineSeparator()).append(batch);
        }
        return sb.toString();
    }
}
