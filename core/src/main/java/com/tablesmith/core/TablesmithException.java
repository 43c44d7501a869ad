package com.tablesmith.core;

/**
 * Base type for every failure raised by the schema and migration pipeline.
 */
public class TablesmithException extends RuntimeException {
    public TablesmithException(String message) {
        super(message);
    }

    public TablesmithException(String message, Throwable cause) {
        super(message, cause);
    }
}
