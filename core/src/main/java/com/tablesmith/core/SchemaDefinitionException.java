package com.tablesmith.core;

/**
 * Raised while building a schema model when entity annotations are invalid or contradictory,
 * e.g. a length on a non-string field or a foreign key pointing at a field that does not exist.
 */
public class SchemaDefinitionException extends TablesmithException {
    public SchemaDefinitionException(String message) {
        super(message);
    }

    public SchemaDefinitionException(String message, Throwable cause) {
        super(message, cause);
    }
}
