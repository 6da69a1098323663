package com.pgoutbox.infrastructure.exception;

/**
 * An existing table, publication or slot is incompatible with the configured one.
 */
public class SchemaConflictException extends OutboxException {

    public SchemaConflictException(String message) {
        super("SCHEMA_CONFLICT", message);
    }
}
