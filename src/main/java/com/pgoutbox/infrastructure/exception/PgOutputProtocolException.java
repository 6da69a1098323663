package com.pgoutbox.infrastructure.exception;

/**
 * A replication message could not be decoded. Not retried: the same bytes would arrive again.
 */
public class PgOutputProtocolException extends OutboxException {

    public PgOutputProtocolException(String message) {
        super("PROTOCOL_ERROR", message);
    }

    public PgOutputProtocolException(String message, Throwable cause) {
        super("PROTOCOL_ERROR", message, cause);
    }
}
