package com.pgoutbox.infrastructure.exception;

/**
 * The database could not be reached, or the replication connection dropped.
 * Retried by the consumer until its reconnect budget is exhausted.
 */
public class ConnectionFailureException extends OutboxException {

    public ConnectionFailureException(String message) {
        super("CONNECTION_FAILURE", message);
    }

    public ConnectionFailureException(String message, Throwable cause) {
        super("CONNECTION_FAILURE", message, cause);
    }
}
