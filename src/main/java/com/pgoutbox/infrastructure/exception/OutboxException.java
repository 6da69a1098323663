package com.pgoutbox.infrastructure.exception;

/**
 * Base class for failures surfaced to the owning process. Carries a stable error code
 * that the REST layer and logs expose.
 */
public abstract class OutboxException extends RuntimeException {

    private final String errorCode;

    protected OutboxException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected OutboxException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
