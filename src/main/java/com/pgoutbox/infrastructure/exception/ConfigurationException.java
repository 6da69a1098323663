package com.pgoutbox.infrastructure.exception;

/**
 * Incomplete or contradictory subscription setup. Raised synchronously while options are built.
 */
public class ConfigurationException extends OutboxException {

    public ConfigurationException(String message) {
        super("CONFIGURATION_ERROR", message);
    }
}
