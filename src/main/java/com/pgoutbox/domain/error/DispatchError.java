package com.pgoutbox.domain.error;

/**
 * Sealed type representing the expected ways delivering one outbox row can fail.
 * These are routed through the error processor, not thrown.
 */
public sealed interface DispatchError {

    String discriminator();

    String message();

    String code();

    record UnknownDiscriminator(String discriminator) implements DispatchError {
        @Override
        public String message() {
            return "No handler registered for discriminator '" + discriminator + "'";
        }

        @Override
        public String code() {
            return "UNKNOWN_DISCRIMINATOR";
        }
    }

    /**
     * The payload could not be converted into the shape the handler expects.
     */
    record MappingFailed(String discriminator, Exception cause) implements DispatchError {
        @Override
        public String message() {
            return "Payload of '" + discriminator + "' could not be mapped: " + cause.getMessage();
        }

        @Override
        public String code() {
            return "MAPPING_FAILED";
        }
    }

    record HandlerFailed(String discriminator, Exception cause) implements DispatchError {
        @Override
        public String message() {
            return "Handler for '" + discriminator + "' failed: " + cause.getMessage();
        }

        @Override
        public String code() {
            return "HANDLER_FAILED";
        }
    }
}
