package com.pgoutbox.infrastructure.exception;

import com.pgoutbox.domain.error.DispatchError;
import com.pgoutbox.domain.model.MessageEnvelope;

/**
 * The error processor decided to stop on a row. The row's position was not confirmed,
 * so the next subscription on the same slot receives it again.
 */
public class SubscriptionAbortedException extends OutboxException {

    private final transient MessageEnvelope envelope;
    private final transient DispatchError error;

    public SubscriptionAbortedException(MessageEnvelope envelope, DispatchError error) {
        super("SUBSCRIPTION_ABORTED",
            "Subscription aborted at " + envelope.position() + ": " + error.message(),
            causeOf(error));
        this.envelope = envelope;
        this.error = error;
    }

    public MessageEnvelope getEnvelope() {
        return envelope;
    }

    public DispatchError getError() {
        return error;
    }

    private static Throwable causeOf(DispatchError error) {
        if (error instanceof DispatchError.HandlerFailed failed) {
            return failed.cause();
        }
        if (error instanceof DispatchError.MappingFailed failed) {
            return failed.cause();
        }
        return null;
    }
}
