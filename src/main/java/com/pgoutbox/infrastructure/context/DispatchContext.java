package com.pgoutbox.infrastructure.context;

import com.pgoutbox.domain.model.MessageEnvelope;
import org.slf4j.MDC;

/**
 * Puts the row being dispatched into the logging context of the subscription thread.
 */
public final class DispatchContext {

    public static final String DISCRIMINATOR_KEY = "discriminator";
    public static final String LSN_KEY = "lsn";
    public static final String MESSAGE_ID_KEY = "messageId";

    private DispatchContext() {}

    public static void set(MessageEnvelope envelope) {
        MDC.put(DISCRIMINATOR_KEY, envelope.discriminator());
        MDC.put(LSN_KEY, envelope.position().toString());
        if (envelope.messageId() != null) {
            MDC.put(MESSAGE_ID_KEY, envelope.messageId());
        }
    }

    public static void clear() {
        MDC.remove(DISCRIMINATOR_KEY);
        MDC.remove(LSN_KEY);
        MDC.remove(MESSAGE_ID_KEY);
    }
}
