package com.pgoutbox.application.error;

import com.pgoutbox.domain.error.DispatchError;
import com.pgoutbox.domain.model.MessageEnvelope;

/**
 * Policy hook consulted whenever a row fails to dispatch.
 * Called on the subscription thread; must not block for long.
 */
@FunctionalInterface
public interface ErrorProcessor {

    ErrorDirective process(DispatchError error, MessageEnvelope envelope);
}
