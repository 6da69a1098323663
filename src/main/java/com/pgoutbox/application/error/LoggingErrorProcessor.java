package com.pgoutbox.application.error;

import com.pgoutbox.domain.error.DispatchError;
import com.pgoutbox.domain.model.MessageEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;

/**
 * Default error processor. Rows nobody consumes are logged and skipped; mapping and handler
 * failures get the configured directive, which is {@link ErrorDirective.Abort} unless overridden.
 */
public class LoggingErrorProcessor implements ErrorProcessor {

    private static final Logger log = LoggerFactory.getLogger(LoggingErrorProcessor.class);

    private final ErrorDirective onFailure;

    public LoggingErrorProcessor() {
        this(ErrorDirective.abort());
    }

    public LoggingErrorProcessor(ErrorDirective onFailure) {
        this.onFailure = Objects.requireNonNull(onFailure, "onFailure");
    }

    @Override
    public ErrorDirective process(DispatchError error, MessageEnvelope envelope) {
        if (error instanceof DispatchError.UnknownDiscriminator) {
            log.warn("Skipping outbox row {} at {}: {}", envelope.messageId(), envelope.position(), error.message());
            return ErrorDirective.skip();
        }

        Throwable cause = null;
        if (error instanceof DispatchError.HandlerFailed failed) {
            cause = failed.cause();
        } else if (error instanceof DispatchError.MappingFailed failed) {
            cause = failed.cause();
        }
        log.error("Failed to dispatch outbox row {} at {} [{}]: {} -> {}",
            envelope.messageId(), envelope.position(), error.code(), error.message(),
            onFailure.getClass().getSimpleName(), cause);
        return onFailure;
    }

    public ErrorDirective getOnFailure() {
        return onFailure;
    }
}
