package com.pgoutbox.application.subscription;

import com.pgoutbox.application.port.out.MetricsPort;
import com.pgoutbox.application.registry.MapperRegistry;
import com.pgoutbox.application.registry.RegistryEntry;
import com.pgoutbox.domain.error.DispatchError;
import com.pgoutbox.domain.model.MessageEnvelope;
import com.pgoutbox.domain.model.Result;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.Optional;

/**
 * Routes one envelope to its registered handler. Failures come back as {@link DispatchError} values.
 */
public class MessageDispatcher {

    private static final Logger log = LoggerFactory.getLogger(MessageDispatcher.class);

    private final MapperRegistry registry;
    private final MetricsPort metrics;

    public MessageDispatcher(MapperRegistry registry, MetricsPort metrics) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
    }

    public Result<Void, DispatchError> dispatch(MessageEnvelope envelope) {
        Optional<RegistryEntry<?>> entry = registry.lookup(envelope.discriminator());
        if (entry.isEmpty()) {
            return Result.failure(new DispatchError.UnknownDiscriminator(envelope.discriminator()));
        }

        long startedAt = System.nanoTime();
        Result<Void, DispatchError> result = deliver(entry.get(), envelope);
        metrics.recordDispatchDuration(System.nanoTime() - startedAt);
        if (result.isSuccess()) {
            metrics.incrementDispatched(envelope.discriminator());
            log.debug("Dispatched {} at {}", envelope.discriminator(), envelope.position());
        }
        return result;
    }

    private <T> Result<Void, DispatchError> deliver(RegistryEntry<T> entry, MessageEnvelope envelope) {
        T message;
        try {
            message = entry.mapper().map(envelope.payload());
        } catch (Exception e) {
            return Result.failure(new DispatchError.MappingFailed(envelope.discriminator(), e));
        }

        try {
            entry.handler().handle(message);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Result.failure(new DispatchError.HandlerFailed(envelope.discriminator(), e));
        } catch (Exception e) {
            return Result.failure(new DispatchError.HandlerFailed(envelope.discriminator(), e));
        }
        return Result.ok();
    }
}
