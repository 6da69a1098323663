package com.pgoutbox.application.subscription;

import com.pgoutbox.application.config.SubscriptionOptions;
import com.pgoutbox.application.port.in.GetSubscriptionStatusUseCase;
import com.pgoutbox.application.port.out.PublicationManager;
import com.pgoutbox.application.port.out.ReplicationSlotManager;
import com.pgoutbox.application.port.out.TableConformityManager;
import com.pgoutbox.application.port.out.WalStreamFactory;
import com.pgoutbox.domain.model.SubscriptionStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Entry point of the engine: prepares the outbox table, publication and slot, then runs a
 * {@link ReplicationStreamConsumer} until stopped.
 */
public class OutboxSubscription implements GetSubscriptionStatusUseCase {

    private static final Logger log = LoggerFactory.getLogger(OutboxSubscription.class);

    private static final Duration DEFAULT_STOP_TIMEOUT = Duration.ofSeconds(30);

    private final SubscriptionOptions options;
    private final TableConformityManager tableManager;
    private final PublicationManager publicationManager;
    private final ReplicationSlotManager slotManager;
    private final WalStreamFactory streamFactory;

    private ReplicationStreamConsumer consumer;

    public OutboxSubscription(
            SubscriptionOptions options,
            TableConformityManager tableManager,
            PublicationManager publicationManager,
            ReplicationSlotManager slotManager,
            WalStreamFactory streamFactory) {
        this.options = options;
        this.tableManager = tableManager;
        this.publicationManager = publicationManager;
        this.slotManager = slotManager;
        this.streamFactory = streamFactory;
    }

    /**
     * Runs setup synchronously, so schema conflicts and a busy slot surface to the caller,
     * then starts streaming in the background.
     *
     * @return a future completing when the subscription terminates
     */
    public synchronized CompletableFuture<Void> start() {
        if (isRunning()) {
            throw new IllegalStateException("Subscription on slot " + options.slot().slotName() + " is already running");
        }

        var outcome = tableManager.ensureTable(options.table());
        log.info("Outbox table {} {}", options.table(), outcome == TableConformityManager.EnsureOutcome.CREATED ? "created" : "verified");

        publicationManager.ensurePublication(options.publication());
        if (!options.slot().temporary()) {
            var slot = slotManager.ensureSlot(options.slot());
            log.info("Replication slot {} {} at {}", options.slot().slotName(),
                slot.created() ? "created" : "found", slot.confirmedPosition());
        }

        consumer = new ReplicationStreamConsumer(options, slotManager, streamFactory);
        log.info("Starting subscription for {} discriminator(s){} on publication {}",
            options.registry().discriminators().size(),
            options.registry().hasWildcard() ? " plus wildcard" : "",
            options.publication().name());
        return consumer.start();
    }

    public void stop() {
        stop(DEFAULT_STOP_TIMEOUT);
    }

    /**
     * Requests a stop and waits up to {@code timeout} for the consumer thread to finish.
     */
    public void stop(Duration timeout) {
        ReplicationStreamConsumer current;
        synchronized (this) {
            current = consumer;
        }
        if (current == null) {
            return;
        }
        try {
            current.stop().get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (ExecutionException e) {
            log.debug("Subscription had already terminated with failure: {}", e.getCause().getMessage());
        } catch (TimeoutException e) {
            log.warn("Subscription on slot {} did not stop within {} ms", options.slot().slotName(), timeout.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public synchronized boolean isRunning() {
        return consumer != null && !consumer.termination().isDone();
    }

    @Override
    public synchronized SubscriptionStatus getStatus() {
        return consumer == null ? SubscriptionStatus.notStarted() : consumer.status();
    }

    public SubscriptionOptions options() {
        return options;
    }
}
