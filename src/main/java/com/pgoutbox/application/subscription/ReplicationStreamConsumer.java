package com.pgoutbox.application.subscription;

import com.pgoutbox.application.config.ReconnectPolicy;
import com.pgoutbox.application.config.SubscriptionOptions;
import com.pgoutbox.application.error.ErrorDirective;
import com.pgoutbox.application.port.out.MetricsPort;
import com.pgoutbox.application.port.out.ReplicationSlotManager;
import com.pgoutbox.application.port.out.WalStream;
import com.pgoutbox.application.port.out.WalStreamFactory;
import com.pgoutbox.domain.error.DispatchError;
import com.pgoutbox.domain.model.MessageEnvelope;
import com.pgoutbox.domain.model.ReplicationSlotSpec;
import com.pgoutbox.domain.model.Result;
import com.pgoutbox.domain.model.SubscriptionState;
import com.pgoutbox.domain.model.SubscriptionStatus;
import com.pgoutbox.domain.model.TableDescriptor;
import com.pgoutbox.domain.model.WalChange;
import com.pgoutbox.domain.model.WalPosition;
import com.pgoutbox.infrastructure.context.DispatchContext;
import com.pgoutbox.infrastructure.exception.ConnectionFailureException;
import com.pgoutbox.infrastructure.exception.SlotInUseException;
import com.pgoutbox.infrastructure.exception.SubscriptionAbortedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Streams outbox inserts from a replication slot and dispatches them one at a time, in commit order,
 * on a dedicated thread. Handled positions are confirmed to the server in batches; a failing row is
 * never confirmed unless the error processor lets it through.
 *
 * <p>A consumer runs once. Restarting a subscription creates a new consumer.
 */
public class ReplicationStreamConsumer {

    private static final Logger log = LoggerFactory.getLogger(ReplicationStreamConsumer.class);

    private final SubscriptionOptions options;
    private final ReplicationSlotManager slotManager;
    private final WalStreamFactory streamFactory;
    private final MessageDispatcher dispatcher;
    private final PositionTracker tracker;
    private final MetricsPort metrics;

    private final AtomicReference<SubscriptionState> state = new AtomicReference<>(SubscriptionState.DISCONNECTED);
    private final AtomicBoolean started = new AtomicBoolean();
    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private final CompletableFuture<Void> termination = new CompletableFuture<>();
    private final AtomicLong dispatched = new AtomicLong();
    private final AtomicLong failed = new AtomicLong();

    private boolean sessionStreamed;
    private boolean everStreamed;
    private Instant commitTime;

    public ReplicationStreamConsumer(
            SubscriptionOptions options,
            ReplicationSlotManager slotManager,
            WalStreamFactory streamFactory) {
        this(options, slotManager, streamFactory, new PositionTracker(options.confirmationPolicy()));
    }

    ReplicationStreamConsumer(
            SubscriptionOptions options,
            ReplicationSlotManager slotManager,
            WalStreamFactory streamFactory,
            PositionTracker tracker) {
        this.options = Objects.requireNonNull(options, "options");
        this.slotManager = Objects.requireNonNull(slotManager, "slotManager");
        this.streamFactory = Objects.requireNonNull(streamFactory, "streamFactory");
        this.tracker = Objects.requireNonNull(tracker, "tracker");
        this.metrics = options.metrics();
        this.dispatcher = new MessageDispatcher(options.registry(), metrics);
    }

    /**
     * Starts the subscription thread.
     *
     * @return a future completing when the consumer stops; exceptionally with
     *     {@link SubscriptionAbortedException} or {@link ConnectionFailureException} on failure
     */
    public CompletableFuture<Void> start() {
        if (!started.compareAndSet(false, true)) {
            throw new IllegalStateException("Consumer for slot " + slotName() + " already started");
        }
        Thread thread = new Thread(this::run, "outbox-subscription-" + slotName());
        thread.start();
        return termination;
    }

    /**
     * Requests a cooperative stop. The in-flight row is finished and handled positions are confirmed.
     */
    public CompletableFuture<Void> stop() {
        stopSignal.countDown();
        if (started.compareAndSet(false, true)) {
            state.set(SubscriptionState.STOPPED);
            termination.complete(null);
        }
        return termination;
    }

    public SubscriptionStatus status() {
        return new SubscriptionStatus(state.get(), tracker.confirmed(), dispatched.get(), failed.get());
    }

    public SubscriptionState state() {
        return state.get();
    }

    public CompletableFuture<Void> termination() {
        return termination;
    }

    void run() {
        try {
            runSessions();
            state.set(SubscriptionState.STOPPED);
            log.info("Subscription on slot {} stopped at {}", slotName(), tracker.confirmed());
            termination.complete(null);
        } catch (Throwable t) {
            state.set(SubscriptionState.STOPPED);
            log.error("Subscription on slot {} terminated: {}", slotName(), t.getMessage(), t);
            termination.completeExceptionally(t);
        }
    }

    private void runSessions() throws SQLException {
        ReconnectPolicy policy = options.reconnectPolicy();
        int attempt = 0;
        while (!stopRequested()) {
            state.set(SubscriptionState.CONNECTING);
            try {
                runSession();
                return;
            } catch (SQLException | ConnectionFailureException | SlotInUseException e) {
                if (stopRequested()) {
                    log.debug("Ignoring failure during shutdown of slot {}: {}", slotName(), e.getMessage());
                    return;
                }
                if (e instanceof SlotInUseException && !everStreamed) {
                    throw e;
                }
                if (sessionStreamed) {
                    attempt = 0;
                }
                attempt++;
                if (attempt > policy.maxAttempts()) {
                    throw new ConnectionFailureException(
                        "Replication on slot " + slotName() + " failed after " + policy.maxAttempts() + " reconnect attempts", e);
                }
                Duration delay = policy.delayFor(attempt);
                state.set(SubscriptionState.RECONNECTING);
                metrics.incrementReconnects();
                log.warn("Replication session on slot {} failed ({}), reconnecting in {} ms (attempt {}/{})",
                    slotName(), e.getMessage(), delay.toMillis(), attempt, policy.maxAttempts());
                awaitStop(delay);
            }
        }
    }

    private void runSession() throws SQLException {
        sessionStreamed = false;
        commitTime = null;
        ReplicationSlotSpec slot = options.slot();

        WalPosition start = WalPosition.INVALID;
        if (!slot.temporary()) {
            start = slotManager.ensureSlot(slot).confirmedPosition();
        }

        try (WalStream stream = streamFactory.open(slot, options.publication(), start)) {
            tracker.reset(stream.startPosition());
            metrics.recordConfirmedPosition(tracker.confirmed().value());
            state.set(SubscriptionState.STREAMING);
            sessionStreamed = true;
            everStreamed = true;
            log.info("Streaming {} from slot {} at {}", options.table(), slotName(), stream.startPosition());

            Duration pollInterval = options.confirmationPolicy().pollInterval();
            while (!stopRequested()) {
                Optional<WalChange> change = stream.poll();
                if (change.isEmpty()) {
                    if (tracker.hasPending()) {
                        confirm(stream);
                    }
                    awaitStop(pollInterval);
                    continue;
                }
                apply(change.get(), stream);
                if (tracker.shouldConfirm()) {
                    confirm(stream);
                }
            }

            if (tracker.hasPending()) {
                confirm(stream);
            }
        }
    }

    private void apply(WalChange change, WalStream stream) throws SQLException {
        if (change instanceof WalChange.Begin begin) {
            commitTime = begin.committedAt();
        } else if (change instanceof WalChange.Insert insert) {
            TableDescriptor table = options.table();
            if (table.matches(insert.schema(), insert.table())) {
                process(toEnvelope(insert), stream);
            }
        } else if (change instanceof WalChange.Commit commit) {
            tracker.markHandled(commit.endPosition());
            commitTime = null;
        }
    }

    private MessageEnvelope toEnvelope(WalChange.Insert insert) {
        TableDescriptor table = options.table();
        String discriminator = insert.columns().get(table.discriminator().name());
        return new MessageEnvelope(
            insert.columns().get(table.id().name()),
            discriminator != null ? discriminator : "",
            insert.columns().get(table.payload().name()),
            insert.position(),
            commitTime
        );
    }

    private void process(MessageEnvelope envelope, WalStream stream) throws SQLException {
        if (stopRequested()) {
            return;
        }
        DispatchContext.set(envelope);
        try {
            Result<Void, DispatchError> result = dispatcher.dispatch(envelope);
            if (result.isSuccess()) {
                dispatched.incrementAndGet();
                tracker.markHandled(envelope.position());
            } else {
                handleFailure(envelope, result.errorOrNull(), stream);
            }
        } finally {
            DispatchContext.clear();
        }
    }

    private void handleFailure(MessageEnvelope envelope, DispatchError error, WalStream stream) throws SQLException {
        ErrorDirective directive = options.errorProcessor().process(error, envelope);
        DispatchError last = error;

        if (directive instanceof ErrorDirective.Retry retry) {
            for (int attempt = 1; attempt <= retry.attempts(); attempt++) {
                if (awaitStop(retry.delayBefore(attempt))) {
                    log.info("Stop requested while retrying {} at {}", envelope.discriminator(), envelope.position());
                    return;
                }
                log.debug("Retrying {} at {} (attempt {}/{})",
                    envelope.discriminator(), envelope.position(), attempt, retry.attempts());
                Result<Void, DispatchError> result = dispatcher.dispatch(envelope);
                if (result.isSuccess()) {
                    dispatched.incrementAndGet();
                    tracker.markHandled(envelope.position());
                    return;
                }
                last = result.errorOrNull();
            }
            directive = retry.onExhausted();
        }

        failed.incrementAndGet();
        metrics.incrementFailures(last.code());

        if (directive instanceof ErrorDirective.Abort) {
            if (tracker.hasPending()) {
                confirm(stream);
            }
            throw new SubscriptionAbortedException(envelope, last);
        }
        tracker.markHandled(envelope.position());
    }

    private void confirm(WalStream stream) throws SQLException {
        WalPosition position = tracker.handled();
        stream.confirm(position);
        tracker.advance(position);
        metrics.recordConfirmedPosition(position.value());
        log.debug("Confirmed {} on slot {}", position, slotName());
    }

    private boolean stopRequested() {
        return stopSignal.getCount() == 0;
    }

    /**
     * Waits for the given time or until stop is requested.
     *
     * @return true if stop was requested
     */
    private boolean awaitStop(Duration timeout) {
        if (timeout.isZero() || timeout.isNegative()) {
            return stopRequested();
        }
        try {
            return stopSignal.await(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            stopSignal.countDown();
            return true;
        }
    }

    private String slotName() {
        return options.slot().slotName();
    }
}
