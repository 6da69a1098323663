package com.pgoutbox.application.subscription;

import com.pgoutbox.application.config.ConfirmationPolicy;
import com.pgoutbox.domain.model.WalPosition;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Tracks the last handled WAL position and decides when it should be confirmed to the server.
 * The confirmed position only moves forward and never passes the handled one.
 * Written by the subscription thread only; {@link #confirmed()} may be read from any thread.
 */
public class PositionTracker {

    private final ConfirmationPolicy policy;
    private final Clock clock;

    private volatile WalPosition confirmed = WalPosition.INVALID;
    private WalPosition handled = WalPosition.INVALID;
    private int pending;
    private Instant lastConfirmedAt;

    public PositionTracker(ConfirmationPolicy policy) {
        this(policy, Clock.systemUTC());
    }

    public PositionTracker(ConfirmationPolicy policy, Clock clock) {
        this.policy = Objects.requireNonNull(policy, "policy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.lastConfirmedAt = clock.instant();
    }

    /**
     * Starts a new session from the server's confirmed position.
     */
    public void reset(WalPosition serverConfirmed) {
        WalPosition start = WalPosition.max(serverConfirmed, confirmed);
        confirmed = start;
        handled = start;
        pending = 0;
        lastConfirmedAt = clock.instant();
    }

    public void markHandled(WalPosition position) {
        if (position.isAfter(handled)) {
            handled = position;
            pending++;
        }
    }

    public boolean hasPending() {
        return handled.isAfter(confirmed);
    }

    public boolean shouldConfirm() {
        if (!hasPending()) {
            return false;
        }
        if (pending >= policy.batchSize()) {
            return true;
        }
        return !Duration.between(lastConfirmedAt, clock.instant()).minus(policy.interval()).isNegative();
    }

    /**
     * Position to report next: everything up to and including it was handled.
     */
    public WalPosition handled() {
        return handled;
    }

    /**
     * Records a successful confirmation. Positions behind the current one are ignored.
     */
    public void advance(WalPosition position) {
        if (position.isAfter(handled)) {
            throw new IllegalArgumentException("Cannot confirm " + position + " past handled position " + handled);
        }
        if (position.isAfter(confirmed)) {
            confirmed = position;
        }
        pending = 0;
        lastConfirmedAt = clock.instant();
    }

    public WalPosition confirmed() {
        return confirmed;
    }
}
