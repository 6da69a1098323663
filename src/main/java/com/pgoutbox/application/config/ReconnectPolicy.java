package com.pgoutbox.application.config;

import java.time.Duration;
import java.util.Objects;

/**
 * Exponential backoff between replication sessions after a connection failure.
 */
public record ReconnectPolicy(int maxAttempts, Duration initialBackoff, double multiplier, Duration maxBackoff) {

    public static final ReconnectPolicy DEFAULT =
        new ReconnectPolicy(5, Duration.ofMillis(500), 2.0, Duration.ofSeconds(30));

    public ReconnectPolicy {
        if (maxAttempts < 0) {
            throw new IllegalArgumentException("maxAttempts must be >= 0");
        }
        Objects.requireNonNull(initialBackoff, "initialBackoff");
        Objects.requireNonNull(maxBackoff, "maxBackoff");
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0");
        }
    }

    public static ReconnectPolicy none() {
        return new ReconnectPolicy(0, Duration.ZERO, 1.0, Duration.ZERO);
    }

    /**
     * Delay before reconnect attempt {@code attempt} (1-based), capped at {@code maxBackoff}.
     */
    public Duration delayFor(int attempt) {
        double millis = initialBackoff.toMillis() * Math.pow(multiplier, Math.max(0, attempt - 1));
        long capped = (long) Math.min(millis, (double) maxBackoff.toMillis());
        return Duration.ofMillis(capped);
    }
}
