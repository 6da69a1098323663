package com.pgoutbox.application.config;

import java.time.Duration;
import java.util.Objects;

/**
 * How often handled positions are reported back to the server.
 *
 * @param batchSize      confirm after this many handled positions
 * @param interval       confirm when this much time passed since the last confirmation
 * @param pollInterval   wait between reads when the stream has nothing pending
 * @param statusInterval pgjdbc keepalive status interval
 */
public record ConfirmationPolicy(int batchSize, Duration interval, Duration pollInterval, Duration statusInterval) {

    public static final ConfirmationPolicy DEFAULT =
        new ConfirmationPolicy(100, Duration.ofSeconds(1), Duration.ofMillis(10), Duration.ofSeconds(10));

    public ConfirmationPolicy {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1");
        }
        Objects.requireNonNull(interval, "interval");
        Objects.requireNonNull(pollInterval, "pollInterval");
        Objects.requireNonNull(statusInterval, "statusInterval");
    }
}
