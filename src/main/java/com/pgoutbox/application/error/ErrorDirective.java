package com.pgoutbox.application.error;

import java.time.Duration;
import java.util.Objects;

/**
 * What the consumer does with a row that failed to dispatch.
 */
public sealed interface ErrorDirective permits ErrorDirective.Continue, ErrorDirective.Retry, ErrorDirective.Abort {

    /**
     * Treat the row as handled and move on.
     */
    enum Continue implements ErrorDirective {
        INSTANCE
    }

    /**
     * Stop the subscription without confirming the failing row.
     */
    enum Abort implements ErrorDirective {
        INSTANCE
    }

    /**
     * Re-dispatch up to {@code attempts} times, waiting {@code backoff * attempt} before each try,
     * then apply {@code onExhausted}.
     */
    record Retry(int attempts, Duration backoff, ErrorDirective onExhausted) implements ErrorDirective {

        public Retry {
            if (attempts < 1) {
                throw new IllegalArgumentException("attempts must be >= 1, got " + attempts);
            }
            Objects.requireNonNull(backoff, "backoff");
            Objects.requireNonNull(onExhausted, "onExhausted");
            if (backoff.isNegative()) {
                throw new IllegalArgumentException("backoff must not be negative");
            }
            if (onExhausted instanceof Retry) {
                throw new IllegalArgumentException("onExhausted must be Continue or Abort");
            }
        }

        public Duration delayBefore(int attempt) {
            return backoff.multipliedBy(attempt);
        }
    }

    static ErrorDirective skip() {
        return Continue.INSTANCE;
    }

    static ErrorDirective abort() {
        return Abort.INSTANCE;
    }

    static ErrorDirective retry(int attempts, Duration backoff, ErrorDirective onExhausted) {
        return new Retry(attempts, backoff, onExhausted);
    }
}
