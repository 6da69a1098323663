package com.pgoutbox.application.port.out;

/**
 * Port for recording subscription metrics.
 * Keeps the engine free of the metrics library.
 */
public interface MetricsPort {

    void incrementDispatched(String discriminator);

    void incrementFailures(String errorCode);

    void incrementPublished(String discriminator);

    void incrementReconnects();

    void recordConfirmedPosition(long lsn);

    void recordDispatchDuration(long nanos);

    MetricsPort NOOP = new MetricsPort() {
        @Override
        public void incrementDispatched(String discriminator) {
        }

        @Override
        public void incrementFailures(String errorCode) {
        }

        @Override
        public void incrementPublished(String discriminator) {
        }

        @Override
        public void incrementReconnects() {
        }

        @Override
        public void recordConfirmedPosition(long lsn) {
        }

        @Override
        public void recordDispatchDuration(long nanos) {
        }
    };
}
