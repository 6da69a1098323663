package com.pgoutbox.domain.model;

/**
 * Lifecycle of a replication stream consumer. {@link #STOPPED} is terminal.
 */
public enum SubscriptionState {
    DISCONNECTED,
    CONNECTING,
    STREAMING,
    RECONNECTING,
    STOPPED
}
