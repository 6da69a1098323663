package com.pgoutbox.domain.model;

public record SubscriptionStatus(
    SubscriptionState state,
    WalPosition confirmedPosition,
    long dispatched,
    long failed
) {

    public static SubscriptionStatus notStarted() {
        return new SubscriptionStatus(SubscriptionState.DISCONNECTED, WalPosition.INVALID, 0, 0);
    }
}
