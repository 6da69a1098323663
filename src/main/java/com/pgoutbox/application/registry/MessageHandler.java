package com.pgoutbox.application.registry;

/**
 * Application callback for one message kind. Invoked on the subscription thread, one row at a time.
 * Delivery is at-least-once, so implementations must tolerate seeing the same message twice.
 */
@FunctionalInterface
public interface MessageHandler<T> {

    void handle(T message) throws Exception;
}
