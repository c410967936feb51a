package com.z254.maestro.bus;

/**
 * Handle returned by {@link MessageBus#subscribe}; cancelling it detaches the handler.
 */
@FunctionalInterface
public interface Subscription {

    void cancel();
}
