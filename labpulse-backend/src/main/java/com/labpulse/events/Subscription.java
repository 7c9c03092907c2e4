package com.labpulse.events;

/**
 * Handle returned by {@link MetricsEventBus#subscribe(MetricsListener)}.
 */
@FunctionalInterface
public interface Subscription {

    /**
     * Stop receiving payloads. Safe to call more than once.
     */
    void unsubscribe();
}
