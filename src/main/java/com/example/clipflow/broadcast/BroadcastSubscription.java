package com.example.clipflow.broadcast;

/**
 * Handle returned by {@link BroadcastChannel#subscribe}. Cancelling twice is harmless.
 */
@FunctionalInterface
public interface BroadcastSubscription {
    void cancel();
}
