package io.cardlink.realtime.client;

/**
 * Returned by registrations; {@link #unsubscribe()} is idempotent.
 */
@FunctionalInterface
public interface Subscription {
    void unsubscribe();
}
