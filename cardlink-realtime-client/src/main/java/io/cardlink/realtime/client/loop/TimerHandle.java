package io.cardlink.realtime.client.loop;

/**
 * Handle to a scheduled task. Cancelling twice is harmless.
 */
@FunctionalInterface
public interface TimerHandle {
    void cancel();
}
