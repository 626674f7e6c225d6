package io.cardlink.realtime.client;

import io.cardlink.realtime.core.ConnectionState;
import io.cardlink.realtime.core.DisconnectReason;

import java.time.Duration;

/**
 * Lifecycle callbacks of a channel, invoked on its event loop. All methods default to no-ops.
 */
public interface ConnectionListener {

    default void onConnected() {}

    /**
     * An automatic reconnect has been scheduled.
     *
     * @param attempt 1-based attempt number
     * @param delay wait before the attempt
     */
    default void onReconnecting(int attempt, Duration delay) {}

    /**
     * The channel stopped and will not reconnect on its own. Not called for {@code disconnect()}.
     */
    default void onDisconnected(DisconnectReason reason) {}

    /**
     * A transport error. The channel decides about reconnecting by itself.
     */
    default void onError(Throwable error) {}

    default void onStateChanged(ConnectionState previous, ConnectionState current) {}
}
