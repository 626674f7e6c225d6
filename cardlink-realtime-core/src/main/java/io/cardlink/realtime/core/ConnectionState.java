package io.cardlink.realtime.core;

/**
 * Lifecycle state of one channel client.
 */
public enum ConnectionState {
    DISCONNECTED,
    /** An attempt is in flight or a reconnect is scheduled. */
    CONNECTING,
    OPEN,
    /** The server started a close handshake. */
    CLOSING
}
