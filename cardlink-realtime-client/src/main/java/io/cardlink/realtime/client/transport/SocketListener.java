package io.cardlink.realtime.client.transport;

/**
 * Lifecycle events of one physical connection.
 *
 * <p>Events may arrive on a transport thread. A failure is reported as {@link #onError}
 * followed by {@link #onClose} with {@code 1006}; {@code onClose} is delivered at most once.
 */
public interface SocketListener {

    void onOpen();

    void onMessage(String text);

    void onError(Throwable error);

    /**
     * The server started a close handshake; {@link #onClose} follows.
     */
    default void onClosing(int code, String reason) {}

    void onClose(int code, String reason);
}
