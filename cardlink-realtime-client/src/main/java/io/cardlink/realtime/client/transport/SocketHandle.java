package io.cardlink.realtime.client.transport;

/**
 * One physical connection returned by {@link SocketTransport#open}.
 */
public interface SocketHandle {

    /**
     * Queues a text frame.
     *
     * @return false if the connection is not open or the frame was rejected
     */
    boolean send(String text);

    /**
     * Starts a graceful close handshake.
     */
    void close(int code, String reason);

    /**
     * Drops the connection without a handshake.
     */
    void cancel();

    /**
     * Stops delivering events to the listener. Used before a replacement handle is installed.
     */
    void detach();
}
