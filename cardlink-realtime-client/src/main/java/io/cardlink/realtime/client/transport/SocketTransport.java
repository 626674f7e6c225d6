package io.cardlink.realtime.client.transport;

import java.net.URI;

/**
 * Opens WebSocket connections.
 *
 * <p>Implementations never throw for network faults; those are reported to the listener.
 */
public interface SocketTransport {
    SocketHandle open(URI url, SocketListener listener);
}
