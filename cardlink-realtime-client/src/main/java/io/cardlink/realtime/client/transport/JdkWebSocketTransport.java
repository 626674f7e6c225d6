package io.cardlink.realtime.client.transport;

import io.cardlink.realtime.core.Protocol;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;

/**
 * Transport implementation using {@link java.net.http.WebSocket}.
 */
public final class JdkWebSocketTransport implements SocketTransport {
    private static final Logger LOG = LoggerFactory.getLogger(JdkWebSocketTransport.class);

    private final HttpClient http;

    /**
     * Creates a new transport.
     *
     * @param http the JDK HttpClient to use
     */
    public JdkWebSocketTransport(HttpClient http) {
        this.http = Objects.requireNonNull(http, "http");
    }

    public static JdkWebSocketTransport create() {
        return new JdkWebSocketTransport(HttpClient.newHttpClient());
    }

    @Override
    public SocketHandle open(URI url, SocketListener listener) {
        JdkSocketHandle handle = new JdkSocketHandle(listener);
        try {
            http.newWebSocketBuilder()
                    .buildAsync(url, handle)
                    .whenComplete((ws, err) -> {
                        if (err != null) handle.failed(err);
                    });
        } catch (IllegalArgumentException e) {
            handle.failed(e);
        }
        return handle;
    }

    static final class JdkSocketHandle extends AbstractSocketHandle implements WebSocket.Listener {
        private final StringBuilder partial = new StringBuilder();
        // binary fragments may split a UTF-8 sequence, so they are decoded once complete
        private final ByteArrayOutputStream partialBytes = new ByteArrayOutputStream();
        private volatile WebSocket ws;
        private volatile boolean cancelled;
        // java.net.http.WebSocket rejects a send while the previous one is outstanding
        private CompletableFuture<?> sendChain = CompletableFuture.completedFuture(null);

        JdkSocketHandle(SocketListener listener) {
            super(listener);
        }

        @Override
        public void onOpen(WebSocket webSocket) {
            this.ws = webSocket;
            if (cancelled) {
                webSocket.abort();
                fireClose(Protocol.CLOSE_ABNORMAL, "cancelled");
                return;
            }
            webSocket.request(1);
            fireOpen();
        }

        @Override
        public CompletionStage<?> onText(WebSocket webSocket, CharSequence data, boolean last) {
            partial.append(data);
            if (last) {
                String text = partial.toString();
                partial.setLength(0);
                fireMessage(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onBinary(WebSocket webSocket, ByteBuffer data, boolean last) {
            byte[] bytes = new byte[data.remaining()];
            data.get(bytes);
            partialBytes.write(bytes, 0, bytes.length);
            if (last) {
                String text = partialBytes.toString(StandardCharsets.UTF_8);
                partialBytes.reset();
                fireMessage(text);
            }
            webSocket.request(1);
            return null;
        }

        @Override
        public CompletionStage<?> onClose(WebSocket webSocket, int statusCode, String reason) {
            fireClosing(statusCode, reason);
            fireClose(statusCode, reason);
            return null;
        }

        @Override
        public void onError(WebSocket webSocket, Throwable error) {
            failed(error);
        }

        void failed(Throwable error) {
            Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
            if (isClosed()) {
                return;
            }
            fireError(cause);
            fireClose(Protocol.CLOSE_ABNORMAL, cause.getMessage());
        }

        @Override
        public synchronized boolean send(String text) {
            WebSocket socket = ws;
            if (socket == null || isClosed() || socket.isOutputClosed()) {
                return false;
            }
            sendChain = sendChain
                    .handle((r, e) -> null)
                    .thenCompose(v -> socket.sendText(text, true))
                    .whenComplete((r, e) -> {
                        if (e != null) LOG.debug("Send failed: {}", e.toString());
                    });
            return true;
        }

        @Override
        public synchronized void close(int code, String reason) {
            WebSocket socket = ws;
            if (socket == null) {
                cancel();
                return;
            }
            if (socket.isOutputClosed()) {
                return;
            }
            sendChain = sendChain
                    .handle((r, e) -> null)
                    .thenCompose(v -> socket.sendClose(code, reason == null ? "" : reason))
                    .whenComplete((r, e) -> {
                        if (e != null) socket.abort();
                    });
        }

        @Override
        public void cancel() {
            cancelled = true;
            WebSocket socket = ws;
            if (socket != null) {
                socket.abort();
                fireClose(Protocol.CLOSE_ABNORMAL, "cancelled");
            }
        }
    }
}
