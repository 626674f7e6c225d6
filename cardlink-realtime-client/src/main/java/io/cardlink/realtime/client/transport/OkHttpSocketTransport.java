package io.cardlink.realtime.client.transport;

import io.cardlink.realtime.core.Protocol;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.WebSocket;
import okhttp3.WebSocketListener;
import okio.ByteString;

import java.net.URI;
import java.util.Objects;

/**
 * {@link SocketTransport} implementation using OkHttp.
 *
 * <p>Requires {@code com.squareup.okhttp3:okhttp} on the classpath.
 */
public final class OkHttpSocketTransport implements SocketTransport {

    private final OkHttpClient httpClient;

    public OkHttpSocketTransport(OkHttpClient httpClient) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    }

    public static OkHttpSocketTransport create() {
        return new OkHttpSocketTransport(new OkHttpClient());
    }

    @Override
    public SocketHandle open(URI url, SocketListener listener) {
        OkHttpSocketHandle handle = new OkHttpSocketHandle(listener);
        Request request = new Request.Builder().url(url.toString()).build();
        handle.ws = httpClient.newWebSocket(request, handle.callbacks());
        return handle;
    }

    private static final class OkHttpSocketHandle extends AbstractSocketHandle {
        private volatile WebSocket ws;
        private volatile boolean open;

        OkHttpSocketHandle(SocketListener listener) {
            super(listener);
        }

        WebSocketListener callbacks() {
            return new WebSocketListener() {
                @Override
                public void onOpen(WebSocket webSocket, Response response) {
                    ws = webSocket;
                    open = true;
                    fireOpen();
                }

                @Override
                public void onMessage(WebSocket webSocket, String text) {
                    fireMessage(text);
                }

                @Override
                public void onMessage(WebSocket webSocket, ByteString bytes) {
                    fireMessage(bytes.utf8());
                }

                @Override
                public void onClosing(WebSocket webSocket, int code, String reason) {
                    open = false;
                    fireClosing(code, reason);
                    webSocket.close(Protocol.CLOSE_NORMAL, null);
                }

                @Override
                public void onClosed(WebSocket webSocket, int code, String reason) {
                    open = false;
                    fireClose(code, reason);
                }

                @Override
                public void onFailure(WebSocket webSocket, Throwable t, Response response) {
                    open = false;
                    if (isClosed()) {
                        return;
                    }
                    fireError(t);
                    fireClose(Protocol.CLOSE_ABNORMAL, t.getMessage());
                }
            };
        }

        @Override
        public boolean send(String text) {
            WebSocket socket = ws;
            return open && socket != null && socket.send(text);
        }

        @Override
        public void close(int code, String reason) {
            WebSocket socket = ws;
            if (socket != null) {
                open = false;
                socket.close(code, reason);
            }
        }

        @Override
        public void cancel() {
            WebSocket socket = ws;
            open = false;
            if (socket != null) {
                socket.cancel();
            }
        }
    }
}
