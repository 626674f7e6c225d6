package io.cardlink.realtime.client.transport;

import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base for {@link SocketHandle} implementations: detach support and at-most-once close delivery.
 */
public abstract class AbstractSocketHandle implements SocketHandle {

    private static final SocketListener DETACHED = new SocketListener() {
        @Override
        public void onOpen() {
        }

        @Override
        public void onMessage(String text) {
        }

        @Override
        public void onError(Throwable error) {
        }

        @Override
        public void onClose(int code, String reason) {
        }
    };

    private volatile SocketListener listener;
    private final AtomicBoolean closed = new AtomicBoolean();

    protected AbstractSocketHandle(SocketListener listener) {
        this.listener = Objects.requireNonNull(listener, "listener");
    }

    @Override
    public void detach() {
        listener = DETACHED;
    }

    protected boolean isClosed() {
        return closed.get();
    }

    protected void fireOpen() {
        listener.onOpen();
    }

    protected void fireMessage(String text) {
        if (!closed.get()) {
            listener.onMessage(text);
        }
    }

    protected void fireError(Throwable error) {
        listener.onError(error);
    }

    protected void fireClosing(int code, String reason) {
        listener.onClosing(code, reason == null ? "" : reason);
    }

    protected void fireClose(int code, String reason) {
        if (closed.compareAndSet(false, true)) {
            listener.onClose(code, reason == null ? "" : reason);
        }
    }
}
