package io.cardlink.realtime.client;

import io.cardlink.realtime.client.loop.EventLoop;
import io.cardlink.realtime.client.loop.TimerHandle;
import io.cardlink.realtime.client.transport.SocketHandle;
import io.cardlink.realtime.client.transport.SocketListener;
import io.cardlink.realtime.core.ChannelEndpoint;
import io.cardlink.realtime.core.ConnectionState;
import io.cardlink.realtime.core.DisconnectReason;
import io.cardlink.realtime.core.Protocol;
import io.cardlink.realtime.core.RealtimeException;
import io.cardlink.realtime.json.spi.JsonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.time.Duration;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * One logical WebSocket channel that survives unexpected closes.
 *
 * <p>Owns at most one physical socket at a time. Every state transition, socket callback and
 * timer runs on the channel's {@link EventLoop}; public methods called from other threads are
 * re-posted to it, so outbound frames leave in call order.
 *
 * <p>Reconnection follows {@link ReconnectPolicy}. It never applies after {@link #disconnect()},
 * after close code {@code 1000} or after a configured non-retryable code. The credential is read
 * again for every attempt.
 */
public final class ReconnectingChannel {
    private static final Logger LOG = LoggerFactory.getLogger(ReconnectingChannel.class);

    private final ChannelEndpoint endpoint;
    private final ChannelRuntime runtime;
    private final EventLoop loop;
    private final MessageDispatcher dispatcher;
    private final ReconnectPolicy policy;
    private final KeepaliveTimer keepalive;
    private final List<ConnectionListener> listeners = new CopyOnWriteArrayList<>();

    private volatile ConnectionState state = ConnectionState.DISCONNECTED;

    // loop-confined
    private SocketHandle socket;
    private Attempt attempt;
    private TimerHandle reconnectTimer;
    private TimerHandle connectTimeoutTimer;
    private CompletableFuture<Void> pendingConnect;

    public ReconnectingChannel(ChannelEndpoint endpoint, Collection<MessageType<?>> types, ChannelRuntime runtime) {
        this.endpoint = Objects.requireNonNull(endpoint, "endpoint");
        this.runtime = Objects.requireNonNull(runtime, "runtime");
        this.loop = runtime.eventLoop();
        this.dispatcher = new MessageDispatcher(runtime.codec(), endpoint.toString(), types);
        this.policy = ReconnectPolicy.from(runtime.options());
        this.keepalive = new KeepaliveTimer(loop, runtime.options().keepaliveInterval(), this::trySend);
    }

    public ChannelEndpoint endpoint() {
        return endpoint;
    }

    public ChannelOptions options() {
        return runtime.options();
    }

    public EventLoop eventLoop() {
        return loop;
    }

    public ConnectionState state() {
        return state;
    }

    public boolean isOpen() {
        return state == ConnectionState.OPEN;
    }

    public <T> Subscription on(MessageType<T> type, MessageHandler<? super T> handler) {
        return dispatcher.on(type, handler);
    }

    public Subscription addConnectionListener(ConnectionListener listener) {
        Objects.requireNonNull(listener, "listener");
        listeners.add(listener);
        return () -> listeners.remove(listener);
    }

    /**
     * Opens the channel.
     *
     * @return completes when the socket opens; fails on a transport error, a close before open,
     *         a missing credential, a connect timeout or a {@link #disconnect()} in between
     */
    public CompletableFuture<Void> connect() {
        return callOnLoop(this::connectOnLoop);
    }

    /**
     * Closes the channel with {@code 1000} and cancels every pending timer. Idempotent.
     */
    public void disconnect() {
        runOnLoop(this::disconnectOnLoop);
    }

    /**
     * Sends a frame if the channel is open. Never queues.
     *
     * @return false when the channel is known not to be open or the socket rejected the frame.
     *         Off the loop the frame is posted and {@code true} means it was accepted for sending.
     */
    public boolean send(OutboundMessage message) {
        Objects.requireNonNull(message, "message");
        if (loop.inEventLoop()) {
            return trySend(message);
        }
        if (state != ConnectionState.OPEN) {
            return false;
        }
        loop.execute(() -> trySend(message));
        return true;
    }

    /**
     * Sends a frame from the event loop.
     *
     * @throws IllegalStateException if called from another thread
     */
    public boolean trySend(OutboundMessage message) {
        if (!loop.inEventLoop()) {
            throw new IllegalStateException("trySend must be called on the event loop");
        }
        SocketHandle s = socket;
        if (state != ConnectionState.OPEN || s == null) {
            LOG.debug("[{}] Not open, dropping {}", endpoint, message);
            return false;
        }
        String text;
        try {
            text = runtime.codec().writeString(message.toJson(runtime.codec()));
        } catch (JsonException e) {
            LOG.error("[{}] Could not encode {}", endpoint, message, e);
            return false;
        }
        boolean sent = s.send(text);
        if (!sent) {
            LOG.debug("[{}] Socket rejected {}", endpoint, message);
        }
        return sent;
    }

    public void runOnLoop(Runnable task) {
        if (loop.inEventLoop()) {
            task.run();
        } else {
            loop.execute(task);
        }
    }

    public <T> CompletableFuture<T> callOnLoop(Supplier<CompletableFuture<T>> action) {
        if (loop.inEventLoop()) {
            return action.get();
        }
        CompletableFuture<T> relay = new CompletableFuture<>();
        loop.execute(() -> {
            try {
                action.get().whenComplete((v, e) -> {
                    if (e != null) relay.completeExceptionally(e);
                    else relay.complete(v);
                });
            } catch (RuntimeException e) {
                relay.completeExceptionally(e);
            }
        });
        return relay;
    }

    private CompletableFuture<Void> connectOnLoop() {
        switch (state) {
            case OPEN:
                return CompletableFuture.completedFuture(null);
            case CONNECTING:
                if (reconnectTimer != null) {
                    reconnectTimer.cancel();
                    reconnectTimer = null;
                    CompletableFuture<Void> f = pending();
                    openSocket();
                    return f;
                }
                return pending();
            case CLOSING:
                // the close in progress hands over to the reconnect attempt
                return pending();
            case DISCONNECTED:
            default:
                policy.reset();
                CompletableFuture<Void> f = pending();
                openSocket();
                return f;
        }
    }

    private CompletableFuture<Void> pending() {
        if (pendingConnect == null) {
            pendingConnect = new CompletableFuture<>();
        }
        return pendingConnect;
    }

    private void openSocket() {
        Optional<String> credential;
        try {
            credential = runtime.credentials().currentCredential();
        } catch (RuntimeException e) {
            LOG.warn("[{}] Credential provider failed", endpoint, e);
            credential = Optional.empty();
        }
        if (credential.isEmpty() || credential.get().isBlank()) {
            LOG.warn("[{}] No credential available, not connecting", endpoint);
            detachSocket();
            setState(ConnectionState.DISCONNECTED);
            failPending(new RealtimeException.MissingCredential(endpoint.toString()));
            notifyListeners(l -> l.onDisconnected(new DisconnectReason.MissingCredential()));
            return;
        }

        detachSocket();
        setState(ConnectionState.CONNECTING);
        Attempt a = new Attempt();
        attempt = a;
        URI url = endpoint.resolve(credential.get());
        LOG.debug("[{}] Connecting (retry {} of {})", endpoint, policy.attempts(), policy.maxAttempts());

        Duration timeout = runtime.options().connectTimeout();
        connectTimeoutTimer = loop.schedule(() -> onConnectTimeout(a, timeout), timeout);
        try {
            SocketHandle handle = runtime.transport().open(url, a);
            if (attempt == a) {
                socket = handle;
            } else {
                handle.detach();
                handle.cancel();
            }
        } catch (RuntimeException e) {
            LOG.warn("[{}] Transport refused to open", endpoint, e);
            a.onError(e);
            a.onClose(Protocol.CLOSE_ABNORMAL, e.getMessage());
        }
    }

    private void detachSocket() {
        attempt = null;
        SocketHandle s = socket;
        socket = null;
        if (s != null) {
            s.detach();
            s.cancel();
        }
    }

    private void handleOpen(Attempt a) {
        cancelConnectTimeout();
        a.opened = true;
        setState(ConnectionState.OPEN);
        policy.reset();
        keepalive.start();
        LOG.info("[{}] Connected", endpoint);
        CompletableFuture<Void> f = pendingConnect;
        pendingConnect = null;
        if (f != null) {
            f.complete(null);
        }
        notifyListeners(ConnectionListener::onConnected);
    }

    private void handleError(Attempt a, Throwable error) {
        LOG.warn("[{}] Transport error: {}", endpoint, error.toString());
        if (!a.opened) {
            failPending(new RealtimeException.ConnectFailed(endpoint.toString(), error));
        }
        notifyListeners(l -> l.onError(error));
    }

    private void handleClosed(Attempt a, int code, String reason) {
        attempt = null;
        socket = null;
        cancelConnectTimeout();
        keepalive.stop();

        if (!policy.isRetryable(code)) {
            LOG.info("[{}] Closed by server code={} reason={}", endpoint, code, reason);
            failPending(new RealtimeException.ConnectionClosed(code, reason));
            setState(ConnectionState.DISCONNECTED);
            notifyListeners(l -> l.onDisconnected(new DisconnectReason.ClosedByServer(code, reason)));
            return;
        }
        if (!a.opened) {
            failPending(new RealtimeException.ConnectionClosed(code, reason));
        }
        LOG.warn("[{}] Connection lost code={} reason={}", endpoint, code, reason);
        scheduleReconnect(code, reason);
    }

    private void scheduleReconnect(int code, String reason) {
        Optional<Duration> next = policy.nextDelay();
        if (next.isEmpty()) {
            int attempts = policy.attempts();
            LOG.warn("[{}] Giving up after {} reconnect attempts", endpoint, attempts);
            failPending(new RealtimeException.ConnectionClosed(code, reason));
            setState(ConnectionState.DISCONNECTED);
            notifyListeners(l -> l.onDisconnected(new DisconnectReason.RetriesExhausted(attempts)));
            return;
        }
        Duration delay = next.get();
        int n = policy.attempts();
        setState(ConnectionState.CONNECTING);
        reconnectTimer = loop.schedule(this::reconnectNow, delay);
        LOG.info("[{}] Reconnecting in {}ms (attempt {}/{})", endpoint, delay.toMillis(), n, policy.maxAttempts());
        notifyListeners(l -> l.onReconnecting(n, delay));
    }

    private void reconnectNow() {
        reconnectTimer = null;
        if (state == ConnectionState.CONNECTING && attempt == null) {
            openSocket();
        }
    }

    private void onConnectTimeout(Attempt a, Duration timeout) {
        connectTimeoutTimer = null;
        if (attempt != a || state != ConnectionState.CONNECTING) {
            return;
        }
        LOG.warn("[{}] Connect timed out after {}ms", endpoint, timeout.toMillis());
        failPending(new RealtimeException.ConnectTimeout(endpoint.toString(), timeout.toMillis()));
        SocketHandle s = socket;
        if (s != null) {
            s.detach();
            s.cancel();
        }
        handleClosed(a, Protocol.CLOSE_ABNORMAL, "connect timeout");
    }

    private void disconnectOnLoop() {
        if (reconnectTimer != null) {
            reconnectTimer.cancel();
            reconnectTimer = null;
        }
        cancelConnectTimeout();
        keepalive.stop();
        attempt = null;
        SocketHandle s = socket;
        socket = null;
        failPending(new RealtimeException.ChannelDisconnected(endpoint.toString()));
        policy.reset();
        if (state != ConnectionState.DISCONNECTED) {
            LOG.info("[{}] Disconnected", endpoint);
            setState(ConnectionState.DISCONNECTED);
        }
        if (s != null) {
            s.detach();
            s.close(Protocol.CLOSE_NORMAL, "client disconnect");
        }
    }

    private void cancelConnectTimeout() {
        if (connectTimeoutTimer != null) {
            connectTimeoutTimer.cancel();
            connectTimeoutTimer = null;
        }
    }

    private void failPending(RealtimeException error) {
        CompletableFuture<Void> f = pendingConnect;
        pendingConnect = null;
        if (f != null) {
            f.completeExceptionally(error);
        }
    }

    private void setState(ConnectionState next) {
        ConnectionState previous = state;
        if (previous == next) {
            return;
        }
        state = next;
        LOG.debug("[{}] {} -> {}", endpoint, previous, next);
        notifyListeners(l -> l.onStateChanged(previous, next));
    }

    private void notifyListeners(Consumer<ConnectionListener> call) {
        for (ConnectionListener l : listeners) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                LOG.error("[{}] Connection listener failed", endpoint, e);
            }
        }
    }

    /**
     * Listener for one physical socket. Events of a replaced attempt are ignored.
     */
    private final class Attempt implements SocketListener {
        private boolean opened;

        @Override
        public void onOpen() {
            runOnLoop(() -> {
                if (attempt == this) handleOpen(this);
            });
        }

        @Override
        public void onMessage(String text) {
            runOnLoop(() -> {
                if (attempt == this && (state == ConnectionState.OPEN || state == ConnectionState.CLOSING)) {
                    dispatcher.dispatch(text);
                }
            });
        }

        @Override
        public void onError(Throwable error) {
            runOnLoop(() -> {
                if (attempt == this) handleError(this, error);
            });
        }

        @Override
        public void onClosing(int code, String reason) {
            runOnLoop(() -> {
                if (attempt == this && state == ConnectionState.OPEN) {
                    setState(ConnectionState.CLOSING);
                }
            });
        }

        @Override
        public void onClose(int code, String reason) {
            runOnLoop(() -> {
                if (attempt == this) handleClosed(this, code, reason == null ? "" : reason);
            });
        }
    }
}
