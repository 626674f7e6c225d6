package io.cardlink.realtime.client;

import io.cardlink.realtime.core.ChannelEndpoint;
import io.cardlink.realtime.core.ConnectionState;
import io.cardlink.realtime.core.CredentialProvider;
import io.cardlink.realtime.core.DisconnectReason;
import io.cardlink.realtime.core.InMemoryTokenStorage;
import io.cardlink.realtime.core.RealtimeException;
import io.cardlink.realtime.json.jackson.JacksonJsonCodec;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.net.URI;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ReconnectingChannelTest {

    private static final URI BASE = URI.create("http://localhost:8000/api");

    private ManualEventLoop loop;
    private FakeSocketTransport transport;
    private InMemoryTokenStorage tokens;
    private RecordingConnectionListener listener;

    @BeforeEach
    void setUp() {
        loop = new ManualEventLoop();
        transport = new FakeSocketTransport();
        tokens = new InMemoryTokenStorage();
        tokens.set("tok-1");
        listener = new RecordingConnectionListener();
    }

    private ReconnectingChannel channel(ChannelOptions options) {
        ChannelRuntime runtime = new ChannelRuntime(transport, CredentialProvider.from(tokens), loop,
                new JacksonJsonCodec(), options);
        ReconnectingChannel channel = new ReconnectingChannel(ChannelEndpoint.projectChat(BASE, "p1"),
                List.of(ServerError.TYPE), runtime);
        channel.addConnectionListener(listener);
        return channel;
    }

    private ReconnectingChannel channel() {
        return channel(ChannelOptions.defaults());
    }

    @Test
    void connectOpensSocketWithCurrentCredentialAndResolvesOnOpen() {
        ReconnectingChannel channel = channel();

        CompletableFuture<Void> connected = channel.connect();

        assertThat(channel.state()).isEqualTo(ConnectionState.CONNECTING);
        assertThat(connected).isNotDone();
        assertThat(transport.last().url()).isEqualTo(URI.create("ws://localhost:8000/api/ws/chat/p1?token=tok-1"));

        transport.last().acceptOpen();

        assertThat(connected).isCompleted();
        assertThat(channel.isOpen()).isTrue();
        assertThat(listener.events).containsExactly("connected");
    }

    @Test
    void connectWhileConnectingReturnsPendingAttempt() {
        ReconnectingChannel channel = channel();

        CompletableFuture<Void> first = channel.connect();
        CompletableFuture<Void> second = channel.connect();

        assertThat(second).isSameAs(first);
        assertThat(transport.openCount()).isEqualTo(1);
    }

    @Test
    void connectWhenOpenIsNoop() {
        ReconnectingChannel channel = channel();
        channel.connect();
        transport.last().acceptOpen();

        CompletableFuture<Void> again = channel.connect();

        assertThat(again).isCompleted();
        assertThat(transport.openCount()).isEqualTo(1);
    }

    @Test
    void retriesWithLinearBackoffUntilBudgetIsSpent() {
        ReconnectingChannel channel = channel(ChannelOptions.builder().maxReconnectAttempts(2).build());
        channel.connect();
        transport.last().acceptOpen();

        transport.last().fail(new IOException("reset"));
        assertThat(channel.state()).isEqualTo(ConnectionState.CONNECTING);

        loop.advanceMillis(999);
        assertThat(transport.openCount()).isEqualTo(1);
        loop.advanceMillis(1);
        assertThat(transport.openCount()).isEqualTo(2);

        transport.last().fail(new IOException("refused"));
        loop.advanceMillis(1999);
        assertThat(transport.openCount()).isEqualTo(2);
        loop.advanceMillis(1);
        assertThat(transport.openCount()).isEqualTo(3);

        transport.last().fail(new IOException("refused"));
        loop.advance(Duration.ofMinutes(5));

        assertThat(transport.openCount()).isEqualTo(3);
        assertThat(channel.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(listener.events).containsSubsequence(
                "connected", "reconnecting 1 1000", "reconnecting 2 2000", "disconnected");
        assertThat(listener.disconnects).containsExactly(new DisconnectReason.RetriesExhausted(2));
    }

    @Test
    void successfulReconnectResetsAttemptCounter() {
        ReconnectingChannel channel = channel();
        channel.connect();
        transport.last().acceptOpen();

        transport.last().fail(new IOException("reset"));
        loop.advanceMillis(1000);
        transport.last().fail(new IOException("refused"));
        loop.advanceMillis(2000);
        transport.last().acceptOpen();

        transport.last().fail(new IOException("reset again"));

        assertThat(listener.events).endsWith("reconnecting 1 1000");
    }

    @Test
    void manualConnectAfterRetriesExhaustedStartsFresh() {
        ReconnectingChannel channel = channel(ChannelOptions.builder().maxReconnectAttempts(1).build());
        channel.connect();
        transport.last().fail(new IOException("refused"));
        loop.advanceMillis(1000);
        transport.last().fail(new IOException("refused"));
        assertThat(channel.state()).isEqualTo(ConnectionState.DISCONNECTED);

        channel.connect();
        transport.last().fail(new IOException("refused"));

        assertThat(listener.events).endsWith("reconnecting 1 1000");
    }

    @Test
    void normalClosureIsNotRetried() {
        ReconnectingChannel channel = channel();
        channel.connect();
        transport.last().acceptOpen();

        transport.last().serverClose(1000, "bye");
        loop.advance(Duration.ofMinutes(1));

        assertThat(transport.openCount()).isEqualTo(1);
        assertThat(channel.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(listener.disconnects).containsExactly(new DisconnectReason.ClosedByServer(1000, "bye"));
    }

    @Test
    void accessDeniedIsNotRetried() {
        ReconnectingChannel channel = channel();
        CompletableFuture<Void> connected = channel.connect();

        transport.last().serverClose(4003, "Access denied");
        loop.advance(Duration.ofMinutes(1));

        assertThat(transport.openCount()).isEqualTo(1);
        assertThatThrownBy(connected::join)
                .isInstanceOf(CompletionException.class)
                .hasCauseInstanceOf(RealtimeException.ConnectionClosed.class);
        assertThat(listener.disconnects).containsExactly(new DisconnectReason.ClosedByServer(4003, "Access denied"));
    }

    @Test
    void unauthorizedIsRetriedWithFreshCredential() {
        ReconnectingChannel channel = channel();
        channel.connect();
        transport.last().serverClose(4001, "Unauthorized");

        tokens.set("tok-2");
        loop.advanceMillis(1000);

        assertThat(transport.openCount()).isEqualTo(2);
        assertThat(transport.last().url().getQuery()).isEqualTo("token=tok-2");
    }

    @Test
    void closingHandshakeIsObservable() {
        ReconnectingChannel channel = channel();
        channel.connect();
        transport.last().acceptOpen();

        transport.last().serverClose(1011, "restart");

        assertThat(listener.states).containsExactly(
                ConnectionState.CONNECTING, ConnectionState.OPEN, ConnectionState.CLOSING, ConnectionState.CONNECTING);
    }

    @Test
    void disconnectCancelsScheduledReconnect() {
        ReconnectingChannel channel = channel();
        channel.connect();
        transport.last().acceptOpen();
        transport.last().fail(new IOException("reset"));

        channel.disconnect();
        loop.advance(Duration.ofMinutes(10));

        assertThat(transport.openCount()).isEqualTo(1);
        assertThat(loop.pendingTimers()).isZero();
        assertThat(channel.state()).isEqualTo(ConnectionState.DISCONNECTED);
    }

    @Test
    void disconnectClosesNormallyAndIsIdempotent() {
        ReconnectingChannel channel = channel();
        channel.connect();
        transport.last().acceptOpen();

        channel.disconnect();
        channel.disconnect();

        assertThat(transport.last().closeCode()).isEqualTo(1000);
        assertThat(channel.state()).isEqualTo(ConnectionState.DISCONNECTED);
        assertThat(listener.disconnects).isEmpty();
        assertThat(loop.pendingTimers()).isZero();
    }

    @Test
    void disconnectFailsPendingConnect() {
        ReconnectingChannel channel = channel();
        CompletableFuture<Void> connected = channel.connect();

        channel.disconnect();

        assertThatThrownBy(connected::join).hasCauseInstanceOf(RealtimeException.ChannelDisconnected.class);
        assertThat(transport.last().isOpen()).isFalse();
    }

    @Test
    void disconnectedChannelSendsNothing() {
        ReconnectingChannel channel = channel();
        channel.connect();
        FakeSocketTransport.FakeSocket socket = transport.last();
        socket.acceptOpen();

        assertThat(channel.send(OutboundMessage.markRead())).isTrue();
        channel.disconnect();

        assertThat(channel.send(OutboundMessage.markRead())).isFalse();
        loop.advance(Duration.ofMinutes(5));
        assertThat(socket.sent()).containsExactly("{\"action\":\"mark_read\"}");
    }

    @Test
    void sendBeforeOpenIsRejected() {
        ReconnectingChannel channel = channel();
        channel.connect();

        assertThat(channel.send(OutboundMessage.typing(true))).isFalse();
        assertThat(transport.last().sent()).isEmpty();
    }

    @Test
    void keepalivePingsWhileOpenAndStopsOnDisconnect() {
        ReconnectingChannel channel = channel();
        channel.connect();
        FakeSocketTransport.FakeSocket socket = transport.last();
        socket.acceptOpen();

        loop.advanceMillis(29_999);
        assertThat(socket.sent()).isEmpty();
        loop.advanceMillis(1);
        assertThat(socket.sent()).containsExactly("{\"action\":\"ping\"}");
        loop.advanceMillis(30_000);
        assertThat(socket.sent()).hasSize(2);

        channel.disconnect();
        loop.advance(Duration.ofMinutes(10));
        assertThat(socket.sent()).hasSize(2);
    }

    @Test
    void keepaliveStopsOnUnexpectedClose() {
        ReconnectingChannel channel = channel(ChannelOptions.builder().maxReconnectAttempts(0).build());
        channel.connect();
        FakeSocketTransport.FakeSocket socket = transport.last();
        socket.acceptOpen();

        socket.fail(new IOException("reset"));
        loop.advance(Duration.ofMinutes(5));

        assertThat(socket.sent()).isEmpty();
        assertThat(loop.pendingTimers()).isZero();
    }

    @Test
    void connectTimeoutCancelsAttemptAndSchedulesRetry() {
        ReconnectingChannel channel = channel(ChannelOptions.builder().connectTimeout(Duration.ofSeconds(5)).build());
        CompletableFuture<Void> connected = channel.connect();
        FakeSocketTransport.FakeSocket stale = transport.last();

        loop.advanceMillis(5000);

        assertThatThrownBy(connected::join).hasCauseInstanceOf(RealtimeException.ConnectTimeout.class);
        assertThat(stale.cancelled()).isTrue();
        assertThat(listener.events).containsExactly("reconnecting 1 1000");

        loop.advanceMillis(1000);
        assertThat(transport.openCount()).isEqualTo(2);
    }

    @Test
    void eventsFromReplacedSocketAreIgnored() {
        ReconnectingChannel channel = channel(ChannelOptions.builder().connectTimeout(Duration.ofSeconds(5)).build());
        List<ServerError> errors = new ArrayList<>();
        channel.on(ServerError.TYPE, errors::add);
        channel.connect();
        FakeSocketTransport.FakeSocket stale = transport.last();
        loop.advanceMillis(6000);
        transport.last().acceptOpen();

        stale.acceptOpen();
        stale.receive("{\"type\":\"error\",\"message\":\"stale\"}");
        stale.serverClose(1000, "late");

        assertThat(channel.state()).isEqualTo(ConnectionState.OPEN);
        assertThat(errors).isEmpty();
        assertThat(transport.openCount()).isEqualTo(2);
    }

    @Test
    void missingCredentialFailsWithoutRetry() {
        tokens.remove();
        ReconnectingChannel channel = channel();

        CompletableFuture<Void> connected = channel.connect();

        assertThatThrownBy(connected::join).hasCauseInstanceOf(RealtimeException.MissingCredential.class);
        assertThat(transport.openCount()).isZero();
        assertThat(listener.disconnects).containsExactly(new DisconnectReason.MissingCredential());
        assertThat(loop.pendingTimers()).isZero();
    }

    @Test
    void errorBeforeOpenFailsConnectAndNotifies() {
        ReconnectingChannel channel = channel();
        CompletableFuture<Void> connected = channel.connect();

        transport.last().fail(new IOException("refused"));

        assertThatThrownBy(connected::join).hasCauseInstanceOf(RealtimeException.ConnectFailed.class);
        assertThat(listener.errors).hasSize(1);
        assertThat(channel.state()).isEqualTo(ConnectionState.CONNECTING);
    }

    @Test
    void failingListenerDoesNotBreakChannel() {
        ReconnectingChannel channel = channel();
        channel.addConnectionListener(new ConnectionListener() {
            @Override
            public void onConnected() {
                throw new IllegalStateException("boom");
            }
        });
        CompletableFuture<Void> connected = channel.connect();

        transport.last().acceptOpen();

        assertThat(connected).isCompleted();
        assertThat(channel.isOpen()).isTrue();
        assertThat(listener.events).containsExactly("connected");
    }

    @Test
    void inboundFramesAreDispatchedWhileOpen() {
        ReconnectingChannel channel = channel();
        List<ServerError> errors = new ArrayList<>();
        channel.on(ServerError.TYPE, errors::add);
        channel.connect();
        transport.last().acceptOpen();

        transport.last().receive("{\"type\":\"error\",\"message\":\"Rate limit exceeded\",\"code\":\"rate_limit\"}");

        assertThat(errors).containsExactly(new ServerError("Rate limit exceeded", "rate_limit"));
    }
}
