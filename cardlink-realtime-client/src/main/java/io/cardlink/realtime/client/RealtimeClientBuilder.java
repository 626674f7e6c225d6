package io.cardlink.realtime.client;

import io.cardlink.realtime.client.chat.ProjectChatClient;
import io.cardlink.realtime.client.dm.DirectMessageClient;
import io.cardlink.realtime.client.generation.BioGenerationClient;
import io.cardlink.realtime.client.generation.EditableContent;
import io.cardlink.realtime.client.loop.EventLoop;
import io.cardlink.realtime.client.loop.ExecutorEventLoop;
import io.cardlink.realtime.client.transport.JdkWebSocketTransport;
import io.cardlink.realtime.client.transport.OkHttpSocketTransport;
import io.cardlink.realtime.client.transport.SocketTransport;
import io.cardlink.realtime.core.CredentialProvider;
import io.cardlink.realtime.core.TokenStorage;
import io.cardlink.realtime.json.spi.JsonCodec;
import io.cardlink.realtime.json.spi.JsonCodecs;
import okhttp3.OkHttpClient;

import java.net.URI;
import java.net.http.HttpClient;
import java.util.Objects;

/**
 * Wires the collaborators shared by channel clients and creates them.
 *
 * <p>Defaults: {@link JdkWebSocketTransport}, one {@link ExecutorEventLoop} for every client of this
 * builder, the highest-priority {@link JsonCodec} on the class path and {@link ChannelOptions#defaults()}.
 */
public final class RealtimeClientBuilder {
    private URI baseUrl;
    private CredentialProvider credentials;
    private SocketTransport transport;
    private EventLoop eventLoop;
    private JsonCodec codec;
    private ChannelOptions options = ChannelOptions.defaults();
    private ChannelRuntime runtime;
    // created once, since clients built from an earlier runtime may still run on it
    private EventLoop defaultLoop;

    public RealtimeClientBuilder baseUrl(URI baseUrl) {
        this.baseUrl = Objects.requireNonNull(baseUrl, "baseUrl");
        return this;
    }

    public RealtimeClientBuilder baseUrl(String baseUrl) {
        return baseUrl(URI.create(Objects.requireNonNull(baseUrl, "baseUrl")));
    }

    public RealtimeClientBuilder credentials(CredentialProvider credentials) {
        this.credentials = Objects.requireNonNull(credentials, "credentials");
        return invalidate();
    }

    public RealtimeClientBuilder tokenStorage(TokenStorage storage) {
        return credentials(CredentialProvider.from(Objects.requireNonNull(storage, "storage")));
    }

    public RealtimeClientBuilder transport(SocketTransport transport) {
        this.transport = Objects.requireNonNull(transport, "transport");
        return invalidate();
    }

    public RealtimeClientBuilder jdkHttpClient(HttpClient httpClient) {
        return transport(new JdkWebSocketTransport(Objects.requireNonNull(httpClient, "httpClient")));
    }

    public RealtimeClientBuilder okHttpClient(OkHttpClient httpClient) {
        return transport(new OkHttpSocketTransport(Objects.requireNonNull(httpClient, "httpClient")));
    }

    public RealtimeClientBuilder eventLoop(EventLoop eventLoop) {
        this.eventLoop = Objects.requireNonNull(eventLoop, "eventLoop");
        return invalidate();
    }

    public RealtimeClientBuilder codec(JsonCodec codec) {
        this.codec = Objects.requireNonNull(codec, "codec");
        return invalidate();
    }

    public RealtimeClientBuilder options(ChannelOptions options) {
        this.options = Objects.requireNonNull(options, "options");
        return invalidate();
    }

    public ProjectChatClient projectChat(String projectId) {
        return new ProjectChatClient(requireBaseUrl(), projectId, runtime());
    }

    public DirectMessageClient directMessages() {
        return new DirectMessageClient(requireBaseUrl(), runtime());
    }

    public BioGenerationClient bioGeneration(String cardId, String ownerId, EditableContent content) {
        return new BioGenerationClient(requireBaseUrl(), cardId, ownerId, content, runtime());
    }

    /**
     * Resolves the shared collaborators; the same instance is reused until a setter changes them.
     */
    public synchronized ChannelRuntime runtime() {
        if (runtime == null) {
            if (credentials == null) {
                throw new IllegalStateException("credentials are required");
            }
            SocketTransport t = transport != null ? transport : JdkWebSocketTransport.create();
            EventLoop l = eventLoop != null ? eventLoop : defaultLoop();
            JsonCodec c = codec != null ? codec : JsonCodecs.load();
            runtime = new ChannelRuntime(t, credentials, l, c, options);
        }
        return runtime;
    }

    private EventLoop defaultLoop() {
        if (defaultLoop == null) {
            defaultLoop = new ExecutorEventLoop();
        }
        return defaultLoop;
    }

    private synchronized RealtimeClientBuilder invalidate() {
        runtime = null;
        return this;
    }

    private URI requireBaseUrl() {
        if (baseUrl == null) {
            throw new IllegalStateException("baseUrl is required");
        }
        return baseUrl;
    }
}
