package io.cardlink.realtime.client;

import io.cardlink.realtime.client.loop.EventLoop;
import io.cardlink.realtime.client.transport.SocketTransport;
import io.cardlink.realtime.core.CredentialProvider;
import io.cardlink.realtime.json.spi.JsonCodec;

import java.util.Objects;

/**
 * Collaborators shared by the channels built from one {@link RealtimeClientBuilder}.
 */
public record ChannelRuntime(SocketTransport transport,
                             CredentialProvider credentials,
                             EventLoop eventLoop,
                             JsonCodec codec,
                             ChannelOptions options) {
    public ChannelRuntime {
        Objects.requireNonNull(transport, "transport");
        Objects.requireNonNull(credentials, "credentials");
        Objects.requireNonNull(eventLoop, "eventLoop");
        Objects.requireNonNull(codec, "codec");
        Objects.requireNonNull(options, "options");
    }
}
