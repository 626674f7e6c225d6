package io.cardlink.realtime.client;

import java.util.Objects;

/**
 * An inbound message kind: its {@code type} discriminant and the decoder for its payload.
 *
 * @param name the discriminant value
 * @param decoder the shape validator and mapper
 * @param <T> the decoded record type
 */
public record MessageType<T>(String name, MessageDecoder<T> decoder) {
    public MessageType {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(decoder, "decoder");
    }

    public static <T> MessageType<T> of(String name, MessageDecoder<T> decoder) {
        return new MessageType<>(name, decoder);
    }
}
