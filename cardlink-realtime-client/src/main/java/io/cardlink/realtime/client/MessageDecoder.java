package io.cardlink.realtime.client;

import io.cardlink.realtime.json.spi.JsonNode;

/**
 * Turns an inbound frame into its typed record, validating its shape.
 *
 * <p>Throw {@link io.cardlink.realtime.core.RealtimeException.MalformedMessage} for frames that
 * lack required fields; the dispatcher logs and drops them.
 */
@FunctionalInterface
public interface MessageDecoder<T> {
    T decode(JsonNode frame);
}
