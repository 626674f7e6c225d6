package io.cardlink.realtime.client;

import io.cardlink.realtime.core.Protocol;
import io.cardlink.realtime.json.spi.JsonNode;

/**
 * Application-level {@code error} frame, e.g. a rate limit or a failed generation.
 *
 * @param message human-readable text
 * @param code machine-readable code such as {@code rate_limit}, or {@code null}
 */
public record ServerError(String message, String code) {

    public static final MessageType<ServerError> TYPE = MessageType.of(Protocol.T_ERROR, ServerError::from);

    public ServerError {
        message = message == null ? "" : message;
    }

    static ServerError from(JsonNode frame) {
        return new ServerError(Frames.optionalText(frame, "message"), Frames.optionalText(frame, "code"));
    }
}
