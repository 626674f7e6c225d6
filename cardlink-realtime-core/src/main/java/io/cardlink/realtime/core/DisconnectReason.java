package io.cardlink.realtime.core;

/**
 * Why a channel stopped for good (no further automatic reconnects).
 *
 * <p>A caller-initiated disconnect is not reported; the caller already knows.
 */
public sealed interface DisconnectReason
        permits DisconnectReason.ClosedByServer, DisconnectReason.RetriesExhausted, DisconnectReason.MissingCredential {

    /**
     * The server closed with a normal or non-retryable code.
     *
     * @param code the close code
     * @param reason the close reason sent by the server, possibly empty
     */
    record ClosedByServer(int code, String reason) implements DisconnectReason {
        public ClosedByServer {
            reason = reason == null ? "" : reason;
        }
    }

    /**
     * The reconnect budget is spent; only a manual {@code connect()} will try again.
     *
     * @param attempts number of automatic attempts that were made
     */
    record RetriesExhausted(int attempts) implements DisconnectReason {}

    /**
     * No credential was available at connect time.
     */
    record MissingCredential() implements DisconnectReason {}
}
