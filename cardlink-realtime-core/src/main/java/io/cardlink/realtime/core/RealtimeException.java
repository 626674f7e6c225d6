package io.cardlink.realtime.core;

/**
 * Base class for real-time channel exceptions.
 *
 * <p>None of these escape a socket callback; they complete futures exceptionally or are
 * handed to listeners.
 */
public abstract class RealtimeException extends RuntimeException {

    protected RealtimeException(String message) {
        super(message);
    }

    protected RealtimeException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Raised when the credential provider has no token for a connect attempt.
     */
    public static class MissingCredential extends RealtimeException {
        public MissingCredential(String endpoint) {
            super("no credential available for " + endpoint);
        }
    }

    /**
     * Raised when an attempt does not open within the configured bound.
     */
    public static class ConnectTimeout extends RealtimeException {
        public ConnectTimeout(String endpoint, long millis) {
            super("connect to " + endpoint + " timed out after " + millis + "ms");
        }
    }

    /**
     * Raised when the transport reports an error while connecting.
     */
    public static class ConnectFailed extends RealtimeException {
        public ConnectFailed(String endpoint, Throwable cause) {
            super("connect to " + endpoint + " failed: " + cause.getMessage(), cause);
        }
    }

    /**
     * Raised when the socket closes before it ever opened.
     */
    public static class ConnectionClosed extends RealtimeException {
        private final int code;

        public ConnectionClosed(int code, String reason) {
            super("connection closed code=" + code + (reason == null || reason.isEmpty() ? "" : " reason=" + reason));
            this.code = code;
        }

        public int code() {
            return code;
        }
    }

    /**
     * Raised when the caller disconnects while a connect or generation is pending.
     */
    public static class ChannelDisconnected extends RealtimeException {
        public ChannelDisconnected(String endpoint) {
            super("channel " + endpoint + " was disconnected");
        }
    }

    /**
     * Raised when an operation needs an open channel.
     */
    public static class ChannelNotOpen extends RealtimeException {
        public ChannelNotOpen(String endpoint) {
            super("channel " + endpoint + " is not open");
        }
    }

    /**
     * Raised when an inbound frame does not have the shape its type requires.
     */
    public static class MalformedMessage extends RealtimeException {
        public MalformedMessage(String message) {
            super(message);
        }

        public MalformedMessage(String message, Throwable cause) {
            super(message, cause);
        }
    }

    /**
     * Raised when a generation is requested while another one is streaming.
     */
    public static class GenerationInProgress extends RealtimeException {
        public GenerationInProgress() {
            super("a generation is already in progress");
        }
    }

    /**
     * Raised when the server reports a generation error; content has been rolled back.
     */
    public static class GenerationFailed extends RealtimeException {
        public GenerationFailed(String message) {
            super(message);
        }
    }

    /**
     * Raised when the caller cancels a generation; content has been rolled back.
     */
    public static class GenerationCancelled extends RealtimeException {
        public GenerationCancelled() {
            super("generation cancelled");
        }
    }
}
