package io.cardlink.realtime.json.spi;

/**
 * Base exception for JSON parsing and serialization errors.
 */
public class JsonException extends Exception {
    public JsonException(String message) {
        super(message);
    }

    public JsonException(String message, Throwable cause) {
        super(message, cause);
    }
}
