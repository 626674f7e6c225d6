package io.cardlink.realtime.json.spi;

/**
 * Mutable JSON object, used to assemble outbound frames.
 */
public interface ObjectNode extends JsonNode {

    /**
     * Sets a string field; a {@code null} value is written as JSON null.
     */
    ObjectNode put(String fieldName, String value);

    /**
     * Sets a boolean field.
     */
    ObjectNode put(String fieldName, boolean value);

    /**
     * Sets a long field.
     */
    ObjectNode put(String fieldName, long value);
}
