package io.cardlink.realtime.json.spi;

/**
 * Minimal JSON codec used by the channel clients.
 * Implementations wrap specific JSON libraries (Jackson, Gson, Moshi, etc.).
 *
 * <p>Frames are small and routed by a discriminant field, so the contract is tree based:
 * inbound text is parsed to a {@link JsonNode}, outbound frames are built as an {@link ObjectNode}.
 */
public interface JsonCodec {

    /**
     * Parses a JSON text frame.
     * @param json the frame text
     * @return the root node
     * @throws JsonException if the text is not valid JSON
     */
    JsonNode readTree(String json) throws JsonException;

    /**
     * Creates an empty mutable object.
     */
    ObjectNode createObjectNode();

    /**
     * Serializes a node to its compact JSON text.
     * @param node the node to serialize
     * @return JSON string
     * @throws JsonException if serialization fails
     */
    String writeString(JsonNode node) throws JsonException;
}
