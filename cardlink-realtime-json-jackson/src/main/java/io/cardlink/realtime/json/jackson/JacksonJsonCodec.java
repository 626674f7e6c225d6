package io.cardlink.realtime.json.jackson;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.cardlink.realtime.json.spi.JsonCodec;
import io.cardlink.realtime.json.spi.JsonException;
import io.cardlink.realtime.json.spi.JsonNode;
import io.cardlink.realtime.json.spi.ObjectNode;

import java.util.Objects;

/**
 * Jackson implementation of JsonCodec.
 */
public final class JacksonJsonCodec implements JsonCodec {
    private final ObjectMapper mapper;

    /**
     * Creates a Jackson codec with the default ObjectMapper.
     */
    public JacksonJsonCodec() {
        this(new ObjectMapper(new JsonFactory()));
    }

    /**
     * Creates a Jackson codec with a custom ObjectMapper.
     * @param mapper the ObjectMapper to use
     */
    public JacksonJsonCodec(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getMapper() {
        return mapper;
    }

    @Override
    public JsonNode readTree(String json) throws JsonException {
        if (json == null || json.isBlank()) {
            throw new JsonException("Cannot parse empty frame");
        }
        try {
            com.fasterxml.jackson.databind.JsonNode node = mapper.readTree(json);
            if (node == null || node.isMissingNode()) {
                throw new JsonException("Invalid JSON: no tokens");
            }
            return JacksonJsonNode.wrap(node);
        } catch (JsonException e) {
            throw e;
        } catch (Exception e) {
            throw new JsonException("Failed to parse string to tree", e);
        }
    }

    @Override
    public ObjectNode createObjectNode() {
        return new JacksonObjectNode(mapper.createObjectNode());
    }

    @Override
    public String writeString(JsonNode node) throws JsonException {
        try {
            return mapper.writeValueAsString(JacksonJsonNode.unwrap(node));
        } catch (Exception e) {
            throw new JsonException("Failed to serialize node to string", e);
        }
    }
}
