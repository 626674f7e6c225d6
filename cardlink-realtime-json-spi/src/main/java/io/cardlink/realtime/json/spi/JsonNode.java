package io.cardlink.realtime.json.spi;

import java.util.Iterator;

/**
 * Read-only view of a parsed JSON value.
 * Implementations wrap a specific JSON library without exposing it.
 */
public interface JsonNode {

    /**
     * Returns the node type.
     */
    JsonNodeType getNodeType();

    default boolean isObject() {
        return getNodeType() == JsonNodeType.OBJECT;
    }

    default boolean isArray() {
        return getNodeType() == JsonNodeType.ARRAY;
    }

    default boolean isTextual() {
        return getNodeType() == JsonNodeType.STRING;
    }

    default boolean isNumber() {
        return getNodeType() == JsonNodeType.NUMBER;
    }

    default boolean isBoolean() {
        return getNodeType() == JsonNodeType.BOOLEAN;
    }

    default boolean isNull() {
        return getNodeType() == JsonNodeType.NULL;
    }

    /**
     * Gets a field by name from an object node.
     * Returns null if this is not an object or the field doesn't exist.
     */
    JsonNode get(String fieldName);

    /**
     * Returns true if this node has a field with the given name.
     */
    boolean has(String fieldName);

    /**
     * Returns the size of this node.
     * For objects: number of fields
     * For arrays: number of elements
     * For others: 0
     */
    int size();

    /**
     * Returns the text value of this node.
     * For text nodes: the string value
     * For other types: string representation
     */
    String asText();

    /**
     * Returns the double value or the default if not numeric.
     */
    double asDouble(double defaultValue);

    /**
     * Returns the boolean value or the default if not boolean.
     */
    boolean asBoolean(boolean defaultValue);

    /**
     * Returns an iterator over the elements (for array nodes).
     */
    Iterator<JsonNode> elements();
}
