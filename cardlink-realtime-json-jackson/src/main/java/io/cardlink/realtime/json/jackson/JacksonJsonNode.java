package io.cardlink.realtime.json.jackson;

import io.cardlink.realtime.json.spi.JsonNode;
import io.cardlink.realtime.json.spi.JsonNodeType;

import java.util.Iterator;
import java.util.Objects;

/**
 * Jackson implementation of JsonNode.
 * Wraps a Jackson JsonNode and delegates all operations to it.
 */
class JacksonJsonNode implements JsonNode {
    final com.fasterxml.jackson.databind.JsonNode delegate;

    JacksonJsonNode(com.fasterxml.jackson.databind.JsonNode delegate) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
    }

    @Override
    public JsonNodeType getNodeType() {
        if (delegate.isObject()) return JsonNodeType.OBJECT;
        if (delegate.isArray()) return JsonNodeType.ARRAY;
        if (delegate.isTextual()) return JsonNodeType.STRING;
        if (delegate.isNumber()) return JsonNodeType.NUMBER;
        if (delegate.isBoolean()) return JsonNodeType.BOOLEAN;
        return JsonNodeType.NULL;
    }

    @Override
    public JsonNode get(String fieldName) {
        return wrap(delegate.get(fieldName));
    }

    @Override
    public boolean has(String fieldName) {
        return delegate.has(fieldName);
    }

    @Override
    public int size() {
        return delegate.size();
    }

    @Override
    public String asText() {
        return delegate.asText();
    }

    @Override
    public double asDouble(double defaultValue) {
        return delegate.isNumber() ? delegate.asDouble() : delegate.asDouble(defaultValue);
    }

    @Override
    public boolean asBoolean(boolean defaultValue) {
        return delegate.asBoolean(defaultValue);
    }

    @Override
    public Iterator<JsonNode> elements() {
        Iterator<com.fasterxml.jackson.databind.JsonNode> iter = delegate.elements();
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return iter.hasNext();
            }

            @Override
            public JsonNode next() {
                return wrap(iter.next());
            }
        };
    }

    @Override
    public String toString() {
        return delegate.toString();
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof JacksonJsonNode other)) return false;
        return delegate.equals(other.delegate);
    }

    @Override
    public int hashCode() {
        return delegate.hashCode();
    }

    static JsonNode wrap(com.fasterxml.jackson.databind.JsonNode node) {
        if (node == null) return null;
        if (node instanceof com.fasterxml.jackson.databind.node.ObjectNode on) {
            return new JacksonObjectNode(on);
        }
        return new JacksonJsonNode(node);
    }

    static com.fasterxml.jackson.databind.JsonNode unwrap(JsonNode node) {
        if (node instanceof JacksonJsonNode jjn) {
            return jjn.delegate;
        }
        throw new IllegalArgumentException("Cannot unwrap non-Jackson JsonNode");
    }
}
