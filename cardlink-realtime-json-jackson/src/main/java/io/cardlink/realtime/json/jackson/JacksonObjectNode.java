package io.cardlink.realtime.json.jackson;

import io.cardlink.realtime.json.spi.ObjectNode;

/**
 * Jackson implementation of ObjectNode.
 */
final class JacksonObjectNode extends JacksonJsonNode implements ObjectNode {
    private final com.fasterxml.jackson.databind.node.ObjectNode objectDelegate;

    JacksonObjectNode(com.fasterxml.jackson.databind.node.ObjectNode delegate) {
        super(delegate);
        this.objectDelegate = delegate;
    }

    @Override
    public ObjectNode put(String fieldName, String value) {
        if (value == null) {
            objectDelegate.putNull(fieldName);
        } else {
            objectDelegate.put(fieldName, value);
        }
        return this;
    }

    @Override
    public ObjectNode put(String fieldName, boolean value) {
        objectDelegate.put(fieldName, value);
        return this;
    }

    @Override
    public ObjectNode put(String fieldName, long value) {
        objectDelegate.put(fieldName, value);
        return this;
    }
}
