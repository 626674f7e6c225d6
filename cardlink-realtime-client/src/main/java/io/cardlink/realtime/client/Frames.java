package io.cardlink.realtime.client;

import io.cardlink.realtime.core.RealtimeException;
import io.cardlink.realtime.json.spi.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;

/**
 * Field accessors used by message decoders.
 */
public final class Frames {
    private Frames() {}

    public static String requiredText(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isObject() || v.isArray()) {
            throw new RealtimeException.MalformedMessage("missing required field: " + field);
        }
        return v.asText();
    }

    /**
     * Returns the field as text, or {@code null} when it is absent or JSON null.
     */
    public static String optionalText(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return null;
        return v.asText();
    }

    public static boolean requiredBoolean(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isBoolean()) {
            throw new RealtimeException.MalformedMessage("missing boolean field: " + field);
        }
        return v.asBoolean(false);
    }

    public static boolean optionalBoolean(JsonNode node, String field, boolean defaultValue) {
        JsonNode v = node.get(field);
        return v == null || v.isNull() ? defaultValue : v.asBoolean(defaultValue);
    }

    public static JsonNode requiredObject(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || !v.isObject()) {
            throw new RealtimeException.MalformedMessage("missing object field: " + field);
        }
        return v;
    }

    /**
     * Returns the elements of an array field; an absent or null field yields an empty list.
     */
    public static List<JsonNode> array(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull()) return List.of();
        if (!v.isArray()) {
            throw new RealtimeException.MalformedMessage("field is not an array: " + field);
        }
        List<JsonNode> out = new ArrayList<>(v.size());
        Iterator<JsonNode> it = v.elements();
        while (it.hasNext()) out.add(it.next());
        return out;
    }

    public static List<String> textList(JsonNode node, String field) {
        List<String> out = new ArrayList<>();
        for (JsonNode e : array(node, field)) {
            if (!e.isNull()) out.add(e.asText());
        }
        return List.copyOf(out);
    }
}
