package io.cardlink.realtime.client;

import io.cardlink.realtime.core.Protocol;
import io.cardlink.realtime.json.spi.JsonCodec;
import io.cardlink.realtime.json.spi.ObjectNode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * An outbound frame keyed by its {@code action}. Only the factories below create instances.
 */
public final class OutboundMessage {
    private final String action;
    private final Map<String, Object> fields;

    private OutboundMessage(String action, Map<String, Object> fields) {
        this.action = action;
        this.fields = Collections.unmodifiableMap(fields);
    }

    public String action() {
        return action;
    }

    public Map<String, Object> fields() {
        return fields;
    }

    public static OutboundMessage ping() {
        return of(Protocol.A_PING, new LinkedHashMap<>());
    }

    public static OutboundMessage sendMessage(String content, String replyToId) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("content", Objects.requireNonNull(content, "content"));
        if (replyToId != null) f.put("reply_to_id", replyToId);
        return of(Protocol.A_SEND_MESSAGE, f);
    }

    public static OutboundMessage typing(boolean isTyping) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("is_typing", isTyping);
        return of(Protocol.A_TYPING, f);
    }

    public static OutboundMessage editMessage(String messageId, String content) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("message_id", Objects.requireNonNull(messageId, "messageId"));
        f.put("content", Objects.requireNonNull(content, "content"));
        return of(Protocol.A_EDIT_MESSAGE, f);
    }

    public static OutboundMessage deleteMessage(String messageId) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("message_id", Objects.requireNonNull(messageId, "messageId"));
        return of(Protocol.A_DELETE_MESSAGE, f);
    }

    /**
     * Deletes for everyone, or only hides the message for the caller when {@code forMe} is set.
     */
    public static OutboundMessage deleteMessage(String messageId, boolean forMe) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("message_id", Objects.requireNonNull(messageId, "messageId"));
        f.put("for_me", forMe);
        return of(Protocol.A_DELETE_MESSAGE, f);
    }

    public static OutboundMessage forwardMessage(String sourceMessageId) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("source_message_id", Objects.requireNonNull(sourceMessageId, "sourceMessageId"));
        return of(Protocol.A_FORWARD_MESSAGE, f);
    }

    public static OutboundMessage markRead() {
        return of(Protocol.A_MARK_READ, new LinkedHashMap<>());
    }

    public static OutboundMessage generateBio() {
        return of(Protocol.A_GENERATE_BIO, new LinkedHashMap<>());
    }

    public static OutboundMessage suggestTags(String bioText) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("bio_text", Objects.requireNonNull(bioText, "bioText"));
        return of(Protocol.A_SUGGEST_TAGS, f);
    }

    /**
     * Returns a copy addressed to one direct-message conversation.
     */
    public OutboundMessage inConversation(String conversationId) {
        Map<String, Object> f = new LinkedHashMap<>();
        f.put("conversation_id", Objects.requireNonNull(conversationId, "conversationId"));
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            f.putIfAbsent(e.getKey(), e.getValue());
        }
        return new OutboundMessage(action, f);
    }

    ObjectNode toJson(JsonCodec codec) {
        ObjectNode node = codec.createObjectNode().put(Protocol.F_ACTION, action);
        for (Map.Entry<String, Object> e : fields.entrySet()) {
            Object v = e.getValue();
            if (v instanceof Boolean b) {
                node.put(e.getKey(), b.booleanValue());
            } else if (v instanceof Number n) {
                node.put(e.getKey(), n.longValue());
            } else {
                node.put(e.getKey(), v == null ? null : v.toString());
            }
        }
        return node;
    }

    @Override
    public String toString() {
        return "OutboundMessage[" + action + "]";
    }

    private static OutboundMessage of(String action, Map<String, Object> fields) {
        return new OutboundMessage(action, fields);
    }
}
