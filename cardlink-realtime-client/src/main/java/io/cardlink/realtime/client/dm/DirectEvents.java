package io.cardlink.realtime.client.dm;

import io.cardlink.realtime.client.Frames;
import io.cardlink.realtime.client.MessageType;
import io.cardlink.realtime.client.ServerError;
import io.cardlink.realtime.core.Protocol;
import io.cardlink.realtime.json.spi.JsonNode;

import java.util.List;

/**
 * Inbound messages of the direct-message stream. Every event names its conversation.
 */
public final class DirectEvents {
    private DirectEvents() {}

    /**
     * A direct message as broadcast by the server.
     *
     * @param forwardedFromUserId original author when the message was forwarded, else {@code null}
     * @param read whether the recipient has read it; {@code false} for fresh messages
     */
    public record DirectMessage(String id,
                                String conversationId,
                                String senderId,
                                String senderName,
                                String content,
                                String replyToId,
                                String forwardedFromUserId,
                                String forwardedFromName,
                                boolean read,
                                String createdAt) {

        static DirectMessage from(JsonNode m) {
            return new DirectMessage(
                    Frames.requiredText(m, "id"),
                    Frames.requiredText(m, "conversation_id"),
                    Frames.requiredText(m, "sender_id"),
                    Frames.optionalText(m, "sender_name"),
                    Frames.requiredText(m, "content"),
                    Frames.optionalText(m, "reply_to_id"),
                    Frames.optionalText(m, "forwarded_from_user_id"),
                    Frames.optionalText(m, "forwarded_from_name"),
                    Frames.optionalBoolean(m, "is_read", false),
                    Frames.optionalText(m, "created_at"));
        }

        public boolean isForwarded() {
            return forwardedFromUserId != null;
        }
    }

    public record NewMessage(DirectMessage message) {
        public String conversationId() {
            return message.conversationId();
        }
    }

    public record Typing(String conversationId, String userId, String userName, boolean typing) {}

    public record MessageEdited(String conversationId, String messageId, String content, String editedAt) {}

    /** Deleted for both participants. */
    public record MessageDeleted(String conversationId, String messageId) {}

    /** Hidden for the current user only. */
    public record MessageHidden(String conversationId, String messageId) {}

    public record ReadReceipt(String conversationId, String userId, String readAt) {}

    public static final MessageType<NewMessage> NEW_MESSAGE = MessageType.of(Protocol.T_NEW_MESSAGE,
            f -> new NewMessage(DirectMessage.from(Frames.requiredObject(f, "message"))));

    public static final MessageType<Typing> TYPING = MessageType.of(Protocol.T_TYPING,
            f -> new Typing(Frames.requiredText(f, "conversation_id"), Frames.requiredText(f, "user_id"),
                    Frames.optionalText(f, "user_name"), Frames.requiredBoolean(f, "is_typing")));

    public static final MessageType<MessageEdited> MESSAGE_EDITED = MessageType.of(Protocol.T_MESSAGE_EDITED,
            f -> new MessageEdited(Frames.requiredText(f, "conversation_id"), Frames.requiredText(f, "message_id"),
                    editedContent(f), Frames.optionalText(f, "edited_at")));

    public static final MessageType<MessageDeleted> MESSAGE_DELETED = MessageType.of(Protocol.T_MESSAGE_DELETED,
            f -> new MessageDeleted(Frames.requiredText(f, "conversation_id"), Frames.requiredText(f, "message_id")));

    public static final MessageType<MessageHidden> MESSAGE_HIDDEN = MessageType.of(Protocol.T_MESSAGE_HIDDEN_FOR_USER,
            f -> new MessageHidden(Frames.requiredText(f, "conversation_id"), Frames.requiredText(f, "message_id")));

    public static final MessageType<ReadReceipt> READ_RECEIPT = MessageType.of(Protocol.T_READ_RECEIPT,
            f -> new ReadReceipt(Frames.requiredText(f, "conversation_id"), Frames.requiredText(f, "user_id"),
                    Frames.optionalText(f, "read_at")));

    public static final MessageType<ServerError> ERROR = ServerError.TYPE;

    static final List<MessageType<?>> ALL = List.of(
            NEW_MESSAGE, TYPING, MESSAGE_EDITED, MESSAGE_DELETED, MESSAGE_HIDDEN, READ_RECEIPT, ERROR);

    // the DM stream names the field "content", the project chat "new_content"
    private static String editedContent(JsonNode f) {
        return f.has("content") ? Frames.requiredText(f, "content") : Frames.requiredText(f, "new_content");
    }
}
