package io.cardlink.realtime.client.chat;

import io.cardlink.realtime.client.Frames;
import io.cardlink.realtime.client.MessageType;
import io.cardlink.realtime.client.ServerError;
import io.cardlink.realtime.core.Protocol;
import io.cardlink.realtime.json.spi.JsonNode;

import java.util.List;

/**
 * Inbound messages of a project chat room.
 */
public final class ChatEvents {
    private ChatEvents() {}

    /**
     * A chat message as broadcast by the server. Timestamps are passed through as sent.
     */
    public record ChatMessage(String id,
                              String projectId,
                              String authorId,
                              String authorName,
                              String authorAvatar,
                              String content,
                              String messageType,
                              String replyToId,
                              String createdAt) {

        static ChatMessage from(JsonNode m) {
            return new ChatMessage(
                    Frames.requiredText(m, "id"),
                    Frames.optionalText(m, "project_id"),
                    Frames.requiredText(m, "author_id"),
                    Frames.optionalText(m, "author_name"),
                    Frames.optionalText(m, "author_avatar"),
                    Frames.requiredText(m, "content"),
                    Frames.optionalText(m, "message_type"),
                    Frames.optionalText(m, "reply_to_id"),
                    Frames.optionalText(m, "created_at"));
        }
    }

    public record NewMessage(ChatMessage message) {}

    public record Typing(String userId, String userName, boolean typing) {}

    public record MessageEdited(String messageId, String newContent, String editedAt) {}

    public record MessageDeleted(String messageId) {}

    /**
     * Someone joined or left the room.
     *
     * @param onlineUsers ids of everyone connected after the change
     */
    public record Presence(String userId, String userName, List<String> onlineUsers) {}

    public record ReadReceipt(String userId, String projectId, String readAt) {}

    public static final MessageType<NewMessage> NEW_MESSAGE = MessageType.of(Protocol.T_NEW_MESSAGE,
            f -> new NewMessage(ChatMessage.from(Frames.requiredObject(f, "message"))));

    public static final MessageType<Typing> TYPING = MessageType.of(Protocol.T_TYPING,
            f -> new Typing(Frames.requiredText(f, "user_id"), Frames.optionalText(f, "user_name"),
                    Frames.requiredBoolean(f, "is_typing")));

    public static final MessageType<MessageEdited> MESSAGE_EDITED = MessageType.of(Protocol.T_MESSAGE_EDITED,
            f -> new MessageEdited(Frames.requiredText(f, "message_id"), Frames.requiredText(f, "new_content"),
                    Frames.optionalText(f, "edited_at")));

    public static final MessageType<MessageDeleted> MESSAGE_DELETED = MessageType.of(Protocol.T_MESSAGE_DELETED,
            f -> new MessageDeleted(Frames.requiredText(f, "message_id")));

    public static final MessageType<Presence> USER_JOINED = MessageType.of(Protocol.T_USER_JOINED, ChatEvents::presence);

    public static final MessageType<Presence> USER_LEFT = MessageType.of(Protocol.T_USER_LEFT, ChatEvents::presence);

    public static final MessageType<ReadReceipt> READ_RECEIPT = MessageType.of(Protocol.T_READ_RECEIPT,
            f -> new ReadReceipt(Frames.requiredText(f, "user_id"), Frames.optionalText(f, "project_id"),
                    Frames.optionalText(f, "read_at")));

    public static final MessageType<ServerError> ERROR = ServerError.TYPE;

    static final List<MessageType<?>> ALL = List.of(
            NEW_MESSAGE, TYPING, MESSAGE_EDITED, MESSAGE_DELETED, USER_JOINED, USER_LEFT, READ_RECEIPT, ERROR);

    private static Presence presence(JsonNode f) {
        return new Presence(Frames.requiredText(f, "user_id"), Frames.optionalText(f, "user_name"),
                Frames.textList(f, "online_users"));
    }
}
