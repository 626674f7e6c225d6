package io.cardlink.realtime.core;

/**
 * Real-time protocol constants (paths, query keys, message discriminants and close codes).
 *
 * <p>Shared by every channel variant. Contains no transport or JSON bindings.
 */
public final class Protocol {
    private Protocol() {}

    // Paths below the host
    public static final String WS_PATH_PREFIX = "/api/ws/";
    public static final String PATH_CHAT = "chat";
    public static final String PATH_DIRECT_MESSAGES = "dm";
    public static final String PATH_CARDS = "cards";

    // Query parameter keys
    public static final String Q_TOKEN = "token";
    public static final String Q_OWNER_ID = "owner_id";

    // Discriminant fields
    public static final String F_TYPE = "type";
    public static final String F_ACTION = "action";

    // Outbound actions
    public static final String A_SEND_MESSAGE = "send_message";
    public static final String A_TYPING = "typing";
    public static final String A_EDIT_MESSAGE = "edit_message";
    public static final String A_DELETE_MESSAGE = "delete_message";
    public static final String A_FORWARD_MESSAGE = "forward_message";
    public static final String A_MARK_READ = "mark_read";
    public static final String A_PING = "ping";
    public static final String A_GENERATE_BIO = "generate_bio";
    public static final String A_SUGGEST_TAGS = "suggest_tags";

    // Inbound types
    public static final String T_NEW_MESSAGE = "new_message";
    public static final String T_TYPING = "typing";
    public static final String T_MESSAGE_EDITED = "message_edited";
    public static final String T_MESSAGE_DELETED = "message_deleted";
    public static final String T_MESSAGE_HIDDEN_FOR_USER = "message_hidden_for_user";
    public static final String T_USER_JOINED = "user_joined";
    public static final String T_USER_LEFT = "user_left";
    public static final String T_READ_RECEIPT = "read_receipt";
    public static final String T_PONG = "pong";
    public static final String T_ERROR = "error";
    public static final String T_START = "start";
    public static final String T_CHUNK = "chunk";
    public static final String T_COMPLETE = "complete";
    public static final String T_TAGS_UPDATE = "tags_update";

    // Close codes
    public static final int CLOSE_NORMAL = 1000;
    /** Synthesized locally when a connection drops without a close frame. */
    public static final int CLOSE_ABNORMAL = 1006;
    public static final int CLOSE_INVALID_REQUEST = 4000;
    public static final int CLOSE_UNAUTHORIZED = 4001;
    public static final int CLOSE_ACCESS_DENIED = 4003;
}
