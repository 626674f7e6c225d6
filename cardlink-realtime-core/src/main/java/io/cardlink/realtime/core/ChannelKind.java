package io.cardlink.realtime.core;

/**
 * The three real-time channel families exposed by the server.
 */
public enum ChannelKind {
    /** Project chat room, scoped by project id. */
    PROJECT_CHAT(Protocol.PATH_CHAT, true),
    /** The caller's direct-message stream; conversations are addressed per frame. */
    DIRECT_MESSAGES(Protocol.PATH_DIRECT_MESSAGES, false),
    /** AI bio generation and tag suggestions for one business card. */
    CARD_GENERATION(Protocol.PATH_CARDS, true);

    private final String pathSegment;
    private final boolean requiresResourceId;

    ChannelKind(String pathSegment, boolean requiresResourceId) {
        this.pathSegment = pathSegment;
        this.requiresResourceId = requiresResourceId;
    }

    public String pathSegment() {
        return pathSegment;
    }

    public boolean requiresResourceId() {
        return requiresResourceId;
    }
}
