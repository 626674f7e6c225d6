package io.cardlink.realtime.client.generation;

/**
 * Progress of generations, invoked on the channel's event loop. All methods default to no-ops.
 */
public interface GenerationListener {

    /** The {@code generate_bio} request was sent and the content snapshot taken. */
    default void onStarted() {}

    default void onChunk(String chunk, String accumulated) {}

    default void onCommitted(String content) {}

    /**
     * The content was restored to its snapshot.
     *
     * @param reason server error message, {@code "cancelled"} or {@code "connection lost"}
     */
    default void onRolledBack(String restored, String reason) {}
}
