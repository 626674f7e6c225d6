package io.cardlink.realtime.client.generation;

/**
 * The caller-owned text a generation replaces, e.g. the bio field of an editor.
 *
 * <p>Called on the channel's event loop. {@link #get()} may return {@code null}; a rollback
 * passes it back to {@link #set} unchanged.
 */
public interface EditableContent {
    String get();

    void set(String value);
}
