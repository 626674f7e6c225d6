package io.cardlink.realtime.client.generation;

import io.cardlink.realtime.client.Frames;
import io.cardlink.realtime.client.MessageType;
import io.cardlink.realtime.client.ServerError;
import io.cardlink.realtime.core.Protocol;
import io.cardlink.realtime.json.spi.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Inbound messages of the card generation stream.
 */
public final class GenerationEvents {
    private GenerationEvents() {}

    /** The server began streaming; {@code message} is an optional status text. */
    public record Start(String message) {}

    public record Chunk(String content) {}

    /** End of stream. {@code fullBio} may be {@code null} or blank, in which case the buffer is final. */
    public record Complete(String fullBio) {}

    public record SuggestedTag(String name, String category, double confidence, String reason) {}

    public record TagsUpdate(List<SuggestedTag> tags) {
        public TagsUpdate {
            tags = List.copyOf(tags);
        }

        public List<String> names() {
            List<String> names = new ArrayList<>(tags.size());
            for (SuggestedTag t : tags) names.add(t.name());
            return names;
        }
    }

    public static final MessageType<Start> START = MessageType.of(Protocol.T_START,
            f -> new Start(Frames.optionalText(f, "message")));

    public static final MessageType<Chunk> CHUNK = MessageType.of(Protocol.T_CHUNK, f -> {
        String content = Frames.optionalText(f, "content");
        return new Chunk(content == null ? "" : content);
    });

    public static final MessageType<Complete> COMPLETE = MessageType.of(Protocol.T_COMPLETE,
            f -> new Complete(Frames.optionalText(f, "full_bio")));

    public static final MessageType<TagsUpdate> TAGS_UPDATE = MessageType.of(Protocol.T_TAGS_UPDATE,
            GenerationEvents::tags);

    public static final MessageType<ServerError> ERROR = ServerError.TYPE;

    static final List<MessageType<?>> ALL = List.of(START, CHUNK, COMPLETE, TAGS_UPDATE, ERROR);

    private static TagsUpdate tags(JsonNode f) {
        List<SuggestedTag> tags = new ArrayList<>();
        for (JsonNode t : Frames.array(f, "tags")) {
            tags.add(new SuggestedTag(
                    Frames.requiredText(t, "name"),
                    Frames.optionalText(t, "category"),
                    t.has("confidence") ? t.get("confidence").asDouble(0.0) : 0.0,
                    Frames.optionalText(t, "reason")));
        }
        return new TagsUpdate(tags);
    }
}
