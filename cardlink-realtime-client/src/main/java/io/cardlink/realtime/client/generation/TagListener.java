package io.cardlink.realtime.client.generation;

import java.util.List;

@FunctionalInterface
public interface TagListener {
    void onTags(List<GenerationEvents.SuggestedTag> tags);
}
