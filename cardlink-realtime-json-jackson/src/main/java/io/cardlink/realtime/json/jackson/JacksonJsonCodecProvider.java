package io.cardlink.realtime.json.jackson;

import io.cardlink.realtime.json.spi.JsonCodec;
import io.cardlink.realtime.json.spi.JsonCodecProvider;

/**
 * ServiceLoader provider for {@link JacksonJsonCodec}.
 */
public final class JacksonJsonCodecProvider implements JsonCodecProvider {
    @Override
    public int priority() {
        return 100;
    }

    @Override
    public JsonCodec create() {
        return new JacksonJsonCodec();
    }
}
