package io.cardlink.realtime.json.spi;

import java.util.Comparator;
import java.util.Objects;
import java.util.ServiceLoader;
import java.util.stream.StreamSupport;

/**
 * Resolves a {@link JsonCodec} through {@link ServiceLoader}.
 */
public final class JsonCodecs {
    private JsonCodecs() {}

    /**
     * Loads the highest-priority codec visible to the context class loader.
     *
     * @throws IllegalStateException if no provider is registered
     */
    public static JsonCodec load() {
        return load(Thread.currentThread().getContextClassLoader());
    }

    public static JsonCodec load(ClassLoader cl) {
        Objects.requireNonNull(cl, "cl");
        ServiceLoader<JsonCodecProvider> loader = ServiceLoader.load(JsonCodecProvider.class, cl);
        return StreamSupport.stream(loader.spliterator(), false)
                .max(Comparator.comparingInt(JsonCodecProvider::priority))
                .map(JsonCodecProvider::create)
                .orElseThrow(() -> new IllegalStateException(
                        "no JsonCodecProvider on the classpath; add cardlink-realtime-json-jackson"));
    }
}
