package io.cardlink.realtime.json.spi;

/**
 * ServiceLoader entry point for {@link JsonCodec} implementations.
 *
 * <p>Register implementations in {@code META-INF/services/io.cardlink.realtime.json.spi.JsonCodecProvider}.
 */
public interface JsonCodecProvider {

    /**
     * Higher wins when several providers are on the classpath.
     */
    default int priority() {
        return 0;
    }

    JsonCodec create();
}
