package io.cardlink.realtime.core;

import java.util.Optional;

/**
 * External token storage owned by the hosting application.
 *
 * <p>The real-time layer only reads from it; {@link #set} and {@link #remove} exist for the host.
 */
public interface TokenStorage {
    Optional<String> get();
    void set(String token);
    void remove();
}
