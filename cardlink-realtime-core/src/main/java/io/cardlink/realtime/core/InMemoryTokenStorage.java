package io.cardlink.realtime.core;

import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link TokenStorage} kept in memory, for hosts without a persistent store and for tests.
 */
public final class InMemoryTokenStorage implements TokenStorage {
    private final AtomicReference<String> token = new AtomicReference<>();

    public InMemoryTokenStorage() {
    }

    public InMemoryTokenStorage(String initial) {
        token.set(initial);
    }

    @Override
    public Optional<String> get() {
        String t = token.get();
        return t == null || t.isBlank() ? Optional.empty() : Optional.of(t);
    }

    @Override
    public void set(String token) {
        this.token.set(Objects.requireNonNull(token, "token"));
    }

    @Override
    public void remove() {
        token.set(null);
    }
}
