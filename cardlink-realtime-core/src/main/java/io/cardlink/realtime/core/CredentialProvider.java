package io.cardlink.realtime.core;

import java.util.Optional;

/**
 * Supplies the current access token for a connect attempt.
 *
 * <p>Called once per attempt, reconnects included. Implementations never mint tokens.
 */
@FunctionalInterface
public interface CredentialProvider {

    Optional<String> currentCredential();

    static CredentialProvider of(String token) {
        Optional<String> fixed = Optional.ofNullable(token);
        return () -> fixed;
    }

    static CredentialProvider from(TokenStorage storage) {
        return storage::get;
    }
}
