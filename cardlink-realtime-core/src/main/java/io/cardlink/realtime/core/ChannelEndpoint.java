package io.cardlink.realtime.core;

import java.net.URI;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Identifies one connection target: base URL, channel family, resource id and extra query parameters.
 *
 * <p>The credential is not part of the endpoint; it is resolved at every connect attempt, so a
 * reconnect picks up a refreshed token.
 *
 * @param baseUrl HTTP(S) or WS(S) base URL of the backend
 * @param kind the channel family
 * @param resourceId project or card id; {@code null} for {@link ChannelKind#DIRECT_MESSAGES}
 * @param extraQuery additional query parameters (e.g. {@code owner_id})
 */
public record ChannelEndpoint(URI baseUrl, ChannelKind kind, String resourceId, Map<String, String> extraQuery) {
    public ChannelEndpoint {
        Objects.requireNonNull(baseUrl, "baseUrl");
        Objects.requireNonNull(kind, "kind");
        if (kind.requiresResourceId() && (resourceId == null || resourceId.isBlank())) {
            throw new IllegalArgumentException(kind + " requires a resource id");
        }
        extraQuery = extraQuery == null ? Map.of() : Map.copyOf(extraQuery);
    }

    public static ChannelEndpoint projectChat(URI baseUrl, String projectId) {
        return new ChannelEndpoint(baseUrl, ChannelKind.PROJECT_CHAT, projectId, Map.of());
    }

    public static ChannelEndpoint directMessages(URI baseUrl) {
        return new ChannelEndpoint(baseUrl, ChannelKind.DIRECT_MESSAGES, null, Map.of());
    }

    public static ChannelEndpoint cardGeneration(URI baseUrl, String cardId, String ownerId) {
        Objects.requireNonNull(ownerId, "ownerId");
        return new ChannelEndpoint(baseUrl, ChannelKind.CARD_GENERATION, cardId, Map.of(Protocol.Q_OWNER_ID, ownerId));
    }

    /**
     * Builds the concrete WebSocket URL for one connect attempt.
     *
     * @param credential the current access token
     */
    public URI resolve(String credential) {
        Objects.requireNonNull(credential, "credential");
        StringBuilder path = new StringBuilder(Protocol.WS_PATH_PREFIX).append(kind.pathSegment());
        if (kind.requiresResourceId()) {
            path.append('/').append(Urls.encodeSegment(resourceId));
        }
        URI base = URI.create(Urls.toWebSocketBase(baseUrl) + path.toString());

        Map<String, String> query = new LinkedHashMap<>(extraQuery);
        query.put(Protocol.Q_TOKEN, credential);
        return Urls.withQuery(base, query);
    }

    @Override
    public String toString() {
        // never print the credential; it is not stored here anyway
        return kind + (resourceId == null ? "" : "/" + resourceId);
    }
}
