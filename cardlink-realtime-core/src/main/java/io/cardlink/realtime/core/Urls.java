package io.cardlink.realtime.core;

import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Utility to build WebSocket URLs with lexicographically sorted query parameter keys.
 */
public final class Urls {
    private Urls() {}

    public static URI withQuery(URI base, Map<String, String> params) {
        Objects.requireNonNull(base, "base");
        if (params == null || params.isEmpty()) return base;

        TreeMap<String, String> sorted = new TreeMap<>(params);
        StringBuilder sb = new StringBuilder(base.toString());
        sb.append(base.getQuery() == null ? "?" : "&");

        boolean first = true;
        for (Map.Entry<String, String> e : sorted.entrySet()) {
            if (e.getKey() == null || e.getValue() == null) continue;
            if (!first) sb.append("&");
            first = false;
            sb.append(encode(e.getKey())).append("=").append(encode(e.getValue()));
        }
        return URI.create(sb.toString());
    }

    /**
     * Rewrites an HTTP(S) base URL to its WebSocket origin.
     *
     * <p>{@code http} becomes {@code ws}, {@code https} becomes {@code wss}; a trailing
     * {@code /api} segment and trailing slashes are removed. {@code ws}/{@code wss} URLs
     * are only trimmed.
     */
    public static URI toWebSocketBase(URI base) {
        Objects.requireNonNull(base, "base");
        String scheme = base.getScheme() == null ? "" : base.getScheme().toLowerCase(Locale.ROOT);
        String wsScheme;
        switch (scheme) {
            case "http":
            case "ws":
                wsScheme = "ws";
                break;
            case "https":
            case "wss":
                wsScheme = "wss";
                break;
            default:
                throw new IllegalArgumentException("unsupported scheme: " + base);
        }

        String path = base.getRawPath() == null ? "" : base.getRawPath();
        while (path.endsWith("/")) path = path.substring(0, path.length() - 1);
        if (path.endsWith("/api")) path = path.substring(0, path.length() - "/api".length());
        while (path.endsWith("/")) path = path.substring(0, path.length() - 1);

        return URI.create(wsScheme + "://" + base.getRawAuthority() + path);
    }

    /**
     * Encodes a single path segment (resource ids are caller-supplied).
     */
    public static String encodeSegment(String segment) {
        return encode(segment).replace("+", "%20");
    }

    private static String encode(String s) {
        return URLEncoder.encode(s, StandardCharsets.UTF_8);
    }
}
