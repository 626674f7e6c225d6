package io.cardlink.realtime.client;

import io.cardlink.realtime.core.Protocol;

import java.time.Duration;
import java.util.Objects;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Immutable tuning for channel clients. Use {@link #builder()} or {@link #fromProperties(Properties)}.
 */
public final class ChannelOptions {

    public static final String PREFIX = "cardlink.realtime.";

    private static final ChannelOptions DEFAULTS = builder().build();

    private final int maxReconnectAttempts;
    private final Duration reconnectBaseDelay;
    private final Set<Integer> nonRetryableCloseCodes;
    private final Duration keepaliveInterval;
    private final Duration connectTimeout;
    private final Duration tagDebounce;
    private final int minTagTextLength;
    private final Duration tagsAfterCommitDelay;

    private ChannelOptions(Builder b) {
        this.maxReconnectAttempts = b.maxReconnectAttempts;
        this.reconnectBaseDelay = b.reconnectBaseDelay;
        this.nonRetryableCloseCodes = Set.copyOf(b.nonRetryableCloseCodes);
        this.keepaliveInterval = b.keepaliveInterval;
        this.connectTimeout = b.connectTimeout;
        this.tagDebounce = b.tagDebounce;
        this.minTagTextLength = b.minTagTextLength;
        this.tagsAfterCommitDelay = b.tagsAfterCommitDelay;
    }

    public static ChannelOptions defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Reads {@code cardlink.realtime.*} keys; absent keys keep their defaults.
     *
     * @throws IllegalArgumentException if a value is not a valid number
     */
    public static ChannelOptions fromProperties(Properties props) {
        Objects.requireNonNull(props, "props");
        Builder b = builder();
        String v;
        if ((v = prop(props, "reconnect.max-attempts")) != null) b.maxReconnectAttempts(parseInt("reconnect.max-attempts", v));
        if ((v = prop(props, "reconnect.base-delay-ms")) != null) b.reconnectBaseDelay(millis("reconnect.base-delay-ms", v));
        if ((v = prop(props, "reconnect.non-retryable-codes")) != null) {
            Set<Integer> codes = new TreeSet<>();
            for (String part : v.split(",")) {
                if (!part.isBlank()) codes.add(parseInt("reconnect.non-retryable-codes", part.trim()));
            }
            b.nonRetryableCloseCodes(codes);
        }
        if ((v = prop(props, "keepalive.interval-ms")) != null) b.keepaliveInterval(millis("keepalive.interval-ms", v));
        if ((v = prop(props, "connect.timeout-ms")) != null) b.connectTimeout(millis("connect.timeout-ms", v));
        if ((v = prop(props, "tags.debounce-ms")) != null) b.tagDebounce(millis("tags.debounce-ms", v));
        if ((v = prop(props, "tags.min-length")) != null) b.minTagTextLength(parseInt("tags.min-length", v));
        if ((v = prop(props, "tags.after-commit-delay-ms")) != null) b.tagsAfterCommitDelay(millis("tags.after-commit-delay-ms", v));
        return b.build();
    }

    public int maxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public Duration reconnectBaseDelay() {
        return reconnectBaseDelay;
    }

    /**
     * Close codes that end the channel without a retry. {@code 1000} is always terminal.
     */
    public Set<Integer> nonRetryableCloseCodes() {
        return nonRetryableCloseCodes;
    }

    public Duration keepaliveInterval() {
        return keepaliveInterval;
    }

    public Duration connectTimeout() {
        return connectTimeout;
    }

    public Duration tagDebounce() {
        return tagDebounce;
    }

    public int minTagTextLength() {
        return minTagTextLength;
    }

    public Duration tagsAfterCommitDelay() {
        return tagsAfterCommitDelay;
    }

    @Override
    public String toString() {
        return "ChannelOptions{maxReconnectAttempts=" + maxReconnectAttempts
                + ", reconnectBaseDelay=" + reconnectBaseDelay
                + ", nonRetryableCloseCodes=" + new TreeSet<>(nonRetryableCloseCodes)
                + ", keepaliveInterval=" + keepaliveInterval
                + ", connectTimeout=" + connectTimeout
                + ", tagDebounce=" + tagDebounce
                + ", minTagTextLength=" + minTagTextLength
                + ", tagsAfterCommitDelay=" + tagsAfterCommitDelay + '}';
    }

    private static String prop(Properties props, String key) {
        String v = props.getProperty(PREFIX + key);
        return v == null || v.isBlank() ? null : v.trim();
    }

    private static int parseInt(String key, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    private static Duration millis(String key, String value) {
        try {
            return Duration.ofMillis(Long.parseLong(value));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("invalid value for " + PREFIX + key + ": " + value, e);
        }
    }

    public static final class Builder {
        private int maxReconnectAttempts = 5;
        private Duration reconnectBaseDelay = Duration.ofMillis(1000);
        private Set<Integer> nonRetryableCloseCodes = Set.of(Protocol.CLOSE_INVALID_REQUEST, Protocol.CLOSE_ACCESS_DENIED);
        private Duration keepaliveInterval = Duration.ofMillis(30_000);
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration tagDebounce = Duration.ofMillis(1500);
        private int minTagTextLength = 20;
        private Duration tagsAfterCommitDelay = Duration.ofMillis(500);

        private Builder() {}

        public Builder maxReconnectAttempts(int maxReconnectAttempts) {
            if (maxReconnectAttempts < 0) throw new IllegalArgumentException("maxReconnectAttempts < 0");
            this.maxReconnectAttempts = maxReconnectAttempts;
            return this;
        }

        public Builder reconnectBaseDelay(Duration reconnectBaseDelay) {
            this.reconnectBaseDelay = positive(reconnectBaseDelay, "reconnectBaseDelay");
            return this;
        }

        public Builder nonRetryableCloseCodes(Set<Integer> codes) {
            this.nonRetryableCloseCodes = Set.copyOf(Objects.requireNonNull(codes, "codes"));
            return this;
        }

        public Builder keepaliveInterval(Duration keepaliveInterval) {
            this.keepaliveInterval = positive(keepaliveInterval, "keepaliveInterval");
            return this;
        }

        public Builder connectTimeout(Duration connectTimeout) {
            this.connectTimeout = positive(connectTimeout, "connectTimeout");
            return this;
        }

        public Builder tagDebounce(Duration tagDebounce) {
            this.tagDebounce = positive(tagDebounce, "tagDebounce");
            return this;
        }

        public Builder minTagTextLength(int minTagTextLength) {
            if (minTagTextLength < 0) throw new IllegalArgumentException("minTagTextLength < 0");
            this.minTagTextLength = minTagTextLength;
            return this;
        }

        public Builder tagsAfterCommitDelay(Duration tagsAfterCommitDelay) {
            Objects.requireNonNull(tagsAfterCommitDelay, "tagsAfterCommitDelay");
            if (tagsAfterCommitDelay.isNegative()) throw new IllegalArgumentException("tagsAfterCommitDelay < 0");
            this.tagsAfterCommitDelay = tagsAfterCommitDelay;
            return this;
        }

        public ChannelOptions build() {
            return new ChannelOptions(this);
        }

        private static Duration positive(Duration d, String name) {
            Objects.requireNonNull(d, name);
            if (d.isNegative() || d.isZero()) throw new IllegalArgumentException(name + " must be positive");
            return d;
        }
    }
}
