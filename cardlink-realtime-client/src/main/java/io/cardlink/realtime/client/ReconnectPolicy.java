package io.cardlink.realtime.client;

import io.cardlink.realtime.core.Protocol;

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Linear backoff: the n-th retry after an unexpected close waits {@code baseDelay * n}.
 *
 * <p>Not thread-safe; owned by one channel and used on its event loop.
 */
public final class ReconnectPolicy {
    private final int maxAttempts;
    private final Duration baseDelay;
    private final Set<Integer> nonRetryableCodes;
    private int attempts;

    public ReconnectPolicy(int maxAttempts, Duration baseDelay, Set<Integer> nonRetryableCodes) {
        if (maxAttempts < 0) throw new IllegalArgumentException("maxAttempts < 0");
        this.maxAttempts = maxAttempts;
        this.baseDelay = baseDelay;
        this.nonRetryableCodes = Set.copyOf(nonRetryableCodes);
    }

    public static ReconnectPolicy from(ChannelOptions options) {
        return new ReconnectPolicy(options.maxReconnectAttempts(), options.reconnectBaseDelay(),
                options.nonRetryableCloseCodes());
    }

    public boolean isRetryable(int closeCode) {
        return closeCode != Protocol.CLOSE_NORMAL && !nonRetryableCodes.contains(closeCode);
    }

    /**
     * Consumes one attempt and returns its delay, or empty once the budget is spent.
     */
    public Optional<Duration> nextDelay() {
        if (attempts >= maxAttempts) {
            return Optional.empty();
        }
        attempts++;
        return Optional.of(baseDelay.multipliedBy(attempts));
    }

    public void reset() {
        attempts = 0;
    }

    public int attempts() {
        return attempts;
    }

    public int maxAttempts() {
        return maxAttempts;
    }
}
