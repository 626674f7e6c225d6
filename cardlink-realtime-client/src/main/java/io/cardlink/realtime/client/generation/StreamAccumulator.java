package io.cardlink.realtime.client.generation;

/**
 * Buffers the chunks of one generation and remembers the content it may have to restore.
 *
 * <p>One instance per generation: {@code IDLE -> STREAMING -> COMMITTED | ROLLED_BACK}.
 * Not thread-safe.
 */
public final class StreamAccumulator {
    private final StringBuilder buffer = new StringBuilder();
    private StreamPhase phase = StreamPhase.IDLE;
    private String snapshot;

    /**
     * Enters {@code STREAMING}. Must be called before the request that starts the stream is sent.
     *
     * @param snapshot the content to restore on rollback, possibly {@code null}
     */
    public void begin(String snapshot) {
        requirePhase(StreamPhase.IDLE);
        this.snapshot = snapshot;
        buffer.setLength(0);
        phase = StreamPhase.STREAMING;
    }

    /**
     * Drops what was buffered so far; the server (re)started the stream.
     */
    public void restart() {
        requirePhase(StreamPhase.STREAMING);
        buffer.setLength(0);
    }

    /**
     * @return the accumulated text including {@code chunk}
     */
    public String append(String chunk) {
        requirePhase(StreamPhase.STREAMING);
        if (chunk != null) {
            buffer.append(chunk);
        }
        return buffer.toString();
    }

    /**
     * @param fullText the server's final text; {@code null} or blank commits the buffer
     * @return the committed text
     */
    public String commit(String fullText) {
        requirePhase(StreamPhase.STREAMING);
        phase = StreamPhase.COMMITTED;
        return fullText != null && !fullText.isBlank() ? fullText : buffer.toString();
    }

    /**
     * @return the snapshot taken by {@link #begin}, unchanged
     */
    public String rollback() {
        requirePhase(StreamPhase.STREAMING);
        phase = StreamPhase.ROLLED_BACK;
        buffer.setLength(0);
        return snapshot;
    }

    public StreamPhase phase() {
        return phase;
    }

    public String buffer() {
        return buffer.toString();
    }

    public String snapshot() {
        return snapshot;
    }

    private void requirePhase(StreamPhase expected) {
        if (phase != expected) {
            throw new IllegalStateException("expected " + expected + " but was " + phase);
        }
    }
}
