package io.cardlink.realtime.client.generation;

import io.cardlink.realtime.client.ChannelRuntime;
import io.cardlink.realtime.client.ConnectionListener;
import io.cardlink.realtime.client.MessageHandler;
import io.cardlink.realtime.client.MessageType;
import io.cardlink.realtime.client.OutboundMessage;
import io.cardlink.realtime.client.ReconnectingChannel;
import io.cardlink.realtime.client.ServerError;
import io.cardlink.realtime.client.Subscription;
import io.cardlink.realtime.client.loop.EventLoop;
import io.cardlink.realtime.client.loop.TimerHandle;
import io.cardlink.realtime.core.ChannelEndpoint;
import io.cardlink.realtime.core.ConnectionState;
import io.cardlink.realtime.core.RealtimeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * AI bio generation and tag suggestions for one business card.
 *
 * <p>{@link #generate()} snapshots the {@link EditableContent} and sends {@code generate_bio} in
 * the same event-loop task. Chunks are accumulated off to the side; on {@code complete} the
 * content is replaced with the final text, on {@code error}, {@link #cancel()} or a lost
 * connection it is restored to the snapshot exactly. Only one generation runs at a time.
 *
 * <p>Cancelling is local: the server keeps streaming, and the frames of a cancelled generation
 * are discarded up to and including its terminal {@code complete} or {@code error}.
 *
 * <p>Tag suggestions run independently of generations and have their own loading flag.
 */
public final class BioGenerationClient {
    private static final Logger LOG = LoggerFactory.getLogger(BioGenerationClient.class);

    static final String REASON_CANCELLED = "cancelled";
    static final String REASON_CONNECTION_LOST = "connection lost";

    private final ReconnectingChannel channel;
    private final EditableContent content;
    private final EventLoop loop;
    private final List<GenerationListener> generationListeners = new CopyOnWriteArrayList<>();
    private final List<TagListener> tagListeners = new CopyOnWriteArrayList<>();

    private volatile boolean generating;
    private volatile boolean tagsLoading;

    // loop-confined
    private StreamAccumulator session;
    private CompletableFuture<String> pendingGeneration;
    private int superseded;
    private TimerHandle tagDebounce;
    private TimerHandle tagsAfterCommit;

    public BioGenerationClient(URI baseUrl, String cardId, String ownerId, EditableContent content, ChannelRuntime runtime) {
        this.content = Objects.requireNonNull(content, "content");
        this.channel = new ReconnectingChannel(ChannelEndpoint.cardGeneration(baseUrl, cardId, ownerId),
                GenerationEvents.ALL, runtime);
        this.loop = channel.eventLoop();

        channel.on(GenerationEvents.START, this::onStart);
        channel.on(GenerationEvents.CHUNK, this::onChunk);
        channel.on(GenerationEvents.COMPLETE, this::onComplete);
        channel.on(GenerationEvents.ERROR, this::onError);
        channel.on(GenerationEvents.TAGS_UPDATE, this::onTags);
        channel.addConnectionListener(new ConnectionListener() {
            @Override
            public void onStateChanged(ConnectionState previous, ConnectionState current) {
                if (previous == ConnectionState.OPEN) {
                    onConnectionLost();
                }
            }
        });
    }

    public CompletableFuture<Void> connect() {
        return channel.connect();
    }

    /**
     * Closes the channel. A running generation is rolled back and pending tag requests are dropped.
     */
    public void disconnect() {
        channel.runOnLoop(() -> {
            cancelTagTimers();
            channel.disconnect();
        });
    }

    public ConnectionState state() {
        return channel.state();
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    public boolean isGenerating() {
        return generating;
    }

    public boolean isTagsLoading() {
        return tagsLoading;
    }

    /**
     * Starts a generation.
     *
     * @return completes with the committed text; fails with {@link RealtimeException.GenerationInProgress},
     *         {@link RealtimeException.ChannelNotOpen}, {@link RealtimeException.GenerationFailed} or
     *         {@link RealtimeException.GenerationCancelled}
     */
    public CompletableFuture<String> generate() {
        return channel.callOnLoop(this::generateOnLoop);
    }

    /**
     * Rolls back the running generation, if any. The server's stream is not aborted.
     */
    public void cancel() {
        channel.runOnLoop(() -> {
            if (session == null) {
                return;
            }
            superseded++;
            LOG.debug("[{}] Generation cancelled, {} superseded stream(s) pending", channel.endpoint(), superseded);
            rollback(REASON_CANCELLED, new RealtimeException.GenerationCancelled());
        });
    }

    /**
     * Asks the server for tag suggestions if the channel is open and the text is long enough.
     *
     * @return false if the request was not sent
     */
    public boolean requestTags(String text) {
        if (loop.inEventLoop()) {
            return requestTagsOnLoop(text);
        }
        if (!eligibleForTags(text)) {
            return false;
        }
        loop.execute(() -> requestTagsOnLoop(text));
        return true;
    }

    /**
     * Reports an edit of the content; tags are requested once edits pause for the debounce interval.
     */
    public void contentEdited(String text) {
        channel.runOnLoop(() -> {
            if (tagDebounce != null) {
                tagDebounce.cancel();
            }
            tagDebounce = loop.schedule(() -> {
                tagDebounce = null;
                requestTagsOnLoop(text);
            }, channel.options().tagDebounce());
        });
    }

    public Subscription addGenerationListener(GenerationListener listener) {
        Objects.requireNonNull(listener, "listener");
        generationListeners.add(listener);
        return () -> generationListeners.remove(listener);
    }

    public Subscription addTagListener(TagListener listener) {
        Objects.requireNonNull(listener, "listener");
        tagListeners.add(listener);
        return () -> tagListeners.remove(listener);
    }

    public Subscription addConnectionListener(ConnectionListener listener) {
        return channel.addConnectionListener(listener);
    }

    public <T> Subscription on(MessageType<T> type, MessageHandler<? super T> handler) {
        return channel.on(type, handler);
    }

    private CompletableFuture<String> generateOnLoop() {
        if (session != null) {
            return CompletableFuture.failedFuture(new RealtimeException.GenerationInProgress());
        }
        if (!channel.isOpen()) {
            return CompletableFuture.failedFuture(new RealtimeException.ChannelNotOpen(channel.endpoint().toString()));
        }
        StreamAccumulator acc = new StreamAccumulator();
        acc.begin(content.get());
        session = acc;
        generating = true;
        CompletableFuture<String> result = new CompletableFuture<>();
        pendingGeneration = result;

        if (!channel.trySend(OutboundMessage.generateBio())) {
            LOG.warn("[{}] generate_bio was not sent", channel.endpoint());
            rollback(REASON_CONNECTION_LOST, new RealtimeException.ChannelNotOpen(channel.endpoint().toString()));
            return result;
        }
        LOG.debug("[{}] Generation started", channel.endpoint());
        notifyGeneration(GenerationListener::onStarted);
        return result;
    }

    private void onStart(GenerationEvents.Start start) {
        if (superseded > 0 || session == null) {
            return;
        }
        session.restart();
    }

    private void onChunk(GenerationEvents.Chunk chunk) {
        if (superseded > 0 || session == null) {
            return;
        }
        String accumulated = session.append(chunk.content());
        notifyGeneration(l -> l.onChunk(chunk.content(), accumulated));
    }

    private void onComplete(GenerationEvents.Complete complete) {
        if (superseded > 0) {
            superseded--;
            return;
        }
        if (session == null) {
            LOG.debug("[{}] complete without a generation", channel.endpoint());
            return;
        }
        String committed = session.commit(complete.fullBio());
        applyContent(committed);
        CompletableFuture<String> result = finish();
        LOG.debug("[{}] Generation committed ({} chars)", channel.endpoint(), committed.length());
        notifyGeneration(l -> l.onCommitted(committed));
        result.complete(committed);

        if (tagsAfterCommit != null) {
            tagsAfterCommit.cancel();
        }
        tagsAfterCommit = loop.schedule(() -> {
            tagsAfterCommit = null;
            requestTagsOnLoop(committed);
        }, channel.options().tagsAfterCommitDelay());
    }

    private void onError(ServerError error) {
        if (superseded > 0) {
            superseded--;
            return;
        }
        if (session != null) {
            LOG.warn("[{}] Generation failed: {}", channel.endpoint(), error.message());
            // error frames carry no request id; an outstanding tag request may be the one that failed
            tagsLoading = false;
            rollback(error.message(), new RealtimeException.GenerationFailed(error.message()));
        } else if (tagsLoading) {
            LOG.warn("[{}] Tag suggestion failed: {}", channel.endpoint(), error.message());
            tagsLoading = false;
        }
    }

    private void onTags(GenerationEvents.TagsUpdate update) {
        tagsLoading = false;
        for (TagListener l : tagListeners) {
            try {
                l.onTags(update.tags());
            } catch (RuntimeException e) {
                LOG.error("[{}] Tag listener failed", channel.endpoint(), e);
            }
        }
    }

    private void onConnectionLost() {
        tagsLoading = false;
        // a new socket carries no frames of the old one
        superseded = 0;
        if (session != null) {
            LOG.warn("[{}] Connection lost during generation", channel.endpoint());
            rollback(REASON_CONNECTION_LOST, new RealtimeException.GenerationFailed(REASON_CONNECTION_LOST));
        }
    }

    private boolean requestTagsOnLoop(String text) {
        if (!eligibleForTags(text)) {
            LOG.debug("[{}] Not requesting tags (open={}, length={})", channel.endpoint(), channel.isOpen(),
                    text == null ? 0 : text.trim().length());
            return false;
        }
        tagsLoading = true;
        if (!channel.trySend(OutboundMessage.suggestTags(text))) {
            tagsLoading = false;
            return false;
        }
        return true;
    }

    private boolean eligibleForTags(String text) {
        return channel.isOpen() && text != null && text.trim().length() >= channel.options().minTagTextLength();
    }

    private void rollback(String reason, RealtimeException failure) {
        String restored = session.rollback();
        applyContent(restored);
        CompletableFuture<String> result = finish();
        notifyGeneration(l -> l.onRolledBack(restored, reason));
        result.completeExceptionally(failure);
    }

    private CompletableFuture<String> finish() {
        CompletableFuture<String> result = pendingGeneration;
        pendingGeneration = null;
        session = null;
        generating = false;
        return result;
    }

    private void applyContent(String value) {
        try {
            content.set(value);
        } catch (RuntimeException e) {
            LOG.error("[{}] Could not update content", channel.endpoint(), e);
        }
    }

    private void cancelTagTimers() {
        if (tagDebounce != null) {
            tagDebounce.cancel();
            tagDebounce = null;
        }
        if (tagsAfterCommit != null) {
            tagsAfterCommit.cancel();
            tagsAfterCommit = null;
        }
    }

    private void notifyGeneration(Consumer<GenerationListener> call) {
        for (GenerationListener l : generationListeners) {
            try {
                call.accept(l);
            } catch (RuntimeException e) {
                LOG.error("[{}] Generation listener failed", channel.endpoint(), e);
            }
        }
    }
}
