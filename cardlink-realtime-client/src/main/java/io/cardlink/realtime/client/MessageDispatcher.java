package io.cardlink.realtime.client;

import io.cardlink.realtime.core.Protocol;
import io.cardlink.realtime.core.RealtimeException;
import io.cardlink.realtime.json.spi.JsonCodec;
import io.cardlink.realtime.json.spi.JsonException;
import io.cardlink.realtime.json.spi.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Routes inbound text frames to typed handlers by their {@code type} discriminant.
 *
 * <p>{@link #dispatch(String)} never throws: frames that cannot be parsed, carry no type, carry an
 * unknown type or fail shape validation are logged and dropped. {@code pong} frames are swallowed.
 * Handlers for one type run in registration order; a failing handler does not stop its siblings.
 */
public final class MessageDispatcher {
    private static final Logger LOG = LoggerFactory.getLogger(MessageDispatcher.class);

    private final JsonCodec codec;
    private final String channelName;
    private final Map<String, MessageType<?>> catalog;
    private final Map<String, List<Registration<?>>> handlers = new ConcurrentHashMap<>();

    public MessageDispatcher(JsonCodec codec, String channelName, Collection<MessageType<?>> types) {
        this.codec = Objects.requireNonNull(codec, "codec");
        this.channelName = Objects.requireNonNull(channelName, "channelName");
        Map<String, MessageType<?>> byName = new LinkedHashMap<>();
        for (MessageType<?> t : types) {
            if (byName.putIfAbsent(t.name(), t) != null) {
                throw new IllegalArgumentException("duplicate message type: " + t.name());
            }
        }
        this.catalog = Map.copyOf(byName);
    }

    public <T> Subscription on(MessageType<T> type, MessageHandler<? super T> handler) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(handler, "handler");
        if (catalog.get(type.name()) != type) {
            throw new IllegalArgumentException(channelName + " does not deliver message type " + type.name());
        }
        Registration<T> reg = new Registration<>(handler);
        List<Registration<?>> list = handlers.computeIfAbsent(type.name(), k -> new CopyOnWriteArrayList<>());
        list.add(reg);
        AtomicBoolean removed = new AtomicBoolean();
        return () -> {
            if (removed.compareAndSet(false, true)) {
                list.remove(reg);
            }
        };
    }

    public boolean supports(MessageType<?> type) {
        return catalog.get(type.name()) == type;
    }

    public void dispatch(String text) {
        JsonNode frame;
        try {
            frame = codec.readTree(text);
        } catch (JsonException | RuntimeException e) {
            LOG.warn("[{}] Dropping unparseable frame: {}", channelName, e.getMessage());
            return;
        }
        if (frame == null || !frame.isObject()) {
            LOG.warn("[{}] Dropping non-object frame", channelName);
            return;
        }
        JsonNode typeNode = frame.get(Protocol.F_TYPE);
        if (typeNode == null || !typeNode.isTextual()) {
            LOG.warn("[{}] Dropping frame without a type", channelName);
            return;
        }
        String name = typeNode.asText();
        if (Protocol.T_PONG.equals(name)) {
            LOG.trace("[{}] pong", channelName);
            return;
        }
        MessageType<?> type = catalog.get(name);
        if (type == null) {
            LOG.debug("[{}] Ignoring unknown message type {}", channelName, name);
            return;
        }
        List<Registration<?>> regs = handlers.get(name);
        if (regs == null || regs.isEmpty()) {
            return;
        }
        deliver(type, frame, regs);
    }

    private <T> void deliver(MessageType<T> type, JsonNode frame, List<Registration<?>> regs) {
        T message;
        try {
            message = type.decoder().decode(frame);
        } catch (RealtimeException.MalformedMessage e) {
            LOG.warn("[{}] Dropping malformed {} frame: {}", channelName, type.name(), e.getMessage());
            return;
        } catch (RuntimeException e) {
            LOG.warn("[{}] Dropping {} frame that failed to decode", channelName, type.name(), e);
            return;
        }
        for (Registration<?> reg : regs) {
            @SuppressWarnings("unchecked")
            Registration<T> typed = (Registration<T>) reg;
            try {
                typed.handler.handle(message);
            } catch (RuntimeException e) {
                LOG.error("[{}] Handler for {} failed", channelName, type.name(), e);
            }
        }
    }

    private static final class Registration<T> {
        private final MessageHandler<? super T> handler;

        Registration(MessageHandler<? super T> handler) {
            this.handler = handler;
        }
    }
}
