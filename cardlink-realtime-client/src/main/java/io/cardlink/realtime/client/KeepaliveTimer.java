package io.cardlink.realtime.client;

import io.cardlink.realtime.client.loop.EventLoop;
import io.cardlink.realtime.client.loop.TimerHandle;

import java.time.Duration;
import java.util.function.Predicate;

/**
 * Sends {@code {"action":"ping"}} at a fixed interval while a channel is open.
 *
 * <p>Holds at most one active timer. Loop-confined.
 */
final class KeepaliveTimer {
    private final EventLoop loop;
    private final Duration interval;
    private final Predicate<OutboundMessage> sender;
    private TimerHandle handle;

    KeepaliveTimer(EventLoop loop, Duration interval, Predicate<OutboundMessage> sender) {
        this.loop = loop;
        this.interval = interval;
        this.sender = sender;
    }

    void start() {
        stop();
        handle = loop.scheduleAtFixedRate(() -> sender.test(OutboundMessage.ping()), interval, interval);
    }

    void stop() {
        if (handle != null) {
            handle.cancel();
            handle = null;
        }
    }

    boolean isRunning() {
        return handle != null;
    }
}
