package io.cardlink.realtime.client.loop;

import java.time.Duration;

/**
 * Single-threaded executor that runs every socket callback and timer of a channel.
 *
 * <p>Tasks run one at a time in submission order, so channel state needs no locking. Tasks must
 * not block.
 */
public interface EventLoop extends AutoCloseable {

    /**
     * Returns true when the calling thread is the loop thread.
     */
    boolean inEventLoop();

    void execute(Runnable task);

    TimerHandle schedule(Runnable task, Duration delay);

    TimerHandle scheduleAtFixedRate(Runnable task, Duration initialDelay, Duration period);

    /**
     * Stops the loop. Pending timers are dropped.
     */
    @Override
    void close();
}
