package io.cardlink.realtime.client;

@FunctionalInterface
public interface MessageHandler<T> {
    void handle(T message);
}
