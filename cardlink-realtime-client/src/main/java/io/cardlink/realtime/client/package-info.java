/**
 * Reconnecting WebSocket channels and the clients built on them.
 *
 * <p>Start with {@link io.cardlink.realtime.client.RealtimeClientBuilder}. Each client owns one
 * {@link io.cardlink.realtime.client.ReconnectingChannel}; all of a channel's callbacks run on its
 * {@link io.cardlink.realtime.client.loop.EventLoop}.
 */
package io.cardlink.realtime.client;
