package io.cardlink.realtime.client.chat;

import io.cardlink.realtime.client.ChannelRuntime;
import io.cardlink.realtime.client.ConnectionListener;
import io.cardlink.realtime.client.MessageHandler;
import io.cardlink.realtime.client.MessageType;
import io.cardlink.realtime.client.OutboundMessage;
import io.cardlink.realtime.client.ReconnectingChannel;
import io.cardlink.realtime.client.Subscription;
import io.cardlink.realtime.core.ChannelEndpoint;
import io.cardlink.realtime.core.ConnectionState;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * Chat room of one project.
 *
 * <p>Sends are no-ops returning {@code false} while the channel is not open; callers fall back
 * to the HTTP API. Inbound {@code new_message} may repeat after a reconnect, deduplicate by id.
 */
public final class ProjectChatClient {
    private final String projectId;
    private final ReconnectingChannel channel;

    public ProjectChatClient(URI baseUrl, String projectId, ChannelRuntime runtime) {
        this.projectId = projectId;
        this.channel = new ReconnectingChannel(ChannelEndpoint.projectChat(baseUrl, projectId), ChatEvents.ALL, runtime);
    }

    public String projectId() {
        return projectId;
    }

    public CompletableFuture<Void> connect() {
        return channel.connect();
    }

    public void disconnect() {
        channel.disconnect();
    }

    public ConnectionState state() {
        return channel.state();
    }

    public boolean isOpen() {
        return channel.isOpen();
    }

    public boolean sendMessage(String content) {
        return sendMessage(content, null);
    }

    public boolean sendMessage(String content, String replyToId) {
        return channel.send(OutboundMessage.sendMessage(content, replyToId));
    }

    public boolean sendTyping(boolean isTyping) {
        return channel.send(OutboundMessage.typing(isTyping));
    }

    public boolean editMessage(String messageId, String content) {
        return channel.send(OutboundMessage.editMessage(messageId, content));
    }

    public boolean deleteMessage(String messageId) {
        return channel.send(OutboundMessage.deleteMessage(messageId));
    }

    public boolean markRead() {
        return channel.send(OutboundMessage.markRead());
    }

    public <T> Subscription on(MessageType<T> type, MessageHandler<? super T> handler) {
        return channel.on(type, handler);
    }

    public Subscription addConnectionListener(ConnectionListener listener) {
        return channel.addConnectionListener(listener);
    }
}
