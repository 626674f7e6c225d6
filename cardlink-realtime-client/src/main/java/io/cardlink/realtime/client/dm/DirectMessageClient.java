package io.cardlink.realtime.client.dm;

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
 * The caller's direct-message stream. One socket carries all conversations; every outbound
 * frame names its {@code conversation_id}.
 */
public final class DirectMessageClient {
    private final ReconnectingChannel channel;

    public DirectMessageClient(URI baseUrl, ChannelRuntime runtime) {
        this.channel = new ReconnectingChannel(ChannelEndpoint.directMessages(baseUrl), DirectEvents.ALL, runtime);
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

    public boolean sendMessage(String conversationId, String content) {
        return sendMessage(conversationId, content, null);
    }

    public boolean sendMessage(String conversationId, String content, String replyToId) {
        return send(conversationId, OutboundMessage.sendMessage(content, replyToId));
    }

    public boolean sendTyping(String conversationId, boolean isTyping) {
        return send(conversationId, OutboundMessage.typing(isTyping));
    }

    public boolean editMessage(String conversationId, String messageId, String content) {
        return send(conversationId, OutboundMessage.editMessage(messageId, content));
    }

    public boolean deleteMessage(String conversationId, String messageId) {
        return send(conversationId, OutboundMessage.deleteMessage(messageId));
    }

    /**
     * @param forMe hide the message only for the caller instead of deleting it for both sides
     */
    public boolean deleteMessage(String conversationId, String messageId, boolean forMe) {
        return send(conversationId, OutboundMessage.deleteMessage(messageId, forMe));
    }

    /**
     * Forwards an existing message into another conversation.
     */
    public boolean forwardMessage(String sourceMessageId, String conversationId) {
        return send(conversationId, OutboundMessage.forwardMessage(sourceMessageId));
    }

    public boolean markRead(String conversationId) {
        return send(conversationId, OutboundMessage.markRead());
    }

    public <T> Subscription on(MessageType<T> type, MessageHandler<? super T> handler) {
        return channel.on(type, handler);
    }

    public Subscription addConnectionListener(ConnectionListener listener) {
        return channel.addConnectionListener(listener);
    }

    private boolean send(String conversationId, OutboundMessage message) {
        return channel.send(message.inConversation(conversationId));
    }
}
