package com.toolstock.notifier.transport;

import com.toolstock.notifier.model.ChatEntry;

import java.io.IOException;
import java.util.Optional;

/**
 * The external chat transport: one linked WhatsApp device.
 *
 * <h2>Contract</h2>
 * <ul>
 *   <li>Calls block until the transport answers. Timeouts are applied by the
 *       caller ({@link com.toolstock.notifier.session.ChannelSession}), which
 *       abandons calls that overrun.</li>
 *   <li>Network failures are reported as {@link IOException}; rejected
 *       credentials as {@link com.toolstock.notifier.error.AuthenticationException}.</li>
 *   <li>An instance is used for one connection only. Reconnecting means
 *       building a fresh instance through a {@link ChatTransportFactory}.</li>
 * </ul>
 */
public interface ChatTransport extends AutoCloseable {

    /** Start the connection. Completion is signalled later via {@link TransportListener#onConnected()}. */
    void connect() throws IOException;

    TransportState getState() throws IOException;

    /**
     * Look up the chat account for a normalized number.
     *
     * @return the chat id, or empty if the number has no account
     */
    Optional<String> resolveChatId(String number) throws IOException;

    /**
     * Send a text message.
     *
     * @return the acknowledged message id; empty when the transport answered
     *         without an acknowledgment object
     */
    Optional<String> sendText(String chatId, String text) throws IOException;

    /** The most recent entry of a conversation, if the transport has one. */
    Optional<ChatEntry> lastEntry(String chatId) throws IOException;

    void markUnread(String chatId) throws IOException;

    void setListener(TransportListener listener);

    /** Log out and release resources. Best effort: never throws for remote failures. */
    @Override
    void close();
}
