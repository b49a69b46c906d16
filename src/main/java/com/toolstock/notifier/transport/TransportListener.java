package com.toolstock.notifier.transport;

import com.toolstock.notifier.model.InboundMessage;

/**
 * Connection-state and inbound-message signals from a {@link ChatTransport}.
 *
 * <p>Called on the transport's own threads. Implementations must hand the
 * signal off quickly; {@link com.toolstock.notifier.session.ChannelSession}
 * queues them onto its event loop.
 */
public interface TransportListener {

    TransportListener NONE = new TransportListener() {
        @Override public void onConnected() { }
        @Override public void onDisconnected(final String reason) { }
        @Override public void onAuthFailure(final String message) { }
        @Override public void onMessage(final InboundMessage message) { }
    };

    void onConnected();

    void onDisconnected(String reason);

    void onAuthFailure(String message);

    void onMessage(InboundMessage message);
}
