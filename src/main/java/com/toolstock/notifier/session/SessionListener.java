package com.toolstock.notifier.session;

import com.toolstock.notifier.model.InboundMessage;

/**
 * Observer of a {@link ChannelSession}. Called on the session's event loop (or
 * the thread driving {@code initialize()}/{@code close()}); keep work short
 * and hand long waits to a scheduler.
 */
public interface SessionListener {

    default void onStateChanged(
            final ChannelSession session,
            final SessionState previous,
            final SessionState current,
            final String reason) {
    }

    default void onMessage(final ChannelSession session, final InboundMessage message) {
    }
}
