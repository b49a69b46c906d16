package com.toolstock.notifier.session;

import com.toolstock.notifier.error.TransientTransportException;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;

/**
 * The single active {@link ChannelSession} of the process.
 *
 * <p>Listeners registered here are attached to every session installed later,
 * so collaborators subscribe once and keep receiving events across
 * reconnections.
 */
public final class SessionHolder {

    private final AtomicReference<ChannelSession> current   = new AtomicReference<>();
    private final List<SessionListener>           listeners = new CopyOnWriteArrayList<>();

    public void addListener(final SessionListener listener) {
        listeners.add(listener);
        final ChannelSession session = current.get();
        if (session != null) {
            session.addListener(listener);
        }
    }

    /**
     * Make {@code session} the active one.
     *
     * @return the session it replaced, if any; the caller closes it
     */
    public Optional<ChannelSession> install(final ChannelSession session) {
        for (final SessionListener listener : listeners) {
            session.addListener(listener);
        }
        final ChannelSession previous = current.getAndSet(session);
        if (previous != null) {
            for (final SessionListener listener : listeners) {
                previous.removeListener(listener);
            }
        }
        return Optional.ofNullable(previous);
    }

    /** @throws TransientTransportException if no session was installed yet */
    public ChannelSession get() {
        final ChannelSession session = current.get();
        if (session == null) {
            throw new TransientTransportException("no chat session available");
        }
        return session;
    }

    public Optional<ChannelSession> current() {
        return Optional.ofNullable(current.get());
    }

    public boolean isCurrent(final ChannelSession session) {
        return session != null && current.get() == session;
    }

    public SessionState getState() {
        final ChannelSession session = current.get();
        return session != null ? session.getState() : SessionState.IDLE;
    }
}
