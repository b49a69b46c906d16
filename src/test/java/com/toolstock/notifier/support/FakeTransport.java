package com.toolstock.notifier.support;

import com.toolstock.notifier.model.ChatEntry;
import com.toolstock.notifier.model.InboundMessage;
import com.toolstock.notifier.transport.ChatTransport;
import com.toolstock.notifier.transport.TransportListener;
import com.toolstock.notifier.transport.TransportState;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

/** Scriptable in-memory {@link ChatTransport}. */
public class FakeTransport implements ChatTransport {

    public volatile boolean        connectOnConnect = true;
    public volatile IOException    connectError;
    public volatile TransportState state = TransportState.CONNECTED;
    public volatile IOException    stateError;

    public final List<String>      sent     = new ArrayList<>();
    public final List<String>      unread   = new ArrayList<>();
    public final AtomicInteger     connects = new AtomicInteger();
    public final AtomicInteger     probes   = new AtomicInteger();
    public volatile boolean        closed;

    private volatile TransportListener listener = TransportListener.NONE;

    @Override
    public void connect() throws IOException {
        connects.incrementAndGet();
        if (connectError != null) {
            throw connectError;
        }
        if (connectOnConnect) {
            listener.onConnected();
        }
    }

    @Override
    public TransportState getState() throws IOException {
        probes.incrementAndGet();
        if (stateError != null) {
            throw stateError;
        }
        return state;
    }

    @Override
    public Optional<String> resolveChatId(final String number) {
        return Optional.of(number + "@c.us");
    }

    @Override
    public synchronized Optional<String> sendText(final String chatId, final String text) {
        sent.add(chatId + ": " + text);
        return Optional.empty();
    }

    @Override
    public Optional<ChatEntry> lastEntry(final String chatId) {
        return Optional.empty();
    }

    @Override
    public synchronized void markUnread(final String chatId) {
        unread.add(chatId);
    }

    @Override
    public void setListener(final TransportListener listener) {
        this.listener = listener;
    }

    @Override
    public void close() {
        closed = true;
    }

    // ── Event injection ──────────────────────────────────────────────────────

    public void fireConnected()                        { listener.onConnected(); }
    public void fireDisconnected(final String reason)  { listener.onDisconnected(reason); }
    public void fireAuthFailure(final String message)  { listener.onAuthFailure(message); }
    public void fireMessage(final InboundMessage msg)  { listener.onMessage(msg); }
}
