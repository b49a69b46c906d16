package com.toolstock.notifier.session;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Bounded log of connection events, shared by every session of the process so
 * that it survives reconnections. Oldest entries are dropped first.
 */
public final class ConnectionHistory {

    private final int                    capacity;
    private final Clock                  clock;
    private final Deque<ConnectionEvent> events = new ArrayDeque<>();
    private volatile int                 reconnectionAttempts;

    public ConnectionHistory(final int capacity, final Clock clock) {
        if (capacity < 1) {
            throw new IllegalArgumentException("capacity must be >= 1, got: " + capacity);
        }
        this.capacity = capacity;
        this.clock    = clock;
    }

    public ConnectionEvent record(final ConnectionEvent.Type type, final String reason) {
        final ConnectionEvent event = new ConnectionEvent(type, reason, clock.instant(), reconnectionAttempts);
        synchronized (events) {
            events.addLast(event);
            while (events.size() > capacity) {
                events.removeFirst();
            }
        }
        return event;
    }

    /** Stamped on every subsequent event. */
    public void setReconnectionAttempts(final int attempts) {
        this.reconnectionAttempts = attempts;
    }

    /** The most recent {@code limit} events, oldest first. */
    public List<ConnectionEvent> recent(final int limit) {
        synchronized (events) {
            final List<ConnectionEvent> out = new ArrayList<>(Math.min(limit, events.size()));
            final Iterator<ConnectionEvent> it = events.descendingIterator();
            while (it.hasNext() && out.size() < limit) {
                out.add(0, it.next());
            }
            return out;
        }
    }

    public List<ConnectionEvent> all() {
        synchronized (events) {
            return new ArrayList<>(events);
        }
    }

    public int size() {
        synchronized (events) {
            return events.size();
        }
    }
}
