package com.toolstock.notifier.model;

import java.time.Instant;

/** The latest entry of a conversation, used to verify silent send acknowledgments. */
public final class ChatEntry {

    private final String  id;
    private final String  body;
    private final Instant timestamp;

    public ChatEntry(final String id, final String body, final Instant timestamp) {
        this.id        = id;
        this.body      = body;
        this.timestamp = timestamp;
    }

    public String  getId()        { return id; }
    public String  getBody()      { return body; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return "ChatEntry{id=" + id + ", timestamp=" + timestamp + "}";
    }
}
