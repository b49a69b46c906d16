package com.toolstock.notifier.model;

import java.time.Instant;

/**
 * A message event delivered by the transport. Addresses use the transport's
 * chat id form, e.g. {@code 34612345678@c.us} or {@code 1234-5678@g.us} for groups.
 */
public final class InboundMessage {

    private final String  id;
    private final String  from;
    private final String  to;
    private final String  body;
    private final boolean fromMe;
    private final boolean status;
    private final Instant timestamp;

    public InboundMessage(
            final String id,
            final String from,
            final String to,
            final String body,
            final boolean fromMe,
            final boolean status,
            final Instant timestamp) {
        this.id        = id;
        this.from      = from;
        this.to        = to;
        this.body      = body;
        this.fromMe    = fromMe;
        this.status    = status;
        this.timestamp = timestamp;
    }

    public String  getId()        { return id; }
    public String  getFrom()      { return from; }
    public String  getTo()        { return to; }
    public String  getBody()      { return body; }
    public boolean isFromMe()     { return fromMe; }
    /** Status/story updates arrive on the same stream as chat messages. */
    public boolean isStatus()     { return status; }
    public Instant getTimestamp() { return timestamp; }

    @Override
    public String toString() {
        return "InboundMessage{id=" + id
             + ", from=" + Masking.maskPhone(from)
             + ", fromMe=" + fromMe
             + ", status=" + status + "}";
    }
}
