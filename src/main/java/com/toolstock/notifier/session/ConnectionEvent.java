package com.toolstock.notifier.session;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;

/** One entry of the {@link ConnectionHistory}. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class ConnectionEvent {

    public enum Type {
        CONNECTING,
        READY,
        STABLE,
        DISCONNECTED,
        AUTH_FAILED,
        HEALTH_CHECK_PASSED,
        HEALTH_CHECK_FAILED,
        RECONNECT_SCHEDULED,
        RECONNECT_SUCCEEDED,
        RECONNECT_FAILED,
        RECONNECT_EXHAUSTED
    }

    private final Type    type;
    private final String  reason;
    private final Instant timestamp;
    private final int     reconnectionAttempts;

    public ConnectionEvent(final Type type, final String reason, final Instant timestamp, final int reconnectionAttempts) {
        this.type                 = type;
        this.reason               = reason;
        this.timestamp            = timestamp;
        this.reconnectionAttempts = reconnectionAttempts;
    }

    public Type    getType()                 { return type; }
    public String  getReason()               { return reason; }
    public Instant getTimestamp()            { return timestamp; }
    public int     getReconnectionAttempts() { return reconnectionAttempts; }

    @Override
    public String toString() {
        return timestamp + " " + type + (reason != null ? " (" + reason + ")" : "");
    }
}
