package com.toolstock.notifier.session;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.List;

/** Snapshot served by the {@code /health/session} endpoint. */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SessionDiagnostics {

    static final int RECENT_EVENTS = 10;

    private final SessionState          state;
    private final Integer               generation;
    private final ReconnectionStatus    reconnection;
    private final Instant               lastHealthyAt;
    private final List<ConnectionEvent> recentEvents;

    private SessionDiagnostics(
            final SessionState state,
            final Integer generation,
            final ReconnectionStatus reconnection,
            final Instant lastHealthyAt,
            final List<ConnectionEvent> recentEvents) {
        this.state         = state;
        this.generation    = generation;
        this.reconnection  = reconnection;
        this.lastHealthyAt = lastHealthyAt;
        this.recentEvents  = recentEvents;
    }

    public static SessionDiagnostics capture(
            final SessionHolder holder,
            final ReconnectionController reconnection,
            final HealthMonitor monitor,
            final ConnectionHistory history) {
        return new SessionDiagnostics(
                holder.getState(),
                holder.current().map(ChannelSession::getGeneration).orElse(null),
                reconnection.status(),
                monitor.getLastHealthyAt().orElse(null),
                history.recent(RECENT_EVENTS));
    }

    public SessionState          getState()         { return state; }
    public Integer               getGeneration()    { return generation; }
    public ReconnectionStatus    getReconnection()  { return reconnection; }
    public Instant               getLastHealthyAt() { return lastHealthyAt; }
    public List<ConnectionEvent> getRecentEvents()  { return recentEvents; }
}
