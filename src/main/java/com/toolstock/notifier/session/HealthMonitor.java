package com.toolstock.notifier.session;

import com.toolstock.notifier.alert.OperatorAlerts;
import com.toolstock.notifier.error.NotifierException;
import com.toolstock.notifier.scheduling.ScheduledHandle;
import com.toolstock.notifier.scheduling.TaskScheduler;
import com.toolstock.notifier.transport.TransportState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Probes the active session at a fixed rate and hands failures to the
 * {@link ReconnectionController}.
 *
 * <p>A session that failed authentication is reported but never triggers a
 * reconnection.
 */
public class HealthMonitor implements AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(HealthMonitor.class);

    public enum Outcome {
        /** Monitor stopped, or a reconnection is already in flight. */
        SKIPPED,
        PASSED,
        /** Session not stable, or the transport does not report itself connected. */
        SOFT_FAIL,
        /** The probe timed out or raised an error. */
        HARD_FAIL
    }

    private final SessionHolder          holder;
    private final ReconnectionController reconnection;
    private final TaskScheduler          scheduler;
    private final OperatorAlerts         alerts;
    private final ConnectionHistory      history;
    private final Clock                  clock;
    private final Duration               interval;
    private final Duration               timeout;

    private volatile ScheduledHandle handle;
    private volatile Instant         lastHealthyAt;

    public HealthMonitor(
            final SessionHolder holder,
            final ReconnectionController reconnection,
            final TaskScheduler scheduler,
            final OperatorAlerts alerts,
            final ConnectionHistory history,
            final Clock clock,
            final Duration interval,
            final Duration timeout) {
        this.holder       = holder;
        this.reconnection = reconnection;
        this.scheduler    = scheduler;
        this.alerts       = alerts;
        this.history      = history;
        this.clock        = clock;
        this.interval     = interval;
        this.timeout      = timeout;
    }

    public synchronized void start() {
        if (handle != null) {
            return;
        }
        handle = scheduler.scheduleAtFixedRate(this::runOnce, interval, interval);
        LOG.info("Health monitor started (interval={}s, timeout={}s)", interval.toSeconds(), timeout.toSeconds());
    }

    public synchronized void stop() {
        if (handle == null) {
            return;
        }
        handle.cancel();
        handle = null;
        LOG.info("Health monitor stopped");
    }

    public boolean isRunning() {
        return handle != null;
    }

    public Outcome runOnce() {
        if (handle == null || reconnection.isReconnecting()) {
            return Outcome.SKIPPED;
        }

        final Optional<ChannelSession> current = holder.current();
        if (current.isEmpty()) {
            return fail(Outcome.SOFT_FAIL, "no session", true);
        }
        final ChannelSession session = current.get();
        final SessionState state = session.getState();

        if (state == SessionState.AUTH_FAILED) {
            return fail(Outcome.SOFT_FAIL, "session authentication failed", false);
        }
        if (state != SessionState.STABLE) {
            return fail(Outcome.SOFT_FAIL, "session " + state, true);
        }

        try {
            final TransportState transportState = session.probe(timeout);
            if (transportState != TransportState.CONNECTED) {
                return fail(Outcome.SOFT_FAIL, "transport state " + transportState, true);
            }
        } catch (NotifierException e) {
            return fail(Outcome.HARD_FAIL, e.getMessage(), true);
        }

        lastHealthyAt = clock.instant();
        history.record(ConnectionEvent.Type.HEALTH_CHECK_PASSED, null);
        LOG.debug("Health check passed for session #{}", session.getGeneration());
        return Outcome.PASSED;
    }

    private Outcome fail(final Outcome outcome, final String reason, final boolean reconnect) {
        LOG.warn("Health check {}: {}", outcome, reason);
        history.record(ConnectionEvent.Type.HEALTH_CHECK_FAILED, reason);
        alerts.healthDegraded(reason);
        if (reconnect) {
            reconnection.onHealthFailure(reason);
        }
        return outcome;
    }

    public Optional<Instant> getLastHealthyAt() {
        return Optional.ofNullable(lastHealthyAt);
    }

    @Override
    public void close() {
        stop();
    }
}
