package com.toolstock.notifier.session;

import com.toolstock.notifier.alert.OperatorAlerts;
import com.toolstock.notifier.error.AuthenticationException;
import com.toolstock.notifier.retry.ExponentialBackoff;
import com.toolstock.notifier.scheduling.ScheduledHandle;
import com.toolstock.notifier.scheduling.Sleeper;
import com.toolstock.notifier.scheduling.TaskScheduler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

/**
 * Rebuilds the chat session after a disconnect or a failed health check.
 *
 * <h2>Policy</h2>
 * <ul>
 *   <li>At most one reconnection in flight; triggers arriving meanwhile are ignored.</li>
 *   <li>Attempt {@code n} (zero-based) waits {@code min(base × 2^n, cap)}.</li>
 *   <li>After {@code maxAttempts} attempts without a stable session the
 *       controller reports exhaustion once and stays idle until {@link #reset()}.</li>
 *   <li>An authentication failure is terminal: nothing is scheduled.</li>
 * </ul>
 *
 * The attempt counter goes back to zero only when a rebuilt session reaches
 * {@code STABLE}, or on {@link #reset()}.
 */
public class ReconnectionController implements SessionListener {

    private static final Logger LOG = LoggerFactory.getLogger(ReconnectionController.class);

    private final SessionHolder         holder;
    private final ChannelSessionFactory factory;
    private final ReconnectSettings     settings;
    private final ExponentialBackoff    backoff;
    private final TaskScheduler         scheduler;
    private final Sleeper               sleeper;
    private final OperatorAlerts        alerts;
    private final ConnectionHistory     history;
    private final Clock                 clock;

    // guarded by this
    private int             count;
    private Duration        nextDelay;
    private boolean         reconnecting;
    private boolean         exhausted;
    private boolean         authFailed;
    private boolean         stopped;
    private Instant         disconnectedAt;
    private ScheduledHandle pending;

    public ReconnectionController(
            final SessionHolder holder,
            final ChannelSessionFactory factory,
            final ReconnectSettings settings,
            final TaskScheduler scheduler,
            final Sleeper sleeper,
            final OperatorAlerts alerts,
            final ConnectionHistory history,
            final Clock clock) {
        this.holder    = holder;
        this.factory   = factory;
        this.settings  = settings;
        this.backoff   = new ExponentialBackoff(settings.getBaseDelay(), 2.0, settings.getMaxDelay());
        this.scheduler = scheduler;
        this.sleeper   = sleeper;
        this.alerts    = alerts;
        this.history   = history;
        this.clock     = clock;
        this.nextDelay = backoff.delayFor(0);
    }

    // ── Signals ───────────────────────────────────────────────────────────────

    @Override
    public void onStateChanged(
            final ChannelSession session,
            final SessionState previous,
            final SessionState current,
            final String reason) {
        if (!holder.isCurrent(session)) {
            LOG.debug("Ignoring {} from replaced session #{}", current, session.getGeneration());
            return;
        }
        if (current == SessionState.DISCONNECTED && !ChannelSession.CLOSED_REASON.equals(reason)) {
            onDisconnected(reason);
        } else if (current == SessionState.AUTH_FAILED) {
            onAuthFailed(reason);
        } else if (current == SessionState.STABLE) {
            onStable();
        }
    }

    public void onDisconnected(final String reason) {
        synchronized (this) {
            if (disconnectedAt == null) {
                disconnectedAt = clock.instant();
            }
        }
        alerts.disconnected(reason);
        trigger("disconnected: " + reason);
    }

    public void onHealthFailure(final String reason) {
        trigger("health check: " + reason);
    }

    public void onAuthFailed(final String reason) {
        synchronized (this) {
            authFailed   = true;
            reconnecting = false;
            if (pending != null) {
                pending.cancel();
                pending = null;
            }
        }
        LOG.error("Authentication failed, automatic reconnection disabled: {}", reason);
        alerts.authenticationFailed(reason);
    }

    // ── Scheduling ───────────────────────────────────────────────────────────

    /** @return {@code true} if an attempt was scheduled by this call */
    boolean trigger(final String cause) {
        final Duration delay;
        final int attempt;
        synchronized (this) {
            if (stopped || authFailed || reconnecting) {
                LOG.debug("Reconnection trigger ignored ({}): stopped={} authFailed={} reconnecting={}",
                        cause, stopped, authFailed, reconnecting);
                return false;
            }
            if (count >= settings.getMaxAttempts()) {
                reportExhaustionLocked();
                return false;
            }
            delay        = backoff.delayFor(count);
            reconnecting = true;
            count       += 1;
            attempt      = count;
            nextDelay    = delay;
            history.setReconnectionAttempts(count);
            pending = scheduler.schedule(this::attemptReconnection, delay);
        }
        history.record(ConnectionEvent.Type.RECONNECT_SCHEDULED,
                "attempt " + attempt + " in " + delay.toSeconds() + "s (" + cause + ")");
        LOG.warn("Reconnection attempt {}/{} in {}s ({})", attempt, settings.getMaxAttempts(), delay.toSeconds(), cause);
        alerts.reconnecting(attempt, delay);
        return true;
    }

    void attemptReconnection() {
        final int attempt;
        synchronized (this) {
            pending = null;
            if (stopped || !reconnecting) {
                return;
            }
            attempt = count;
        }

        holder.current().ifPresent(old -> {
            try {
                old.close();
            } catch (RuntimeException e) {
                LOG.warn("Tearing down session #{} failed: {}", old.getGeneration(), e.getMessage());
            }
        });
        sleeper.sleep(settings.getSettleDelay());

        try {
            final ChannelSession session = factory.create();
            holder.install(session);
            session.initialize();
            onStable();
        } catch (AuthenticationException e) {
            // the session's AUTH_FAILED transition already went through onAuthFailed()
            synchronized (this) {
                reconnecting = false;
            }
            history.record(ConnectionEvent.Type.RECONNECT_FAILED, e.getMessage());
        } catch (RuntimeException e) {
            onAttemptFailed(attempt, e);
        }
    }

    /**
     * Bookkeeping for the current session reaching {@code STABLE}. Runs once per
     * recovery: a session that stabilizes after its attempt already timed out
     * also lands here and cancels the pending follow-up.
     */
    private void onStable() {
        final int attempts;
        final Duration downtime;
        synchronized (this) {
            if (count == 0 && !reconnecting) {
                return;
            }
            if (pending != null) {
                pending.cancel();
                pending = null;
            }
            attempts       = count;
            count          = 0;
            reconnecting   = false;
            exhausted      = false;
            nextDelay      = backoff.delayFor(0);
            downtime       = disconnectedAt != null
                    ? Duration.between(disconnectedAt, clock.instant())
                    : Duration.ZERO;
            disconnectedAt = null;
            history.setReconnectionAttempts(0);
        }
        history.record(ConnectionEvent.Type.RECONNECT_SUCCEEDED, "after " + attempts + " attempt(s)");
        LOG.info("Reconnected after {} attempt(s)", attempts);
        alerts.reconnected(attempts, downtime);
    }

    private void onAttemptFailed(final int attempt, final RuntimeException error) {
        LOG.warn("Reconnection attempt {} failed: {}", attempt, error.getMessage());
        history.record(ConnectionEvent.Type.RECONNECT_FAILED, error.getMessage());
        alerts.reconnectFailed(attempt, error);

        synchronized (this) {
            reconnecting = false;
            if (stopped || authFailed) {
                return;
            }
            if (count >= settings.getMaxAttempts()) {
                reportExhaustionLocked();
                return;
            }
            pending = scheduler.schedule(() -> trigger("follow-up after failed attempt " + attempt),
                    settings.getFollowUpDelay());
        }
    }

    /** Must hold the monitor. Reports at most once per exhaustion. */
    private void reportExhaustionLocked() {
        if (exhausted) {
            return;
        }
        exhausted = true;
        history.record(ConnectionEvent.Type.RECONNECT_EXHAUSTED, "after " + count + " attempts");
        LOG.error("Reconnection exhausted after {} attempts", count);
        alerts.reconnectExhausted(count);
    }

    // ── Control ───────────────────────────────────────────────────────────────

    /** Clear the counter and the exhausted/auth-failed latches, e.g. after an operator re-paired the device. */
    public synchronized void reset() {
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
        count          = 0;
        reconnecting   = false;
        exhausted      = false;
        authFailed     = false;
        nextDelay      = backoff.delayFor(0);
        disconnectedAt = null;
        history.setReconnectionAttempts(0);
        LOG.info("Reconnection state reset");
    }

    /** Stop reacting to signals; used at shutdown. */
    public synchronized void stop() {
        stopped = true;
        if (pending != null) {
            pending.cancel();
            pending = null;
        }
    }

    public synchronized boolean isReconnecting() {
        return reconnecting;
    }

    public synchronized ReconnectionStatus status() {
        return new ReconnectionStatus(count, settings.getMaxAttempts(), nextDelay, reconnecting, exhausted);
    }
}
