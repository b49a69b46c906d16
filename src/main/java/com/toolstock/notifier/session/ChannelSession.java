package com.toolstock.notifier.session;

import com.toolstock.notifier.error.AuthenticationException;
import com.toolstock.notifier.error.NotifierException;
import com.toolstock.notifier.error.ReadyTimeoutException;
import com.toolstock.notifier.error.TransientTransportException;
import com.toolstock.notifier.model.ChatEntry;
import com.toolstock.notifier.model.InboundMessage;
import com.toolstock.notifier.scheduling.ScheduledHandle;
import com.toolstock.notifier.scheduling.TaskScheduler;
import com.toolstock.notifier.transport.ChatTransport;
import com.toolstock.notifier.transport.TransportListener;
import com.toolstock.notifier.transport.TransportState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * One connection to the chat transport, driven through the {@link SessionState}
 * machine.
 *
 * <h2>Threading</h2>
 * <ul>
 *   <li>Transport signals are queued onto {@code eventLoop} (single thread) and
 *       applied in arrival order.</li>
 *   <li>Transport calls run on {@code io} and are bounded by a timeout; a call
 *       that overruns is cancelled and abandoned.</li>
 *   <li>{@link #initialize()} and {@link #waitForReady(Duration)} block on a
 *       condition signalled by every state change.</li>
 * </ul>
 *
 * <h2>Stabilization</h2>
 * After {@code READY} the session waits the settle delay and probes the
 * transport. A {@code CONNECTED} answer promotes it to {@code STABLE}; failed
 * probes are retried up to the configured count, after which the session stays
 * {@code READY} and a {@code HEALTH_CHECK_FAILED} event is recorded.
 */
public class ChannelSession implements AutoCloseable {

    /** Disconnect reason used when the session is shut down on purpose. */
    public static final String CLOSED_REASON = "closed";

    private static final Logger LOG = LoggerFactory.getLogger(ChannelSession.class);

    private final int                   generation;
    private final ChatTransport         transport;
    private final SessionSettings       settings;
    private final TaskScheduler         scheduler;
    private final ConnectionHistory     history;
    private final ExecutorService       eventLoop;
    private final ExecutorService       io;
    private final List<SessionListener> listeners = new CopyOnWriteArrayList<>();

    private final ReentrantLock lock         = new ReentrantLock();
    private final Condition     stateChanged = lock.newCondition();

    private volatile SessionState    state = SessionState.IDLE;
    private volatile boolean         closed;
    private volatile ScheduledHandle stabilizeHandle;

    public ChannelSession(
            final int generation,
            final ChatTransport transport,
            final SessionSettings settings,
            final TaskScheduler scheduler,
            final ConnectionHistory history,
            final ExecutorService eventLoop,
            final ExecutorService io) {
        this.generation = generation;
        this.transport  = transport;
        this.settings   = settings;
        this.scheduler  = scheduler;
        this.history    = history;
        this.eventLoop  = eventLoop;
        this.io         = io;
        transport.setListener(new QueueingListener());
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    /**
     * Bring the session to {@code STABLE}, connecting first if it is still idle.
     * Safe to call concurrently: only the first caller connects, the others wait.
     *
     * @throws ReadyTimeoutException       not stable within the ready timeout
     * @throws TransientTransportException the session is (or became) disconnected
     * @throws AuthenticationException     the transport rejected the credentials
     */
    public void initialize() {
        boolean connectNow = false;
        lock.lock();
        try {
            if (closed) {
                throw new TransientTransportException("session #" + generation + " is closed");
            }
            switch (state) {
                case STABLE:
                    return;
                case DISCONNECTED:
                    throw new TransientTransportException("session #" + generation + " is disconnected");
                case AUTH_FAILED:
                    throw new AuthenticationException("session #" + generation + " failed authentication");
                case IDLE:
                    applyLocked(SessionState.CONNECTING, "initialize");
                    connectNow = true;
                    break;
                default:
                    break;
            }
        } finally {
            lock.unlock();
        }

        if (connectNow) {
            afterTransition(SessionState.IDLE, SessionState.CONNECTING, "initialize");
            connectTransport();
        }
        waitForReady(settings.getReadyTimeout());
    }

    private void connectTransport() {
        LOG.info("Session #{} connecting", generation);
        try {
            transport.connect();
        } catch (AuthenticationException e) {
            tryTransition(SessionState.AUTH_FAILED, e.getMessage());
            throw e;
        } catch (IOException | RuntimeException e) {
            tryTransition(SessionState.DISCONNECTED, "connect failed: " + e.getMessage());
            if (e instanceof NotifierException) {
                throw (NotifierException) e;
            }
            throw new TransientTransportException("connect failed: " + e.getMessage(), e);
        }
    }

    /**
     * Block until the session is {@code STABLE}. Never retries: a terminal state
     * ends the wait with the matching exception.
     */
    public void waitForReady(final Duration maxWait) {
        long remaining = maxWait.toNanos();
        lock.lock();
        try {
            while (true) {
                final SessionState current = state;
                if (current == SessionState.STABLE) {
                    return;
                }
                if (current == SessionState.DISCONNECTED) {
                    throw new TransientTransportException("session #" + generation + " disconnected while waiting");
                }
                if (current == SessionState.AUTH_FAILED) {
                    throw new AuthenticationException("session #" + generation + " failed authentication");
                }
                if (remaining <= 0L) {
                    throw new ReadyTimeoutException("session #" + generation + " not stable after "
                            + maxWait.toSeconds() + "s (state=" + current + ")");
                }
                remaining = stateChanged.awaitNanos(remaining);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientTransportException("interrupted while waiting for session #" + generation, e);
        } finally {
            lock.unlock();
        }
    }

    public void ensureStable() {
        if (state != SessionState.STABLE) {
            initialize();
        }
    }

    /** Best effort: logs transport errors, never throws. Idempotent. */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        final ScheduledHandle pending = stabilizeHandle;
        if (pending != null) {
            pending.cancel();
        }
        tryTransition(SessionState.DISCONNECTED, CLOSED_REASON);
        try {
            transport.close();
        } catch (RuntimeException e) {
            LOG.warn("Session #{}: transport close failed: {}", generation, e.getMessage());
        }
        eventLoop.shutdownNow();
        io.shutdownNow();
        LOG.info("Session #{} closed", generation);
    }

    // ── Timed transport operations ───────────────────────────────────────────

    public TransportState probe(final Duration timeout) {
        return timed("probe", timeout, transport::getState);
    }

    /** @return the chat id for {@code number}, empty if it has no account */
    public Optional<String> checkChannel(final String number, final Duration timeout) {
        return timed("channel check", timeout, () -> transport.resolveChatId(number));
    }

    /** @return the acknowledged message id, empty if the transport answered silently */
    public Optional<String> send(final String chatId, final String text, final Duration timeout) {
        return timed("send", timeout, () -> transport.sendText(chatId, text));
    }

    public Optional<ChatEntry> lastEntry(final String chatId, final Duration timeout) {
        return timed("conversation read", timeout, () -> transport.lastEntry(chatId));
    }

    public void markUnread(final String chatId, final Duration timeout) {
        timed("mark unread", timeout, () -> {
            transport.markUnread(chatId);
            return null;
        });
    }

    private <T> T timed(final String operation, final Duration timeout, final Callable<T> call) {
        if (closed) {
            throw new TransientTransportException(operation + ": session #" + generation + " is closed");
        }
        final Future<T> future;
        try {
            future = io.submit(call);
        } catch (RejectedExecutionException e) {
            throw new TransientTransportException(operation + ": session #" + generation + " is closed", e);
        }
        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            throw new TransientTransportException(operation + " timed out after " + timeout.toMillis() + "ms");
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new TransientTransportException(operation + " interrupted", e);
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof NotifierException) {
                throw (NotifierException) cause;
            }
            throw new TransientTransportException(operation + " failed: " + cause.getMessage(), cause);
        }
    }

    // ── State machine ─────────────────────────────────────────────────────────

    /** Must hold {@link #lock}. */
    private SessionState applyLocked(final SessionState next, final String reason) {
        final SessionState previous = state;
        if (!previous.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Illegal session transition " + previous + " -> " + next + " (session #" + generation + ")");
        }
        state = next;
        history.record(ConnectionEvent.Type.valueOf(next.name()), reason);
        stateChanged.signalAll();
        return previous;
    }

    /** @return {@code false} if the current state does not allow the transition */
    private boolean tryTransition(final SessionState next, final String reason) {
        final SessionState previous;
        lock.lock();
        try {
            if (!state.canTransitionTo(next)) {
                return false;
            }
            previous = applyLocked(next, reason);
        } finally {
            lock.unlock();
        }
        afterTransition(previous, next, reason);
        return true;
    }

    private void afterTransition(final SessionState previous, final SessionState next, final String reason) {
        if (next.isTerminal()) {
            LOG.warn("Session #{}: {} -> {} ({})", generation, previous, next, reason);
        } else {
            LOG.info("Session #{}: {} -> {}", generation, previous, next);
        }
        for (final SessionListener listener : listeners) {
            try {
                listener.onStateChanged(this, previous, next, reason);
            } catch (RuntimeException e) {
                LOG.error("Session listener failed on {} -> {}", previous, next, e);
            }
        }
    }

    // ── Event loop handlers ──────────────────────────────────────────────────

    private void post(final Runnable event) {
        if (closed) {
            return;
        }
        try {
            eventLoop.execute(event);
        } catch (RejectedExecutionException e) {
            LOG.debug("Session #{}: event dropped after shutdown", generation);
        }
    }

    private void handleConnected() {
        if (tryTransition(SessionState.READY, "connected")) {
            scheduleStabilizeProbe(1, settings.getSettleDelay());
        } else {
            LOG.debug("Session #{}: 'connected' ignored in state {}", generation, state);
        }
    }

    private void scheduleStabilizeProbe(final int attempt, final Duration delay) {
        if (!closed) {
            stabilizeHandle = scheduler.schedule(() -> runStabilizeProbe(attempt), delay);
        }
    }

    private void runStabilizeProbe(final int attempt) {
        if (closed || state != SessionState.READY) {
            return;
        }
        String failure = null;
        try {
            final TransportState transportState = probe(settings.getProbeTimeout());
            if (transportState != TransportState.CONNECTED) {
                failure = "transport state " + transportState;
            }
        } catch (NotifierException e) {
            failure = e.getMessage();
        }
        final String result = failure;
        post(() -> applyStabilizeResult(attempt, result));
    }

    private void applyStabilizeResult(final int attempt, final String failure) {
        if (state != SessionState.READY) {
            return;
        }
        if (failure == null) {
            tryTransition(SessionState.STABLE, "probe passed");
            return;
        }
        if (attempt < settings.getStabilizeAttempts()) {
            LOG.warn("Session #{}: stabilization probe {}/{} failed: {}",
                    generation, attempt, settings.getStabilizeAttempts(), failure);
            scheduleStabilizeProbe(attempt + 1, settings.getStabilizeRetryDelay());
        } else {
            LOG.warn("Session #{}: not stable after {} probes, staying READY: {}",
                    generation, attempt, failure);
            history.record(ConnectionEvent.Type.HEALTH_CHECK_FAILED,
                    "stabilization failed after " + attempt + " probes: " + failure);
        }
    }

    private void handleMessage(final InboundMessage message) {
        for (final SessionListener listener : listeners) {
            try {
                listener.onMessage(this, message);
            } catch (RuntimeException e) {
                LOG.error("Session listener failed on inbound {}", message, e);
            }
        }
    }

    // ── Accessors ─────────────────────────────────────────────────────────────

    public void addListener(final SessionListener listener) {
        listeners.add(listener);
    }

    public void removeListener(final SessionListener listener) {
        listeners.remove(listener);
    }

    public SessionState getState() {
        return state;
    }

    public boolean isStable() {
        return state == SessionState.STABLE;
    }

    public boolean isClosed() {
        return closed;
    }

    public int getGeneration() {
        return generation;
    }

    @Override
    public String toString() {
        return "ChannelSession{#" + generation + ", state=" + state + "}";
    }

    private final class QueueingListener implements TransportListener {

        @Override
        public void onConnected() {
            post(ChannelSession.this::handleConnected);
        }

        @Override
        public void onDisconnected(final String reason) {
            post(() -> tryTransition(SessionState.DISCONNECTED, reason));
        }

        @Override
        public void onAuthFailure(final String message) {
            post(() -> tryTransition(SessionState.AUTH_FAILED, message));
        }

        @Override
        public void onMessage(final InboundMessage message) {
            post(() -> handleMessage(message));
        }
    }
}
