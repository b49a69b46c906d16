package com.toolstock.notifier.autoreply;

import com.toolstock.notifier.error.NotifierException;
import com.toolstock.notifier.hours.BusinessHoursOracle;
import com.toolstock.notifier.model.InboundMessage;
import com.toolstock.notifier.model.Masking;
import com.toolstock.notifier.scheduling.KeyedTimers;
import com.toolstock.notifier.scheduling.ScheduledHandle;
import com.toolstock.notifier.scheduling.Sleeper;
import com.toolstock.notifier.scheduling.TaskScheduler;
import com.toolstock.notifier.session.ChannelSession;
import com.toolstock.notifier.session.SessionHolder;
import com.toolstock.notifier.session.SessionListener;
import com.toolstock.notifier.session.SessionState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Supplier;

/**
 * Answers inbound chat messages outside business hours.
 *
 * <ul>
 *   <li>Debounced per conversation: a new message resets the pending reply.</li>
 *   <li>At most one reply per conversation within the suppression window.</li>
 *   <li>Groups, broadcasts, status updates and our own messages are ignored,
 *       as is anything arriving from a conversation we just wrote to.</li>
 * </ul>
 *
 * Pending replies are dropped when the session disconnects or fails authentication.
 * Due replies are sent one at a time on {@code replyWorker}.
 */
public class AutoReplyScheduler implements SessionListener, AutoCloseable {

    private static final Logger LOG = LoggerFactory.getLogger(AutoReplyScheduler.class);

    public enum Decision {
        IGNORED,
        /** Business is open, nothing to say. */
        NO_TEMPLATE,
        SUPPRESSED,
        SCHEDULED
    }

    private final SessionHolder                 sessions;
    private final Supplier<BusinessHoursOracle> hours;
    private final TaskScheduler                 scheduler;
    private final Executor                      replyWorker;
    private final Sleeper                       sleeper;
    private final Clock                         clock;
    private final AutoReplySettings             settings;

    private final KeyedTimers<String>  timers;
    private final Map<String, Instant> lastRepliedAt = new ConcurrentHashMap<>();
    private final Map<String, Instant> echoUntil     = new ConcurrentHashMap<>();

    private volatile ScheduledHandle sweepHandle;

    public AutoReplyScheduler(
            final SessionHolder sessions,
            final Supplier<BusinessHoursOracle> hours,
            final TaskScheduler scheduler,
            final Executor replyWorker,
            final Sleeper sleeper,
            final Clock clock,
            final AutoReplySettings settings) {
        this.sessions    = sessions;
        this.hours       = hours;
        this.scheduler   = scheduler;
        this.replyWorker = replyWorker;
        this.sleeper     = sleeper;
        this.clock       = clock;
        this.settings    = settings;
        this.timers      = new KeyedTimers<>(scheduler);
    }

    public synchronized void start() {
        if (sweepHandle == null) {
            sweepHandle = scheduler.scheduleAtFixedRate(
                    this::sweep, settings.getSuppressionWindow(), settings.getSuppressionWindow());
        }
    }

    // ── SessionListener ──────────────────────────────────────────────────────

    @Override
    public void onMessage(final ChannelSession session, final InboundMessage message) {
        onInbound(message);
    }

    @Override
    public void onStateChanged(
            final ChannelSession session,
            final SessionState previous,
            final SessionState current,
            final String reason) {
        if (current.isTerminal()) {
            final int dropped = timers.cancelAll();
            if (dropped > 0) {
                LOG.info("Dropped {} pending auto-replies: session {}", dropped, current);
            }
        }
    }

    // ── Inbound handling ─────────────────────────────────────────────────────

    public Decision onInbound(final InboundMessage message) {
        final String conversation = message.getFrom();
        if (isIgnored(message)) {
            return Decision.IGNORED;
        }

        if (timers.cancel(conversation)) {
            LOG.debug("Auto-reply to {} postponed by new message", Masking.maskPhone(conversation));
        }

        final Instant now = clock.instant();
        final Optional<String> reply = hours.get().getAutoReplyMessage(now);
        if (reply.isEmpty()) {
            return Decision.NO_TEMPLATE;
        }
        if (recentlyReplied(conversation, now)) {
            LOG.debug("Auto-reply to {} suppressed, replied recently", Masking.maskPhone(conversation));
            return Decision.SUPPRESSED;
        }

        timers.schedule(conversation, settings.getReplyDelay(), () -> handOff(conversation, reply.get()));
        LOG.info("Auto-reply to {} scheduled in {}s",
                Masking.maskPhone(conversation), settings.getReplyDelay().toSeconds());
        return Decision.SCHEDULED;
    }

    private boolean isIgnored(final InboundMessage message) {
        final String from = message.getFrom();
        if (from == null || from.isBlank()) {
            return true;
        }
        if (from.equals(message.getTo())
                || from.endsWith("@g.us")
                || from.contains("@broadcast")
                || message.isStatus()
                || message.isFromMe()) {
            return true;
        }
        final Instant echo = echoUntil.get(from);
        return echo != null && clock.instant().isBefore(echo);
    }

    private boolean recentlyReplied(final String conversation, final Instant now) {
        final Instant last = lastRepliedAt.get(conversation);
        return last != null && now.isBefore(last.plus(settings.getSuppressionWindow()));
    }

    /** Sending blocks for seconds; keep it off the timer threads. */
    private void handOff(final String conversation, final String text) {
        try {
            replyWorker.execute(() -> fire(conversation, text));
        } catch (RejectedExecutionException e) {
            LOG.warn("Auto-reply to {} dropped, reply worker shut down", Masking.maskPhone(conversation));
        }
    }

    private void fire(final String conversation, final String text) {
        final String masked = Masking.maskPhone(conversation);
        if (recentlyReplied(conversation, clock.instant())) {
            LOG.info("Auto-reply to {} dropped, already replied", masked);
            return;
        }
        echoUntil.put(conversation, clock.instant().plus(settings.getEchoWindow()));
        sleeper.sleep(settings.getNaturalDelay());

        final ChannelSession session;
        try {
            session = sessions.get();
            session.ensureStable();
            session.send(conversation, text, settings.getSendTimeout());
        } catch (NotifierException e) {
            LOG.error("Auto-reply to {} failed: {}", masked, e.getMessage());
            return;
        }
        lastRepliedAt.put(conversation, clock.instant());
        LOG.info("Auto-reply sent to {}", masked);

        try {
            session.markUnread(conversation, settings.getSendTimeout());
        } catch (NotifierException e) {
            LOG.warn("Could not mark {} unread: {}", masked, e.getMessage());
        }
    }

    /** Forget replies older than the suppression window and expired echo markers. */
    public void sweep() {
        final Instant now = clock.instant();
        lastRepliedAt.entrySet().removeIf(e -> !now.isBefore(e.getValue().plus(settings.getSuppressionWindow())));
        echoUntil.entrySet().removeIf(e -> !now.isBefore(e.getValue()));
        LOG.debug("Auto-reply sweep: {} conversations within suppression window", lastRepliedAt.size());
    }

    public boolean isPending(final String conversation) {
        return timers.isPending(conversation);
    }

    public AutoReplyStats stats() {
        final Instant now = clock.instant();
        final BusinessHoursOracle oracle = hours.get();
        return new AutoReplyStats(
                lastRepliedAt.size(),
                timers.size(),
                oracle.isBusinessHours(now),
                oracle.getNextBusinessDay(now));
    }

    @Override
    public void close() {
        final ScheduledHandle sweep = sweepHandle;
        if (sweep != null) {
            sweep.cancel();
            sweepHandle = null;
        }
        final int dropped = timers.cancelAll();
        LOG.info("Auto-reply scheduler closed, {} pending replies dropped", dropped);
    }
}
