package com.toolstock.notifier.autoreply;

import com.toolstock.notifier.error.ReadyTimeoutException;
import com.toolstock.notifier.error.TransientTransportException;
import com.toolstock.notifier.hours.BusinessHoursConfig;
import com.toolstock.notifier.hours.BusinessHoursProvider;
import com.toolstock.notifier.hours.ReplyTemplates;
import com.toolstock.notifier.model.InboundMessage;
import com.toolstock.notifier.session.ChannelSession;
import com.toolstock.notifier.session.SessionHolder;
import com.toolstock.notifier.session.SessionState;
import com.toolstock.notifier.support.ManualTaskScheduler;
import com.toolstock.notifier.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.RejectedExecutionException;

import static org.assertj.core.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AutoReplySchedulerTest {

    private static final String CUSTOMER = "34612345678@c.us";
    private static final String OURS     = "34911111111@c.us";
    private static final String REPLY    = ReplyTemplates.defaults().getOutOfHours();

    // Wednesday 18:00 in Madrid: closed, open again tomorrow
    private static final Instant EVENING = Instant.parse("2025-01-15T17:00:00Z");
    private static final Instant MORNING = Instant.parse("2025-01-15T09:00:00Z");

    private static final AutoReplySettings SETTINGS = new AutoReplySettings(
            Duration.ofSeconds(5), Duration.ofSeconds(2), Duration.ofHours(1),
            Duration.ofSeconds(10), Duration.ofSeconds(20));

    @Mock private ChannelSession session;

    private final List<Duration> sleeps = new ArrayList<>();
    private MutableClock         clock;
    private ManualTaskScheduler  scheduler;
    private AutoReplyScheduler   autoReply;

    @BeforeEach
    void setup() {
        clock     = new MutableClock(EVENING);
        scheduler = new ManualTaskScheduler(clock);
        final SessionHolder holder = new SessionHolder();
        holder.install(session);
        autoReply = new AutoReplyScheduler(holder, BusinessHoursProvider.fixed(BusinessHoursConfig.defaults()),
                scheduler, Runnable::run, sleeps::add, clock, SETTINGS);
    }

    private static InboundMessage from(final String sender) {
        return new InboundMessage("msg-1", sender, OURS, "hola?", false, false, EVENING);
    }

    // ── Debounce ──────────────────────────────────────────────────────────────

    @Test
    void burstOfMessages_isAnsweredOnce_afterTheLastOnePlusDelay() {
        assertThat(autoReply.onInbound(from(CUSTOMER))).isEqualTo(AutoReplyScheduler.Decision.SCHEDULED);
        scheduler.advance(Duration.ofSeconds(2));
        autoReply.onInbound(from(CUSTOMER));
        scheduler.advance(Duration.ofSeconds(1));
        autoReply.onInbound(from(CUSTOMER));

        scheduler.advance(Duration.ofSeconds(4));
        verify(session, never()).send(anyString(), anyString(), any());
        assertThat(autoReply.isPending(CUSTOMER)).isTrue();

        scheduler.advance(Duration.ofSeconds(1));
        verify(session, times(1)).send(CUSTOMER, REPLY, SETTINGS.getSendTimeout());
        assertThat(autoReply.isPending(CUSTOMER)).isFalse();
    }

    @Test
    void reply_pausesFirst_thenSends_thenMarksUnread() {
        autoReply.onInbound(from(CUSTOMER));
        scheduler.advance(Duration.ofSeconds(5));

        assertThat(sleeps).containsExactly(SETTINGS.getNaturalDelay());
        final var order = inOrder(session);
        order.verify(session).ensureStable();
        order.verify(session).send(CUSTOMER, REPLY, SETTINGS.getSendTimeout());
        order.verify(session).markUnread(CUSTOMER, SETTINGS.getSendTimeout());
    }

    @Test
    void dueReply_isSentOnTheReplyWorker_notTheTimer() {
        final List<Runnable> queued = new ArrayList<>();
        final SessionHolder holder = new SessionHolder();
        holder.install(session);
        final var queuedReplies = new AutoReplyScheduler(holder,
                BusinessHoursProvider.fixed(BusinessHoursConfig.defaults()),
                scheduler, queued::add, sleeps::add, clock, SETTINGS);

        queuedReplies.onInbound(from(CUSTOMER));
        scheduler.advance(Duration.ofSeconds(5));

        assertThat(queued).hasSize(1);
        assertThat(sleeps).isEmpty();
        verifyNoInteractions(session);

        queued.get(0).run();
        verify(session).send(CUSTOMER, REPLY, SETTINGS.getSendTimeout());
    }

    @Test
    void dueReply_afterWorkerShutdown_isDropped() {
        final SessionHolder holder = new SessionHolder();
        holder.install(session);
        final var rejecting = new AutoReplyScheduler(holder,
                BusinessHoursProvider.fixed(BusinessHoursConfig.defaults()),
                scheduler, task -> { throw new RejectedExecutionException("shut down"); },
                sleeps::add, clock, SETTINGS);

        rejecting.onInbound(from(CUSTOMER));
        assertThatCode(() -> scheduler.advance(Duration.ofSeconds(5))).doesNotThrowAnyException();

        verifyNoInteractions(session);
        assertThat(rejecting.stats().getRepliedCount()).isZero();
    }

    @Test
    void conversations_areDebouncedIndependently() {
        final String other = "34699999999@c.us";
        autoReply.onInbound(from(CUSTOMER));
        scheduler.advance(Duration.ofSeconds(3));
        autoReply.onInbound(from(other));

        scheduler.advance(Duration.ofSeconds(2));
        verify(session).send(CUSTOMER, REPLY, SETTINGS.getSendTimeout());
        verify(session, never()).send(eq(other), anyString(), any());

        scheduler.advance(Duration.ofSeconds(3));
        verify(session).send(other, REPLY, SETTINGS.getSendTimeout());
    }

    // ── Suppression ──────────────────────────────────────────────────────────

    @Test
    void secondConversationTurn_withinSuppressionWindow_isSuppressed() {
        autoReply.onInbound(from(CUSTOMER));
        scheduler.advance(Duration.ofSeconds(5));

        scheduler.advance(Duration.ofMinutes(10));
        assertThat(autoReply.onInbound(from(CUSTOMER))).isEqualTo(AutoReplyScheduler.Decision.SUPPRESSED);

        scheduler.advance(Duration.ofHours(1));
        assertThat(autoReply.onInbound(from(CUSTOMER))).isEqualTo(AutoReplyScheduler.Decision.SCHEDULED);
    }

    @Test
    void messagesRightAfterOurReply_areTreatedAsEcho() {
        autoReply.onInbound(from(CUSTOMER));
        scheduler.advance(Duration.ofSeconds(5));

        scheduler.advance(Duration.ofSeconds(3));
        assertThat(autoReply.onInbound(from(CUSTOMER))).isEqualTo(AutoReplyScheduler.Decision.IGNORED);
    }

    @Test
    void failedReply_isNotCountedAsReplied() {
        doThrow(new ReadyTimeoutException("session not stable")).doNothing().when(session).ensureStable();
        autoReply.onInbound(from(CUSTOMER));
        scheduler.advance(Duration.ofSeconds(5));
        verify(session, never()).send(anyString(), anyString(), any());

        scheduler.advance(Duration.ofSeconds(30));
        assertThat(autoReply.onInbound(from(CUSTOMER))).isEqualTo(AutoReplyScheduler.Decision.SCHEDULED);
        scheduler.advance(Duration.ofSeconds(5));
        verify(session).send(CUSTOMER, REPLY, SETTINGS.getSendTimeout());
    }

    @Test
    void markUnreadFailure_stillCountsAsReplied() {
        doThrow(new TransientTransportException("markUnread timed out after 20000ms"))
                .when(session).markUnread(CUSTOMER, SETTINGS.getSendTimeout());
        autoReply.onInbound(from(CUSTOMER));
        scheduler.advance(Duration.ofSeconds(5));

        assertThat(autoReply.stats().getRepliedCount()).isEqualTo(1);
    }

    // ── Filtering ─────────────────────────────────────────────────────────────

    @Test
    void groupsBroadcastsStatusAndOwnMessages_areIgnored() {
        assertThat(autoReply.onInbound(from("120363025246125486@g.us")))
                .isEqualTo(AutoReplyScheduler.Decision.IGNORED);
        assertThat(autoReply.onInbound(from("status@broadcast")))
                .isEqualTo(AutoReplyScheduler.Decision.IGNORED);
        assertThat(autoReply.onInbound(new InboundMessage("m", CUSTOMER, OURS, "x", true, false, EVENING)))
                .isEqualTo(AutoReplyScheduler.Decision.IGNORED);
        assertThat(autoReply.onInbound(new InboundMessage("m", CUSTOMER, OURS, "x", false, true, EVENING)))
                .isEqualTo(AutoReplyScheduler.Decision.IGNORED);
        assertThat(autoReply.onInbound(new InboundMessage("m", OURS, OURS, "x", false, false, EVENING)))
                .isEqualTo(AutoReplyScheduler.Decision.IGNORED);
        assertThat(autoReply.onInbound(from(" "))).isEqualTo(AutoReplyScheduler.Decision.IGNORED);

        scheduler.advance(Duration.ofMinutes(1));
        verifyNoInteractions(session);
    }

    @Test
    void openHours_produceNoReply() {
        clock.set(MORNING);

        assertThat(autoReply.onInbound(from(CUSTOMER))).isEqualTo(AutoReplyScheduler.Decision.NO_TEMPLATE);
        assertThat(autoReply.isPending(CUSTOMER)).isFalse();
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────────

    @Test
    void disconnect_dropsPendingReplies() {
        autoReply.onInbound(from(CUSTOMER));

        autoReply.onStateChanged(session, SessionState.STABLE, SessionState.DISCONNECTED, "phone offline");
        scheduler.advance(Duration.ofMinutes(1));

        verify(session, never()).send(anyString(), anyString(), any());
        assertThat(autoReply.stats().getPendingCount()).isZero();
    }

    @Test
    void nonTerminalStateChange_keepsPendingReplies() {
        autoReply.onInbound(from(CUSTOMER));

        autoReply.onStateChanged(session, SessionState.READY, SessionState.STABLE, "probe passed");

        assertThat(autoReply.isPending(CUSTOMER)).isTrue();
    }

    @Test
    void sweep_forgetsRepliesOlderThanTheWindow() {
        autoReply.start();
        autoReply.onInbound(from(CUSTOMER));
        scheduler.advance(Duration.ofSeconds(5));
        assertThat(autoReply.stats().getRepliedCount()).isEqualTo(1);

        scheduler.advance(Duration.ofHours(2));

        assertThat(autoReply.stats().getRepliedCount()).isZero();
    }

    @Test
    void stats_reportScheduleState() {
        autoReply.onInbound(from(CUSTOMER));

        final var stats = autoReply.stats();

        assertThat(stats.getPendingCount()).isEqualTo(1);
        assertThat(stats.getBusinessHours().isOpen()).isFalse();
        assertThat(stats.getNextBusinessDay().getDaysUntil()).isEqualTo(1);
    }

    @Test
    void close_cancelsEverything() {
        autoReply.start();
        autoReply.onInbound(from(CUSTOMER));

        autoReply.close();
        scheduler.advance(Duration.ofHours(3));

        verifyNoInteractions(session);
        assertThat(scheduler.pendingCount()).isZero();
    }
}
