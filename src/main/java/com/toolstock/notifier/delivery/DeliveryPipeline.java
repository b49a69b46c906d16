package com.toolstock.notifier.delivery;

import com.toolstock.notifier.error.AuthenticationException;
import com.toolstock.notifier.error.NotifierException;
import com.toolstock.notifier.error.TransientTransportException;
import com.toolstock.notifier.error.ValidationException;
import com.toolstock.notifier.model.ChatEntry;
import com.toolstock.notifier.model.Masking;
import com.toolstock.notifier.model.SendJob;
import com.toolstock.notifier.model.SendResult;
import com.toolstock.notifier.retry.RetryExecutor;
import com.toolstock.notifier.scheduling.Sleeper;
import com.toolstock.notifier.session.ChannelSession;
import com.toolstock.notifier.session.SessionHolder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

/**
 * Delivers one {@link SendJob} through the active chat session and classifies
 * the outcome.
 *
 * <h2>Steps</h2>
 * <ol>
 *   <li>Make sure the session is stable.</li>
 *   <li>Normalize the recipient; a malformed number fails the job without retry.</li>
 *   <li>Check the number has a chat account, retried through the {@link RetryExecutor}
 *       with a stability check between attempts.</li>
 *   <li>Settle, capture the send start instant, send.</li>
 *   <li>Verify: after a short grace period, read the conversation's latest
 *       entry. A silent transport answer is resolved by the heuristic below.</li>
 * </ol>
 *
 * <h2>Verification</h2>
 * <ul>
 *   <li>tail contains the first line's prefix and is not older than the send
 *       start minus the tolerance → {@code CHAT_VERIFICATION}</li>
 *   <li>otherwise, transport acknowledged with an id → {@code NORMAL_RESPONSE}</li>
 *   <li>otherwise, tail read failed → {@code SEND_NO_ERROR}</li>
 *   <li>otherwise → {@code NO_ERROR_ASSUMPTION}</li>
 * </ul>
 *
 * Never throws: every failure becomes a {@link SendResult}.
 */
public class DeliveryPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(DeliveryPipeline.class);

    static final String VERIFIED_ID   = "verified";
    static final String ASSUMED_ID    = "assumed_success";
    static final String UNVERIFIED_ID = "unverified_success";

    private final SessionHolder       sessions;
    private final RecipientNormalizer normalizer;
    private final RetryExecutor       retry;
    private final DeliverySettings    settings;
    private final Sleeper             sleeper;
    private final Clock               clock;

    public DeliveryPipeline(
            final SessionHolder sessions,
            final RecipientNormalizer normalizer,
            final RetryExecutor retry,
            final DeliverySettings settings,
            final Sleeper sleeper,
            final Clock clock) {
        this.sessions   = sessions;
        this.normalizer = normalizer;
        this.retry      = retry;
        this.settings   = settings;
        this.sleeper    = sleeper;
        this.clock      = clock;
    }

    public SendResult send(final SendJob job) {
        try {
            return deliver(job);
        } catch (ValidationException e) {
            LOG.warn("Job {} rejected: {}", job.getJobId(), e.getMessage());
            return SendResult.sendError(e.getMessage(), SendResult.ErrorKind.VALIDATION);
        } catch (AuthenticationException e) {
            LOG.error("Job {} failed, session not authenticated: {}", job.getJobId(), e.getMessage());
            return SendResult.sendError(e.getMessage(), SendResult.ErrorKind.AUTHENTICATION);
        } catch (TransientTransportException e) {
            LOG.warn("Job {} failed on the transport: {}", job.getJobId(), e.getMessage());
            return SendResult.sendError(e.getMessage(), SendResult.ErrorKind.TRANSIENT_TRANSPORT);
        } catch (RuntimeException e) {
            LOG.error("Unexpected error delivering job {}", job.getJobId(), e);
            return SendResult.sendError("unexpected error: " + e.getMessage(), SendResult.ErrorKind.SEND_FAILED);
        }
    }

    private SendResult deliver(final SendJob job) {
        sessions.get().ensureStable();

        final String number = normalizer.normalize(job.getRecipientRaw());
        final String masked = Masking.maskPhone(number);
        if (job.getMessageBody() == null || job.getMessageBody().isBlank()) {
            throw new ValidationException("message body is empty");
        }

        final Optional<String> chatId = retry.execute(
                () -> sessions.get().checkChannel(number, settings.getChannelCheckTimeout()),
                "channel check for " + masked,
                () -> sessions.get().ensureStable());
        if (chatId.isEmpty()) {
            LOG.info("Job {}: {} has no chat account", job.getJobId(), masked);
            return SendResult.noChannel("number has no chat account", number);
        }

        sleeper.sleep(settings.getSettleDelay());

        final ChannelSession session = sessions.get();
        final Instant sendStart = clock.instant();
        final Optional<String> ack;
        try {
            ack = session.send(chatId.get(), job.getMessageBody(), settings.getSendTimeout());
        } catch (AuthenticationException e) {
            throw e;
        } catch (NotifierException e) {
            LOG.error("Job {}: send to {} failed: {}", job.getJobId(), masked, e.getMessage());
            return SendResult.sendError(e.getMessage(), SendResult.ErrorKind.SEND_FAILED);
        }

        return verify(job, session, number, chatId.get(), ack, sendStart);
    }

    private SendResult verify(
            final SendJob job,
            final ChannelSession session,
            final String number,
            final String chatId,
            final Optional<String> ack,
            final Instant sendStart) {

        sleeper.sleep(settings.getVerificationGrace());

        Optional<ChatEntry> tail = Optional.empty();
        boolean tailFailed = false;
        try {
            tail = session.lastEntry(chatId, settings.getVerificationTimeout());
        } catch (NotifierException e) {
            tailFailed = true;
            LOG.warn("Job {}: could not read conversation to verify: {}", job.getJobId(), e.getMessage());
        }

        if (tail.isPresent() && matches(tail.get(), job.getMessageBody(), sendStart)) {
            final String id = tail.get().getId() != null ? tail.get().getId() : VERIFIED_ID;
            LOG.info("Job {}: delivery verified in conversation", job.getJobId());
            return SendResult.sent(id, number, SendResult.VerificationMethod.CHAT_VERIFICATION);
        }
        if (ack.isPresent()) {
            return SendResult.sent(ack.get(), number, SendResult.VerificationMethod.NORMAL_RESPONSE);
        }
        if (tailFailed) {
            LOG.info("Job {}: unverified_success, conversation unreadable and send raised no error", job.getJobId());
            return SendResult.sent(UNVERIFIED_ID, number, SendResult.VerificationMethod.SEND_NO_ERROR);
        }
        LOG.info("Job {}: assumed_success, no acknowledgment and conversation did not match", job.getJobId());
        return SendResult.sent(ASSUMED_ID, number, SendResult.VerificationMethod.NO_ERROR_ASSUMPTION);
    }

    /** The conversation tail shows our text, stamped no earlier than the send start minus the tolerance. */
    boolean matches(final ChatEntry entry, final String sentText, final Instant sendStart) {
        if (entry.getBody() == null || entry.getTimestamp() == null) {
            return false;
        }
        final String firstLine = sentText.split("\n", 2)[0];
        final String prefix = firstLine.substring(0, Math.min(firstLine.length(), settings.getVerificationPrefixLength()));
        // tail timestamps have second resolution
        final Instant earliest = sendStart.truncatedTo(ChronoUnit.SECONDS).minus(settings.getVerificationTolerance());
        return entry.getBody().contains(prefix) && !entry.getTimestamp().isBefore(earliest);
    }
}
