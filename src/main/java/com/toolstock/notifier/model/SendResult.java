package com.toolstock.notifier.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Immutable outcome of one send job. Exactly one of three shapes:
 *
 * <ul>
 *   <li>{@link Status#SENT}: {@code messageId}, {@code formattedRecipient},
 *       {@code verificationMethod}</li>
 *   <li>{@link Status#NO_CHANNEL}: the number has no chat account; {@code reason},
 *       {@code formattedRecipient}</li>
 *   <li>{@link Status#SEND_ERROR}: {@code reason}, {@code errorKind}</li>
 * </ul>
 *
 * <p>Returned by {@link com.toolstock.notifier.delivery.DeliveryPipeline}; never thrown.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class SendResult {

    public enum Status { SENT, NO_CHANNEL, SEND_ERROR }

    public enum ErrorKind { VALIDATION, TRANSIENT_TRANSPORT, AUTHENTICATION, SEND_FAILED }

    /** How a {@link Status#SENT} outcome was established. */
    public enum VerificationMethod {
        /** The conversation tail shows our text with a matching timestamp. */
        CHAT_VERIFICATION,
        /** The transport returned an acknowledgment with a message id. */
        NORMAL_RESPONSE,
        /** No acknowledgment, tail did not match, but the send raised no error. */
        NO_ERROR_ASSUMPTION,
        /** No acknowledgment and the tail could not be read, but the send raised no error. */
        SEND_NO_ERROR
    }

    private final Status             status;
    private final String             messageId;
    private final String             formattedRecipient;
    private final VerificationMethod verificationMethod;
    private final String             reason;
    private final ErrorKind          errorKind;

    private SendResult(
            final Status status,
            final String messageId,
            final String formattedRecipient,
            final VerificationMethod verificationMethod,
            final String reason,
            final ErrorKind errorKind) {
        this.status             = status;
        this.messageId          = messageId;
        this.formattedRecipient = formattedRecipient;
        this.verificationMethod = verificationMethod;
        this.reason             = reason;
        this.errorKind          = errorKind;
    }

    public static SendResult sent(
            final String messageId,
            final String formattedRecipient,
            final VerificationMethod method) {
        return new SendResult(Status.SENT, messageId, formattedRecipient, method, null, null);
    }

    public static SendResult noChannel(final String reason, final String formattedRecipient) {
        return new SendResult(Status.NO_CHANNEL, null, formattedRecipient, null, reason, null);
    }

    public static SendResult sendError(final String reason, final ErrorKind kind) {
        return new SendResult(Status.SEND_ERROR, null, null, null, reason, kind);
    }

    public Status             getStatus()             { return status; }
    public String             getMessageId()          { return messageId; }
    public String             getFormattedRecipient() { return formattedRecipient; }
    public VerificationMethod getVerificationMethod() { return verificationMethod; }
    public String             getReason()             { return reason; }
    public ErrorKind          getErrorKind()          { return errorKind; }

    @JsonIgnore
    public boolean isSent() { return status == Status.SENT; }

    @Override
    public String toString() {
        return "SendResult{status=" + status
             + (messageId != null ? ", msgId=" + messageId : "")
             + (formattedRecipient != null ? ", to=" + Masking.maskPhone(formattedRecipient) : "")
             + (verificationMethod != null ? ", verification=" + verificationMethod : "")
             + (errorKind != null ? ", kind=" + errorKind : "")
             + (reason != null ? ", reason=" + reason : "")
             + "}";
    }
}
