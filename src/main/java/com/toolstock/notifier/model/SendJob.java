package com.toolstock.notifier.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.Objects;

/**
 * One outbound notification: who to send it to and the already-rendered text.
 *
 * <p>Consumed from the jobs topic. Rendering (templates, tracking links,
 * address formatting) happens upstream; this class never looks inside the body.
 */
public final class SendJob {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final String jobId;
    private final String recipientRaw;
    private final String messageBody;

    @JsonCreator
    public SendJob(
            @JsonProperty("jobId") final String jobId,
            @JsonProperty("recipient") final String recipientRaw,
            @JsonProperty("message") final String messageBody) {
        this.jobId        = jobId;
        this.recipientRaw = recipientRaw;
        this.messageBody  = messageBody;
    }

    public static SendJob fromJson(final String json) {
        final SendJob job;
        try {
            job = MAPPER.readValue(json, SendJob.class);
        } catch (Exception e) {
            throw new IllegalArgumentException("Failed to deserialise SendJob: " + e.getMessage(), e);
        }
        if (job.getJobId() == null || job.getJobId().isBlank()) {
            throw new IllegalArgumentException("SendJob without jobId");
        }
        return job;
    }

    @JsonProperty("jobId")     public String getJobId()        { return jobId; }
    @JsonProperty("recipient") public String getRecipientRaw() { return recipientRaw; }
    @JsonProperty("message")   public String getMessageBody()  { return messageBody; }

    @Override
    public boolean equals(final Object o) {
        if (this == o) return true;
        if (!(o instanceof SendJob)) return false;
        final SendJob other = (SendJob) o;
        return Objects.equals(jobId, other.jobId)
            && Objects.equals(recipientRaw, other.recipientRaw)
            && Objects.equals(messageBody, other.messageBody);
    }

    @Override
    public int hashCode() {
        return Objects.hash(jobId, recipientRaw, messageBody);
    }

    @Override
    public String toString() {
        return "SendJob{jobId=" + jobId
             + ", recipient=" + (recipientRaw != null ? Masking.maskPhone(recipientRaw) : "null")
             + ", bodyLength=" + (messageBody != null ? messageBody.length() : 0) + "}";
    }
}
