package com.toolstock.notifier.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Instant;

/** {@code {jobId, outcome}} record handed to the outcome sink after every job. */
public final class JobOutcome {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

    private final String     jobId;
    private final SendResult result;
    private final Instant    completedAt;

    public JobOutcome(final String jobId, final SendResult result, final Instant completedAt) {
        this.jobId       = jobId;
        this.result      = result;
        this.completedAt = completedAt;
    }

    public String     getJobId()       { return jobId; }
    public SendResult getResult()      { return result; }
    public Instant    getCompletedAt() { return completedAt; }

    public String toJson() {
        try {
            return MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialise JobOutcome " + jobId, e);
        }
    }

    @Override
    public String toString() {
        return "JobOutcome{jobId=" + jobId + ", result=" + result + ", completedAt=" + completedAt + "}";
    }
}
