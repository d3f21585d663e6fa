package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable audit record of one send try.
 *
 * @since 1.0.0
 */
public final class DeliveryAttempt implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String jobId;
    private final int attemptNumber;
    private final String channel;
    private final DeliveryOutcome outcome;
    private final Instant timestamp;
    private final String errorDetail;

    @JsonCreator
    public DeliveryAttempt(@JsonProperty("jobId") String jobId,
            @JsonProperty("attemptNumber") int attemptNumber,
            @JsonProperty("channel") String channel,
            @JsonProperty("outcome") DeliveryOutcome outcome,
            @JsonProperty("timestamp") Instant timestamp,
            @JsonProperty("errorDetail") String errorDetail) {
        this.jobId = Objects.requireNonNull(jobId, "jobId must not be null");
        this.attemptNumber = attemptNumber;
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
        this.timestamp = Objects.requireNonNull(timestamp, "timestamp must not be null");
        this.errorDetail = errorDetail;
    }

    public String getJobId() {
        return jobId;
    }

    public int getAttemptNumber() {
        return attemptNumber;
    }

    public String getChannel() {
        return channel;
    }

    public DeliveryOutcome getOutcome() {
        return outcome;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public String getErrorDetail() {
        return errorDetail;
    }

    @Override
    public String toString() {
        return "DeliveryAttempt{" +
                "jobId='" + jobId + '\'' +
                ", attempt=" + attemptNumber +
                ", channel='" + channel + '\'' +
                ", outcome=" + outcome +
                ", timestamp=" + timestamp +
                (errorDetail != null ? ", error='" + errorDetail + '\'' : "") +
                '}';
    }
}
