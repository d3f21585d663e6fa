package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * One unit of delivery work: a payload for one channel and destination.
 *
 * <p>
 * At most one job exists per ({@code alertId}, {@code channel}). For digests
 * the {@code alertId} is the first alert of the digest batch.
 * </p>
 *
 * <p>
 * Mutable and Jackson friendly so that job repositories can journal it;
 * repositories hand out {@link #copy() copies}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class NotificationJob implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String alertId;
    private String ruleId;
    private String channel;
    private String destination;
    private Severity severity;
    private NotificationPayload payload;
    private int attempts;
    private Instant nextAttemptAt;
    private JobStatus status = JobStatus.QUEUED;
    private Instant createdAt;
    private Instant updatedAt;
    private String lastError;

    /** No-arg constructor required by Jackson. */
    public NotificationJob() {
    }

    public NotificationJob(String id, String alertId, String ruleId, String channel, String destination,
            Severity severity, NotificationPayload payload, Instant createdAt) {
        this.id = Objects.requireNonNull(id, "id must not be null");
        this.alertId = Objects.requireNonNull(alertId, "alertId must not be null");
        this.ruleId = ruleId;
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.destination = destination;
        this.severity = Objects.requireNonNull(severity, "severity must not be null");
        this.payload = Objects.requireNonNull(payload, "payload must not be null");
        this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        this.updatedAt = createdAt;
        this.nextAttemptAt = createdAt;
    }

    /**
     * @return the uniqueness key {@code alertId|channel}
     */
    public String deliveryKey() {
        return deliveryKey(alertId, channel);
    }

    public static String deliveryKey(String alertId, String channel) {
        return alertId + '|' + channel;
    }

    /**
     * @param now the current instant
     * @return {@code true} if the job may be claimed at {@code now}
     */
    public boolean isDue(Instant now) {
        return status.isClaimable() && (nextAttemptAt == null || !nextAttemptAt.isAfter(now));
    }

    public NotificationJob copy() {
        NotificationJob c = new NotificationJob();
        c.id = id;
        c.alertId = alertId;
        c.ruleId = ruleId;
        c.channel = channel;
        c.destination = destination;
        c.severity = severity;
        c.payload = payload;
        c.attempts = attempts;
        c.nextAttemptAt = nextAttemptAt;
        c.status = status;
        c.createdAt = createdAt;
        c.updatedAt = updatedAt;
        c.lastError = lastError;
        return c;
    }

    // ---------------------------------------------------------------
    // Getters / Setters (required for Jackson)
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getAlertId() {
        return alertId;
    }

    public void setAlertId(String alertId) {
        this.alertId = alertId;
    }

    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public String getChannel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel;
    }

    public String getDestination() {
        return destination;
    }

    public void setDestination(String destination) {
        this.destination = destination;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public NotificationPayload getPayload() {
        return payload;
    }

    public void setPayload(NotificationPayload payload) {
        this.payload = payload;
    }

    public int getAttempts() {
        return attempts;
    }

    public void setAttempts(int attempts) {
        this.attempts = attempts;
    }

    public Instant getNextAttemptAt() {
        return nextAttemptAt;
    }

    public void setNextAttemptAt(Instant nextAttemptAt) {
        this.nextAttemptAt = nextAttemptAt;
    }

    public JobStatus getStatus() {
        return status;
    }

    public void setStatus(JobStatus status) {
        this.status = status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public String getLastError() {
        return lastError;
    }

    public void setLastError(String lastError) {
        this.lastError = lastError;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NotificationJob that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "NotificationJob{" +
                "id='" + id + '\'' +
                ", alertId='" + alertId + '\'' +
                ", channel='" + channel + '\'' +
                ", severity=" + severity +
                ", attempts=" + attempts +
                ", status=" + status +
                ", nextAttemptAt=" + nextAttemptAt +
                '}';
    }
}
