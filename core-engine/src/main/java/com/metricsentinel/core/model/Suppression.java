package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Active de-duplication window for one dedup key.
 *
 * <p>
 * Opened by the first alert of a key and closed at {@link #getWindowEnd()}.
 * While open, further alerts for the key increment
 * {@link #getSuppressedCount()}. Digest rules also accumulate the alerts
 * awaiting the next digest in {@link #getPendingDigest()}.
 * </p>
 *
 * <p>
 * Instances are mutated only inside the suppression repository's per-key
 * critical section.
 * </p>
 *
 * @since 1.0.0
 */
public class Suppression implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String dedupKey;
    private final String ruleId;
    private final Instant windowStart;
    private final Instant windowEnd;
    private int suppressedCount;
    private final List<DigestEntry> pendingDigest = new ArrayList<>();

    public Suppression(String dedupKey, String ruleId, Instant windowStart, Instant windowEnd) {
        this.dedupKey = Objects.requireNonNull(dedupKey, "dedupKey must not be null");
        this.ruleId = Objects.requireNonNull(ruleId, "ruleId must not be null");
        this.windowStart = Objects.requireNonNull(windowStart, "windowStart must not be null");
        this.windowEnd = Objects.requireNonNull(windowEnd, "windowEnd must not be null");
        if (!windowEnd.isAfter(windowStart)) {
            throw new IllegalArgumentException("windowEnd must be after windowStart for " + dedupKey);
        }
    }

    @JsonCreator
    static Suppression restore(@JsonProperty("dedupKey") String dedupKey,
            @JsonProperty("ruleId") String ruleId,
            @JsonProperty("windowStart") Instant windowStart,
            @JsonProperty("windowEnd") Instant windowEnd,
            @JsonProperty("suppressedCount") int suppressedCount,
            @JsonProperty("pendingDigest") List<DigestEntry> pendingDigest) {
        Suppression s = new Suppression(dedupKey, ruleId, windowStart, windowEnd);
        s.suppressedCount = suppressedCount;
        if (pendingDigest != null) {
            s.pendingDigest.addAll(pendingDigest);
        }
        return s;
    }

    /**
     * @param now the instant to test
     * @return {@code true} while {@code now} lies in {@code [windowStart, windowEnd)}
     */
    public boolean isActiveAt(Instant now) {
        return !now.isBefore(windowStart) && now.isBefore(windowEnd);
    }

    public void incrementSuppressed() {
        suppressedCount++;
    }

    public void addPending(DigestEntry entry) {
        pendingDigest.add(Objects.requireNonNull(entry, "entry must not be null"));
    }

    /**
     * Remove and return every entry awaiting a digest.
     *
     * @return the drained entries in arrival order
     */
    public List<DigestEntry> drainPending() {
        List<DigestEntry> drained = new ArrayList<>(pendingDigest);
        pendingDigest.clear();
        return drained;
    }

    public Suppression copy() {
        Suppression c = new Suppression(dedupKey, ruleId, windowStart, windowEnd);
        c.suppressedCount = suppressedCount;
        c.pendingDigest.addAll(pendingDigest);
        return c;
    }

    public String getDedupKey() {
        return dedupKey;
    }

    public String getRuleId() {
        return ruleId;
    }

    public Instant getWindowStart() {
        return windowStart;
    }

    public Instant getWindowEnd() {
        return windowEnd;
    }

    public int getSuppressedCount() {
        return suppressedCount;
    }

    public List<DigestEntry> getPendingDigest() {
        return Collections.unmodifiableList(pendingDigest);
    }

    @Override
    public String toString() {
        return "Suppression{" +
                "dedupKey='" + dedupKey + '\'' +
                ", ruleId='" + ruleId + '\'' +
                ", window=[" + windowStart + ", " + windowEnd + ')' +
                ", suppressedCount=" + suppressedCount +
                ", pending=" + pendingDigest.size() +
                '}';
    }

    /**
     * Summary of one alert held for a digest notification.
     */
    public static final class DigestEntry implements Serializable {

        private static final long serialVersionUID = 1L;

        private final String alertId;
        private final String title;
        private final Severity severity;
        private final Instant createdAt;

        @JsonCreator
        public DigestEntry(@JsonProperty("alertId") String alertId,
                @JsonProperty("title") String title,
                @JsonProperty("severity") Severity severity,
                @JsonProperty("createdAt") Instant createdAt) {
            this.alertId = Objects.requireNonNull(alertId, "alertId must not be null");
            this.title = title;
            this.severity = Objects.requireNonNull(severity, "severity must not be null");
            this.createdAt = Objects.requireNonNull(createdAt, "createdAt must not be null");
        }

        public static DigestEntry of(Alert alert) {
            return new DigestEntry(alert.getId(), alert.getTitle(), alert.getSeverity(), alert.getCreatedAt());
        }

        public String getAlertId() {
            return alertId;
        }

        public String getTitle() {
            return title;
        }

        public Severity getSeverity() {
            return severity;
        }

        public Instant getCreatedAt() {
            return createdAt;
        }
    }
}
