package com.metricsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Alert emitted when an alert rule matches a trigger.
 *
 * <p>
 * An alert is created once by the rule engine and afterwards only its
 * {@link #getStatus() status} changes. Anomaly-based alerts carry the id of
 * the canonical anomaly; alerts raised from raw-metric rules leave it
 * {@code null}.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. The builder enforces that {@code id},
 * {@code ruleId}, {@code entityId}, {@code severity}, {@code dedupKey} and
 * {@code createdAt} are present; omitting one throws a
 * {@link NullPointerException} at build time.
 * </p>
 *
 * @since 1.0.0
 */
public class Alert implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String ruleId;
    private String ruleName;

    /** Canonical anomaly that triggered the alert; {@code null} for metric rules. */
    private String anomalyId;

    private String entityId;
    private String metric;

    /** Observation date the trigger refers to. */
    private LocalDate date;

    private Severity severity;
    private String title;
    private String message;

    /** Snapshot of the numbers behind the alert, rendered as JSON downstream. */
    private Map<String, Object> metricsSnapshot;

    private Instant createdAt;
    private String dedupKey;
    private AlertStatus status = AlertStatus.OPEN;

    // ---------------------------------------------------------------
    // Constructors
    // ---------------------------------------------------------------

    /** No-arg constructor required by Jackson. */
    public Alert() {
    }

    private Alert(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id must not be null");
        this.ruleId = Objects.requireNonNull(builder.ruleId, "ruleId must not be null");
        this.ruleName = builder.ruleName;
        this.anomalyId = builder.anomalyId;
        this.entityId = Objects.requireNonNull(builder.entityId, "entityId must not be null");
        this.metric = builder.metric;
        this.date = builder.date;
        this.severity = Objects.requireNonNull(builder.severity, "severity must not be null");
        this.title = builder.title;
        this.message = builder.message;
        this.metricsSnapshot = builder.metricsSnapshot != null
                ? new LinkedHashMap<>(builder.metricsSnapshot)
                : null;
        this.createdAt = Objects.requireNonNull(builder.createdAt, "createdAt must not be null");
        this.dedupKey = Objects.requireNonNull(builder.dedupKey, "dedupKey must not be null");
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Alert} instances.
     */
    public static class Builder {
        private String id;
        private String ruleId;
        private String ruleName;
        private String anomalyId;
        private String entityId;
        private String metric;
        private LocalDate date;
        private Severity severity;
        private String title;
        private String message;
        private Map<String, Object> metricsSnapshot;
        private Instant createdAt;
        private String dedupKey;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder ruleId(String ruleId) {
            this.ruleId = ruleId;
            return this;
        }

        public Builder ruleName(String ruleName) {
            this.ruleName = ruleName;
            return this;
        }

        public Builder anomalyId(String anomalyId) {
            this.anomalyId = anomalyId;
            return this;
        }

        public Builder entityId(String entityId) {
            this.entityId = entityId;
            return this;
        }

        public Builder metric(String metric) {
            this.metric = metric;
            return this;
        }

        public Builder date(LocalDate date) {
            this.date = date;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder title(String title) {
            this.title = title;
            return this;
        }

        public Builder message(String message) {
            this.message = message;
            return this;
        }

        public Builder metricsSnapshot(Map<String, Object> metricsSnapshot) {
            this.metricsSnapshot = metricsSnapshot;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder dedupKey(String dedupKey) {
            this.dedupKey = dedupKey;
            return this;
        }

        /**
         * Build the alert.
         *
         * @return a new {@link Alert} in status {@link AlertStatus#OPEN}
         * @throws NullPointerException if a required field is {@code null}
         */
        public Alert build() {
            return new Alert(this);
        }
    }

    /**
     * @return a detached copy, status included
     */
    public Alert copy() {
        Alert c = new Alert();
        c.id = id;
        c.ruleId = ruleId;
        c.ruleName = ruleName;
        c.anomalyId = anomalyId;
        c.entityId = entityId;
        c.metric = metric;
        c.date = date;
        c.severity = severity;
        c.title = title;
        c.message = message;
        c.setMetricsSnapshot(metricsSnapshot);
        c.createdAt = createdAt;
        c.dedupKey = dedupKey;
        c.status = status;
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

    public String getRuleId() {
        return ruleId;
    }

    public void setRuleId(String ruleId) {
        this.ruleId = ruleId;
    }

    public String getRuleName() {
        return ruleName;
    }

    public void setRuleName(String ruleName) {
        this.ruleName = ruleName;
    }

    public String getAnomalyId() {
        return anomalyId;
    }

    public void setAnomalyId(String anomalyId) {
        this.anomalyId = anomalyId;
    }

    public String getEntityId() {
        return entityId;
    }

    public void setEntityId(String entityId) {
        this.entityId = entityId;
    }

    public String getMetric() {
        return metric;
    }

    public void setMetric(String metric) {
        this.metric = metric;
    }

    public LocalDate getDate() {
        return date;
    }

    public void setDate(LocalDate date) {
        this.date = date;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public String getTitle() {
        return title;
    }

    public void setTitle(String title) {
        this.title = title;
    }

    public String getMessage() {
        return message;
    }

    public void setMessage(String message) {
        this.message = message;
    }

    /**
     * Return an <strong>unmodifiable</strong> view of the metrics snapshot.
     *
     * @return unmodifiable map, or {@code null} if not set
     */
    public Map<String, Object> getMetricsSnapshot() {
        return metricsSnapshot != null
                ? Collections.unmodifiableMap(metricsSnapshot)
                : null;
    }

    public void setMetricsSnapshot(Map<String, Object> metricsSnapshot) {
        this.metricsSnapshot = metricsSnapshot != null
                ? new LinkedHashMap<>(metricsSnapshot)
                : null;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public void setCreatedAt(Instant createdAt) {
        this.createdAt = createdAt;
    }

    public String getDedupKey() {
        return dedupKey;
    }

    public void setDedupKey(String dedupKey) {
        this.dedupKey = dedupKey;
    }

    public AlertStatus getStatus() {
        return status;
    }

    public void setStatus(AlertStatus status) {
        this.status = status;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Alert alert))
            return false;
        return Objects.equals(id, alert.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Alert{" +
                "id='" + id + '\'' +
                ", ruleId='" + ruleId + '\'' +
                ", entityId='" + entityId + '\'' +
                ", metric='" + metric + '\'' +
                ", severity=" + severity +
                ", title='" + title + '\'' +
                ", status=" + status +
                '}';
    }
}
