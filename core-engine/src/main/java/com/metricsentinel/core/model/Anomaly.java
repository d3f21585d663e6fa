package com.metricsentinel.core.model;

import java.io.Serializable;
import java.time.Instant;
import java.time.LocalDate;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Canonical, de-duplicated anomaly produced by the fusion engine.
 *
 * <p>
 * The {@link #getId() id} is a content hash of entity, metric, date and
 * direction, so re-running detection over the same inputs addresses the same
 * record. The per-detector confidences are retained so that later detector
 * runs can be merged without ever lowering the combined confidence.
 * </p>
 *
 * <h3>Thread Safety</h3>
 * <p>
 * Instances are mutable and <strong>not</strong> thread-safe. Repositories
 * hand out {@link #copy() copies} and perform merges inside their own
 * per-id critical section.
 * </p>
 *
 * @since 1.0.0
 */
public class Anomaly implements Serializable {

    private static final long serialVersionUID = 1L;

    private String id;
    private String entityId;
    private String metric;
    private LocalDate date;
    private Direction direction;
    private Severity severity;
    private double confidence;

    /** Best confidence seen so far per contributing detector. */
    private final Map<DetectorKind, Double> detectorConfidences = new EnumMap<>(DetectorKind.class);

    /** Relative deviation from the expected value, in percent (signed). */
    private double magnitudePct;

    private double actualValue;
    private Double expectedValue;
    private AnomalyStatus status = AnomalyStatus.NEW;
    private Instant firstDetectedAt;
    private Instant updatedAt;
    private Instant resolvedAt;

    public Anomaly() {
    }

    private Anomaly(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.entityId = Objects.requireNonNull(b.entityId, "entityId must not be null");
        this.metric = Objects.requireNonNull(b.metric, "metric must not be null");
        this.date = Objects.requireNonNull(b.date, "date must not be null");
        this.direction = Objects.requireNonNull(b.direction, "direction must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.confidence = b.confidence;
        this.detectorConfidences.putAll(b.detectorConfidences);
        this.magnitudePct = b.magnitudePct;
        this.actualValue = b.actualValue;
        this.expectedValue = b.expectedValue;
        this.status = b.status != null ? b.status : AnomalyStatus.NEW;
        this.firstDetectedAt = b.detectedAt;
        this.updatedAt = b.detectedAt;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link Anomaly}. {@code id}, identity fields and
     * {@code severity} are required.
     */
    public static class Builder {
        private String id;
        private String entityId;
        private String metric;
        private LocalDate date;
        private Direction direction;
        private Severity severity;
        private double confidence;
        private final Map<DetectorKind, Double> detectorConfidences = new EnumMap<>(DetectorKind.class);
        private double magnitudePct;
        private double actualValue;
        private Double expectedValue;
        private AnomalyStatus status;
        private Instant detectedAt;

        public Builder id(String id) {
            this.id = id;
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

        public Builder direction(Direction direction) {
            this.direction = direction;
            return this;
        }

        public Builder severity(Severity severity) {
            this.severity = severity;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
            return this;
        }

        public Builder detectorConfidences(Map<DetectorKind, Double> confidences) {
            this.detectorConfidences.putAll(confidences);
            return this;
        }

        public Builder magnitudePct(double magnitudePct) {
            this.magnitudePct = magnitudePct;
            return this;
        }

        public Builder actualValue(double actualValue) {
            this.actualValue = actualValue;
            return this;
        }

        public Builder expectedValue(Double expectedValue) {
            this.expectedValue = expectedValue;
            return this;
        }

        public Builder status(AnomalyStatus status) {
            this.status = status;
            return this;
        }

        public Builder detectedAt(Instant detectedAt) {
            this.detectedAt = detectedAt;
            return this;
        }

        public Anomaly build() {
            return new Anomaly(this);
        }
    }

    /**
     * @return a detached copy that can be handed to other threads
     */
    public Anomaly copy() {
        Anomaly c = new Anomaly();
        c.id = id;
        c.entityId = entityId;
        c.metric = metric;
        c.date = date;
        c.direction = direction;
        c.severity = severity;
        c.confidence = confidence;
        c.detectorConfidences.putAll(detectorConfidences);
        c.magnitudePct = magnitudePct;
        c.actualValue = actualValue;
        c.expectedValue = expectedValue;
        c.status = status;
        c.firstDetectedAt = firstDetectedAt;
        c.updatedAt = updatedAt;
        c.resolvedAt = resolvedAt;
        return c;
    }

    public SeriesKey seriesKey() {
        return SeriesKey.of(entityId, metric);
    }

    public Set<DetectorKind> getContributingDetectors() {
        return Collections.unmodifiableSet(detectorConfidences.keySet());
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
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

    public Direction getDirection() {
        return direction;
    }

    public void setDirection(Direction direction) {
        this.direction = direction;
    }

    public Severity getSeverity() {
        return severity;
    }

    public void setSeverity(Severity severity) {
        this.severity = severity;
    }

    public double getConfidence() {
        return confidence;
    }

    public void setConfidence(double confidence) {
        this.confidence = confidence;
    }

    /**
     * @return unmodifiable view of the best confidence per detector
     */
    public Map<DetectorKind, Double> getDetectorConfidences() {
        return Collections.unmodifiableMap(detectorConfidences);
    }

    public void setDetectorConfidences(Map<DetectorKind, Double> confidences) {
        detectorConfidences.clear();
        if (confidences != null) {
            detectorConfidences.putAll(confidences);
        }
    }

    public double getMagnitudePct() {
        return magnitudePct;
    }

    public void setMagnitudePct(double magnitudePct) {
        this.magnitudePct = magnitudePct;
    }

    public double getActualValue() {
        return actualValue;
    }

    public void setActualValue(double actualValue) {
        this.actualValue = actualValue;
    }

    public Double getExpectedValue() {
        return expectedValue;
    }

    public void setExpectedValue(Double expectedValue) {
        this.expectedValue = expectedValue;
    }

    public AnomalyStatus getStatus() {
        return status;
    }

    public void setStatus(AnomalyStatus status) {
        this.status = status;
    }

    public Instant getFirstDetectedAt() {
        return firstDetectedAt;
    }

    public void setFirstDetectedAt(Instant firstDetectedAt) {
        this.firstDetectedAt = firstDetectedAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    public void setUpdatedAt(Instant updatedAt) {
        this.updatedAt = updatedAt;
    }

    public Instant getResolvedAt() {
        return resolvedAt;
    }

    public void setResolvedAt(Instant resolvedAt) {
        this.resolvedAt = resolvedAt;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof Anomaly that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hashCode(id);
    }

    @Override
    public String toString() {
        return "Anomaly{" +
                "id='" + id + '\'' +
                ", entityId='" + entityId + '\'' +
                ", metric='" + metric + '\'' +
                ", date=" + date +
                ", direction=" + direction +
                ", severity=" + severity +
                ", confidence=" + String.format("%.3f", confidence) +
                ", detectors=" + detectorConfidences.keySet() +
                ", status=" + status +
                '}';
    }
}
