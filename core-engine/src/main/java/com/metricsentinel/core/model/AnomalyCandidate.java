package com.metricsentinel.core.model;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * A single detector's opinion that one observation is anomalous.
 *
 * <p>
 * Candidates are created by a detector run and consumed by the fusion engine
 * within the same run; they are never persisted.
 * </p>
 *
 * <h3>Construction</h3>
 * <p>
 * Use the {@link Builder}. {@code entityId}, {@code metric}, {@code date},
 * {@code detector} and {@code direction} are required and the confidence
 * must lie in [0, 1].
 * </p>
 *
 * @since 1.0.0
 */
public final class AnomalyCandidate implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final String metric;
    private final LocalDate date;
    private final DetectorKind detector;
    private final Direction direction;

    /** Detector specific score: z-score, outlier score or band deviation. */
    private final double rawScore;

    private final double confidence;
    private final double actualValue;

    /** Baseline or forecast value; {@code null} when the method has none. */
    private final Double expectedValue;

    private AnomalyCandidate(Builder b) {
        this.entityId = Objects.requireNonNull(b.entityId, "entityId must not be null");
        this.metric = Objects.requireNonNull(b.metric, "metric must not be null");
        this.date = Objects.requireNonNull(b.date, "date must not be null");
        this.detector = Objects.requireNonNull(b.detector, "detector must not be null");
        this.direction = Objects.requireNonNull(b.direction, "direction must not be null");
        if (!(b.confidence >= 0.0 && b.confidence <= 1.0)) {
            throw new IllegalArgumentException("confidence must be in [0, 1], got: " + b.confidence);
        }
        this.rawScore = b.rawScore;
        this.confidence = b.confidence;
        this.actualValue = b.actualValue;
        this.expectedValue = b.expectedValue;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Fluent builder for {@link AnomalyCandidate}.
     */
    public static class Builder {
        private String entityId;
        private String metric;
        private LocalDate date;
        private DetectorKind detector;
        private Direction direction;
        private double rawScore;
        private double confidence;
        private double actualValue;
        private Double expectedValue;

        public Builder point(MetricPoint point) {
            this.entityId = point.getEntityId();
            this.metric = point.getMetric();
            this.date = point.getDate();
            this.actualValue = point.getValue();
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

        public Builder detector(DetectorKind detector) {
            this.detector = detector;
            return this;
        }

        public Builder direction(Direction direction) {
            this.direction = direction;
            return this;
        }

        public Builder rawScore(double rawScore) {
            this.rawScore = rawScore;
            return this;
        }

        public Builder confidence(double confidence) {
            this.confidence = confidence;
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

        public AnomalyCandidate build() {
            return new AnomalyCandidate(this);
        }
    }

    public String getEntityId() {
        return entityId;
    }

    public String getMetric() {
        return metric;
    }

    public LocalDate getDate() {
        return date;
    }

    public DetectorKind getDetector() {
        return detector;
    }

    public Direction getDirection() {
        return direction;
    }

    public double getRawScore() {
        return rawScore;
    }

    public double getConfidence() {
        return confidence;
    }

    public double getActualValue() {
        return actualValue;
    }

    public Double getExpectedValue() {
        return expectedValue;
    }

    /**
     * Relative deviation from the expected value in percent, or {@code null}
     * when there is no expectation or it is zero.
     */
    public Double relativeDeviationPct() {
        if (expectedValue == null || expectedValue == 0.0) {
            return null;
        }
        return (actualValue - expectedValue) / Math.abs(expectedValue) * 100.0;
    }

    @Override
    public String toString() {
        return "AnomalyCandidate{" +
                "entityId='" + entityId + '\'' +
                ", metric='" + metric + '\'' +
                ", date=" + date +
                ", detector=" + detector +
                ", direction=" + direction +
                ", rawScore=" + rawScore +
                ", confidence=" + confidence +
                '}';
    }
}
