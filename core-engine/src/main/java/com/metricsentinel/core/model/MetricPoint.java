package com.metricsentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One daily observation of a metric for a monitored entity.
 *
 * <p>
 * Produced by the collection connectors and read-only to the pipeline.
 * Instances are immutable and therefore safe to share between detector
 * threads.
 * </p>
 *
 * @since 1.0.0
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class MetricPoint implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final String metric;
    private final LocalDate date;
    private final double value;

    /**
     * @throws NullPointerException     if any identifying field is {@code null}
     * @throws IllegalArgumentException if {@code value} is not finite
     */
    @JsonCreator
    public MetricPoint(@JsonProperty("entityId") String entityId,
            @JsonProperty("metric") String metric,
            @JsonProperty("date") LocalDate date,
            @JsonProperty("value") double value) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        this.date = Objects.requireNonNull(date, "date must not be null");
        if (!Double.isFinite(value)) {
            throw new IllegalArgumentException("value must be finite for " + entityId + "/" + metric
                    + " on " + date + ", got: " + value);
        }
        this.value = value;
    }

    public static MetricPoint of(String entityId, String metric, LocalDate date, double value) {
        return new MetricPoint(entityId, metric, date, value);
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

    public double getValue() {
        return value;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MetricPoint that))
            return false;
        return Double.compare(value, that.value) == 0
                && entityId.equals(that.entityId)
                && metric.equals(that.metric)
                && date.equals(that.date);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, metric, date, value);
    }

    @Override
    public String toString() {
        return "MetricPoint{" + entityId + '/' + metric + ' ' + date + '=' + value + '}';
    }
}
