package com.metricsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Identity of one metric time series: an (entity, metric) pair.
 *
 * @since 1.0.0
 */
public final class SeriesKey implements Serializable, Comparable<SeriesKey> {

    private static final long serialVersionUID = 1L;

    private final String entityId;
    private final String metric;

    public SeriesKey(String entityId, String metric) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
    }

    public static SeriesKey of(String entityId, String metric) {
        return new SeriesKey(entityId, metric);
    }

    public static SeriesKey of(MetricPoint point) {
        return new SeriesKey(point.getEntityId(), point.getMetric());
    }

    public String getEntityId() {
        return entityId;
    }

    public String getMetric() {
        return metric;
    }

    @Override
    public int compareTo(SeriesKey other) {
        int c = entityId.compareTo(other.entityId);
        return c != 0 ? c : metric.compareTo(other.metric);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SeriesKey that))
            return false;
        return entityId.equals(that.entityId) && metric.equals(that.metric);
    }

    @Override
    public int hashCode() {
        return Objects.hash(entityId, metric);
    }

    @Override
    public String toString() {
        return entityId + '/' + metric;
    }
}
