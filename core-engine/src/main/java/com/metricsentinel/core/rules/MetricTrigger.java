package com.metricsentinel.core.rules;

import com.metricsentinel.core.model.MetricPoint;
import com.metricsentinel.core.model.Severity;

import java.time.LocalDate;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Trigger carrying the raw series of one entity/metric, evaluated by
 * {@code threshold} and {@code pattern} rules.
 *
 * <p>
 * Points are kept in ascending date order. Missing days are simply absent.
 * </p>
 *
 * @since 1.0.0
 */
public final class MetricTrigger implements Trigger {

    private final String entityId;
    private final String metric;
    private final List<MetricPoint> series;

    public MetricTrigger(String entityId, String metric, List<MetricPoint> series) {
        this.entityId = Objects.requireNonNull(entityId, "entityId must not be null");
        this.metric = Objects.requireNonNull(metric, "metric must not be null");
        Objects.requireNonNull(series, "series must not be null");
        if (series.isEmpty()) {
            throw new IllegalArgumentException("series must not be empty for " + entityId + "/" + metric);
        }
        this.series = series.stream()
                .sorted(Comparator.comparing(MetricPoint::getDate))
                .toList();
    }

    public List<MetricPoint> getSeries() {
        return series;
    }

    public MetricPoint latest() {
        return series.get(series.size() - 1);
    }

    /**
     * @return series values, oldest first
     */
    public double[] values() {
        return series.stream().mapToDouble(MetricPoint::getValue).toArray();
    }

    @Override
    public String getEntityId() {
        return entityId;
    }

    @Override
    public String getMetric() {
        return metric;
    }

    @Override
    public LocalDate getDate() {
        return latest().getDate();
    }

    @Override
    public String key() {
        return "metric:" + entityId + "|" + metric + "|" + getDate();
    }

    @Override
    public Severity getSeverity() {
        return Severity.MEDIUM;
    }

    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("latest", latest().getValue());
        snapshot.put("latestDate", getDate().toString());
        snapshot.put("points", series.size());
        return snapshot;
    }

    @Override
    public String toString() {
        return "MetricTrigger{" + entityId + '/' + metric + '@' + getDate() + '}';
    }
}
