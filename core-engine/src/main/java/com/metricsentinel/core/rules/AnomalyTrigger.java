package com.metricsentinel.core.rules;

import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.DetectorKind;
import com.metricsentinel.core.model.Severity;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Trigger wrapping a canonical {@link Anomaly}.
 *
 * @since 1.0.0
 */
public final class AnomalyTrigger implements Trigger {

    private final Anomaly anomaly;

    public AnomalyTrigger(Anomaly anomaly) {
        this.anomaly = Objects.requireNonNull(anomaly, "anomaly must not be null");
        Objects.requireNonNull(anomaly.getId(), "anomaly id must not be null");
    }

    public Anomaly getAnomaly() {
        return anomaly;
    }

    @Override
    public String getEntityId() {
        return anomaly.getEntityId();
    }

    @Override
    public String getMetric() {
        return anomaly.getMetric();
    }

    @Override
    public LocalDate getDate() {
        return anomaly.getDate();
    }

    @Override
    public String key() {
        return "anomaly:" + anomaly.getId();
    }

    @Override
    public Severity getSeverity() {
        return anomaly.getSeverity();
    }

    @Override
    public Map<String, Object> snapshot() {
        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("actual", anomaly.getActualValue());
        if (anomaly.getExpectedValue() != null) {
            snapshot.put("expected", anomaly.getExpectedValue());
        }
        snapshot.put("magnitudePct", anomaly.getMagnitudePct());
        snapshot.put("confidence", anomaly.getConfidence());
        snapshot.put("direction", anomaly.getDirection().key());
        snapshot.put("detectors", anomaly.getContributingDetectors().stream()
                .map(DetectorKind::key)
                .toList());
        return snapshot;
    }

    @Override
    public String toString() {
        return "AnomalyTrigger{" + anomaly.getId() + '}';
    }
}
