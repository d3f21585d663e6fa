package com.metricsentinel.core.rules;

import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.Direction;
import com.metricsentinel.core.model.Severity;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Matches canonical anomalies by severity, confidence, magnitude, direction
 * and the number of agreeing detectors. Unset criteria always pass.
 *
 * @since 1.0.0
 */
public final class AnomalyCondition implements RuleCondition {

    private final Severity minSeverity;
    private final double minConfidence;
    private final double minMagnitudePct;
    private final Set<Direction> directions;
    private final int minDetectors;

    public AnomalyCondition(Severity minSeverity, double minConfidence, double minMagnitudePct,
            Set<Direction> directions, int minDetectors) {
        this.minSeverity = minSeverity != null ? minSeverity : Severity.LOW;
        this.minConfidence = minConfidence;
        this.minMagnitudePct = minMagnitudePct;
        this.directions = directions == null || directions.isEmpty()
                ? EnumSet.allOf(Direction.class)
                : EnumSet.copyOf(directions);
        this.minDetectors = Math.max(1, minDetectors);
    }

    @Override
    public Optional<String> evaluate(Trigger trigger) {
        if (!(trigger instanceof AnomalyTrigger anomalyTrigger)) {
            return Optional.empty();
        }
        Anomaly anomaly = anomalyTrigger.getAnomaly();
        if (!anomaly.getStatus().isActive()) {
            return Optional.empty();
        }
        if (!anomaly.getSeverity().isAtLeast(minSeverity)
                || anomaly.getConfidence() < minConfidence
                || Math.abs(anomaly.getMagnitudePct()) < minMagnitudePct
                || !directions.contains(anomaly.getDirection())
                || anomaly.getContributingDetectors().size() < minDetectors) {
            return Optional.empty();
        }
        return Optional.of(String.format(Locale.ROOT,
                "%s anomaly: %s is %.1f%% %s expected (confidence %.2f, %d detector(s))",
                anomaly.getSeverity().key(), anomaly.getMetric(), Math.abs(anomaly.getMagnitudePct()),
                anomaly.getDirection().key(), anomaly.getConfidence(),
                anomaly.getContributingDetectors().size()));
    }

    @Override
    public String toString() {
        return "AnomalyCondition{minSeverity=" + minSeverity
                + ", minConfidence=" + minConfidence
                + ", minMagnitudePct=" + minMagnitudePct
                + ", directions=" + directions
                + ", minDetectors=" + minDetectors + '}';
    }
}
