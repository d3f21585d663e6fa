package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectionSettings;
import com.metricsentinel.core.model.AnomalyCandidate;
import com.metricsentinel.core.model.DetectorKind;
import com.metricsentinel.core.model.Direction;
import com.metricsentinel.core.model.MetricPoint;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Z-score detector over a trailing baseline.
 *
 * <p>
 * For every tested point, the mean μ and (population) standard deviation σ of
 * the points in the preceding {@code baselineWindowDays} days are computed,
 * excluding the point itself. The point is a candidate when
 * {@code |value - μ| / σ} exceeds the metric's z threshold.
 * </p>
 *
 * <h3>Confidence</h3>
 * <p>
 * {@code min(|z| / confidenceCeiling, 1.0)}.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * No candidate is emitted while the baseline holds fewer than
 * {@code minBaselinePoints} points, or while σ is zero.
 * </p>
 *
 * @since 1.0.0
 */
public class StatisticalBaselineDetector implements AnomalyDetector {

    private static final Logger LOG = LoggerFactory.getLogger(StatisticalBaselineDetector.class);

    private final DetectionSettings settings;

    public StatisticalBaselineDetector(DetectionSettings settings) {
        this.settings = Objects.requireNonNull(settings, "DetectionSettings must not be null");
    }

    @Override
    public List<AnomalyCandidate> detect(List<MetricPoint> series, DetectionWindow window) {
        Objects.requireNonNull(series, "series must not be null");
        Objects.requireNonNull(window, "window must not be null");

        List<MetricPoint> points = SeriesMath.normalise(series);
        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (int i = 0; i < points.size(); i++) {
            MetricPoint point = points.get(i);
            if (!window.contains(point.getDate())) {
                continue;
            }
            double[] baseline = baselineBefore(points, i);
            if (baseline.length < settings.getMinBaselinePoints()) {
                LOG.trace("{}/{} {}: baseline of {} point(s) too small - skipping",
                        point.getEntityId(), point.getMetric(), point.getDate(), baseline.length);
                continue;
            }
            double mean = SeriesMath.mean(baseline);
            double stddev = SeriesMath.stdDev(baseline, mean);
            if (stddev == 0) {
                continue;
            }
            double z = (point.getValue() - mean) / stddev;
            double threshold = settings.zThresholdFor(point.getMetric());
            if (Math.abs(z) <= threshold) {
                continue;
            }
            double confidence = Math.min(Math.abs(z) / settings.getConfidenceCeiling(), 1.0);
            LOG.debug("Statistical candidate {}/{} {}: value={} mean={} stddev={} z={}",
                    point.getEntityId(), point.getMetric(), point.getDate(), point.getValue(), mean, stddev, z);
            candidates.add(AnomalyCandidate.builder()
                    .point(point)
                    .detector(DetectorKind.STATISTICAL)
                    .direction(Direction.of(point.getValue(), mean))
                    .rawScore(z)
                    .confidence(confidence)
                    .expectedValue(mean)
                    .build());
        }
        return candidates;
    }

    /**
     * Values dated in {@code [date - baselineWindowDays, date)} for the point at
     * {@code index}.
     */
    private double[] baselineBefore(List<MetricPoint> points, int index) {
        LocalDate date = points.get(index).getDate();
        LocalDate earliest = date.minusDays(settings.getBaselineWindowDays());
        List<Double> values = new ArrayList<>();
        for (int j = index - 1; j >= 0; j--) {
            LocalDate d = points.get(j).getDate();
            if (d.isBefore(earliest)) {
                break;
            }
            values.add(points.get(j).getValue());
        }
        return values.stream().mapToDouble(Double::doubleValue).toArray();
    }

    @Override
    public DetectorKind kind() {
        return DetectorKind.STATISTICAL;
    }
}
