package com.metricsentinel.core.fusion;

import com.metricsentinel.core.config.DetectionSettings;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyStatus;
import com.metricsentinel.core.model.MetricPoint;
import com.metricsentinel.core.model.SeriesKey;
import com.metricsentinel.core.store.AnomalyRepository;
import com.metricsentinel.core.store.MetricSeriesReader;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Closes anomalies that are no longer relevant.
 *
 * <p>
 * An active anomaly older than the retention horizon is resolved when its
 * metric is back within the baseline (the latest value lies within the z
 * threshold of the trailing mean before the anomaly), when the metric has no
 * data since the horizon, or when no baseline can be computed.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyResolver {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyResolver.class);

    private final AnomalyRepository repository;
    private final MetricSeriesReader reader;
    private final DetectionSettings detection;
    private final int retentionDays;
    private final Clock clock;

    public AnomalyResolver(AnomalyRepository repository, MetricSeriesReader reader, DetectionSettings detection,
            int retentionDays, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.reader = Objects.requireNonNull(reader, "reader must not be null");
        this.detection = Objects.requireNonNull(detection, "detection settings must not be null");
        if (retentionDays < 1) {
            throw new IllegalArgumentException("retentionDays must be >= 1, got " + retentionDays);
        }
        this.retentionDays = retentionDays;
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @param today the run date
     * @return anomalies resolved by this call
     */
    public List<Anomaly> resolveStale(LocalDate today) {
        Objects.requireNonNull(today, "today must not be null");
        LocalDate horizon = today.minusDays(retentionDays);
        List<Anomaly> resolved = new ArrayList<>();
        for (Anomaly anomaly : repository.findAll()) {
            if (!anomaly.getStatus().isActive() || !anomaly.getDate().isBefore(horizon)) {
                continue;
            }
            if (!isBackToNormal(anomaly, horizon, today)) {
                continue;
            }
            resolve(anomaly.getId()).ifPresent(resolved::add);
        }
        if (!resolved.isEmpty()) {
            LOG.info("Resolved {} stale anomalies older than {}", resolved.size(), horizon);
        }
        return resolved;
    }

    /**
     * Resolve an anomaly regardless of its age or data.
     *
     * @return the resolved anomaly, or empty if unknown or already resolved
     */
    public Optional<Anomaly> forceResolve(String anomalyId) {
        Optional<Anomaly> result = resolve(anomalyId);
        result.ifPresent(a -> LOG.info("Anomaly {} force-resolved", a.getId()));
        return result;
    }

    private Optional<Anomaly> resolve(String anomalyId) {
        Objects.requireNonNull(anomalyId, "anomalyId must not be null");
        boolean[] changed = new boolean[1];
        Anomaly stored = repository.compute(anomalyId, existing -> {
            if (existing == null || existing.getStatus() == AnomalyStatus.RESOLVED) {
                return existing;
            }
            existing.setStatus(AnomalyStatus.RESOLVED);
            existing.setResolvedAt(clock.instant());
            existing.setUpdatedAt(clock.instant());
            changed[0] = true;
            return existing;
        });
        return changed[0] ? Optional.of(stored) : Optional.empty();
    }

    private boolean isBackToNormal(Anomaly anomaly, LocalDate horizon, LocalDate today) {
        SeriesKey key = anomaly.seriesKey();
        List<MetricPoint> recent = reader.readSeries(key, horizon, today);
        if (recent.isEmpty()) {
            return true;
        }
        List<MetricPoint> baseline = reader.readSeries(key,
                anomaly.getDate().minusDays(detection.getBaselineWindowDays()), anomaly.getDate().minusDays(1));
        if (baseline.size() < detection.getMinBaselinePoints()) {
            return true;
        }
        double mean = baseline.stream().mapToDouble(MetricPoint::getValue).average().orElse(0.0);
        double variance = baseline.stream()
                .mapToDouble(p -> (p.getValue() - mean) * (p.getValue() - mean))
                .average()
                .orElse(0.0);
        double stddev = Math.sqrt(variance);
        double latest = recent.get(recent.size() - 1).getValue();
        return Math.abs(latest - mean) <= detection.zThresholdFor(anomaly.getMetric()) * stddev;
    }
}
