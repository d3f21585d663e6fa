package com.metricsentinel.core.pipeline;

import com.metricsentinel.core.config.AlertRule;
import com.metricsentinel.core.detection.AnomalyDetector;
import com.metricsentinel.core.detection.DetectionWindow;
import com.metricsentinel.core.fusion.AnomalyResolver;
import com.metricsentinel.core.fusion.FusionEngine;
import com.metricsentinel.core.model.Admission;
import com.metricsentinel.core.model.Alert;
import com.metricsentinel.core.model.AlertStatus;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyCandidate;
import com.metricsentinel.core.model.AnomalyStatus;
import com.metricsentinel.core.model.MetricPoint;
import com.metricsentinel.core.model.SeriesKey;
import com.metricsentinel.core.rules.AnomalyTrigger;
import com.metricsentinel.core.rules.MetricTrigger;
import com.metricsentinel.core.rules.RuleEngine;
import com.metricsentinel.core.rules.Trigger;
import com.metricsentinel.core.store.AlertRepository;
import com.metricsentinel.core.store.AnomalyRepository;
import com.metricsentinel.core.store.MetricSeriesReader;
import com.metricsentinel.core.suppression.AdmissionResult;
import com.metricsentinel.core.suppression.SuppressionManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;

/**
 * One end-to-end pass over the metric store.
 *
 * <h3>Stages</h3>
 * <ol>
 * <li><b>detect</b> - every series is read and scored by all detectors on the
 * executor; a failing series or detector is logged and skipped</li>
 * <li><b>fuse</b> - candidates are merged into canonical anomalies</li>
 * <li><b>resolve</b> - stale anomalies whose metric is back to normal are
 * closed</li>
 * <li><b>alert</b> - rules are evaluated against each active anomaly and each
 * raw series; new alerts go through suppression, which enqueues
 * notifications</li>
 * <li><b>flush</b> - expired dedup windows release their digests</li>
 * </ol>
 *
 * <p>
 * The {@link CancellationToken} is checked between stages and between series
 * results; a cancelled run returns a report flagged as cancelled. Re-running
 * the same window is idempotent: anomalies are upserted and alerts whose
 * deterministic id already exists are not admitted twice.
 * </p>
 *
 * <p>
 * Storage errors while listing series, fusing or saving alerts propagate and
 * abort the run.
 * </p>
 *
 * @since 1.0.0
 */
public class AnomalyPipeline {

    private static final Logger LOG = LoggerFactory.getLogger(AnomalyPipeline.class);

    private final MetricSeriesReader reader;
    private final List<AnomalyDetector> detectors;
    private final FusionEngine fusion;
    private final AnomalyResolver resolver;
    private final RuleEngine ruleEngine;
    private final SuppressionManager suppression;
    private final AnomalyRepository anomalies;
    private final AlertRepository alerts;
    private final ExecutorService executor;
    private final int lookbackDays;
    private final Clock clock;

    private AnomalyPipeline(Builder b) {
        this.reader = Objects.requireNonNull(b.reader, "reader must not be null");
        this.detectors = List.copyOf(Objects.requireNonNull(b.detectors, "detectors must not be null"));
        this.fusion = Objects.requireNonNull(b.fusion, "fusion must not be null");
        this.resolver = Objects.requireNonNull(b.resolver, "resolver must not be null");
        this.ruleEngine = Objects.requireNonNull(b.ruleEngine, "ruleEngine must not be null");
        this.suppression = Objects.requireNonNull(b.suppression, "suppression must not be null");
        this.anomalies = Objects.requireNonNull(b.anomalies, "anomalies must not be null");
        this.alerts = Objects.requireNonNull(b.alerts, "alerts must not be null");
        this.executor = Objects.requireNonNull(b.executor, "executor must not be null");
        if (b.lookbackDays < 1) {
            throw new IllegalArgumentException("lookbackDays must be >= 1, got " + b.lookbackDays);
        }
        this.lookbackDays = b.lookbackDays;
        this.clock = Objects.requireNonNull(b.clock, "clock must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    // ---------------------------------------------------------------
    // Run
    // ---------------------------------------------------------------

    /**
     * Run the pipeline for the dates in {@code window}.
     *
     * @param window dates to score
     * @param token  cancellation flag, checked between stages
     * @return counters of the run
     */
    public RunReport run(DetectionWindow window, CancellationToken token) {
        Objects.requireNonNull(window, "window must not be null");
        Objects.requireNonNull(token, "token must not be null");
        RunReport.Builder report = RunReport.builder(clock.instant());
        LOG.info("Pipeline run started for {}", window);
        try {
            token.throwIfCancelled("detect");
            List<SeriesResult> detected = detect(window, token, report);

            token.throwIfCancelled("fuse");
            List<AnomalyCandidate> candidates = new ArrayList<>();
            detected.forEach(r -> candidates.addAll(r.candidates));
            List<Anomaly> fused = fusion.fuse(candidates);
            report.candidates(candidates.size()).anomalies(fused.size());

            token.throwIfCancelled("resolve");
            report.resolved(resolver.resolveStale(window.getTo()).size());

            token.throwIfCancelled("alert");
            for (Anomaly anomaly : fused) {
                if (anomaly.getStatus().isActive()) {
                    raise(new AnomalyTrigger(anomaly), report);
                }
            }
            for (SeriesResult r : detected) {
                if (!r.points.isEmpty() && window.contains(r.points.get(r.points.size() - 1).getDate())) {
                    raise(new MetricTrigger(r.key.getEntityId(), r.key.getMetric(), r.points), report);
                }
            }

            token.throwIfCancelled("flush");
            report.jobsEnqueued(suppression.flushExpired(clock.instant()).size());
        } catch (CancellationException e) {
            LOG.warn("{}", e.getMessage());
            report.cancelledAt(e.getMessage());
        }
        RunReport result = report.build(clock.instant());
        LOG.info("Pipeline run finished: {}", result);
        return result;
    }

    public RunReport run(DetectionWindow window) {
        return run(window, CancellationToken.none());
    }

    // ---------------------------------------------------------------
    // Detection
    // ---------------------------------------------------------------

    private List<SeriesResult> detect(DetectionWindow window, CancellationToken token, RunReport.Builder report) {
        List<SeriesKey> keys = reader.listSeries();
        LocalDate from = window.getFrom().minusDays(lookbackDays);
        List<Future<SeriesResult>> futures = new ArrayList<>(keys.size());
        for (SeriesKey key : keys) {
            futures.add(executor.submit(() -> scoreSeries(key, from, window)));
        }

        List<SeriesResult> results = new ArrayList<>(keys.size());
        int failed = 0;
        try {
            for (int i = 0; i < futures.size(); i++) {
                if (token.isCancelled()) {
                    futures.forEach(f -> f.cancel(true));
                    token.throwIfCancelled("fuse (detection interrupted)");
                }
                try {
                    results.add(futures.get(i).get());
                } catch (ExecutionException e) {
                    failed++;
                    LOG.warn("Detection failed for series {}: {}", keys.get(i), e.getCause().toString(), e.getCause());
                }
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new CancellationException("Run interrupted during detection");
        }
        report.seriesScanned(keys.size()).seriesFailed(failed);
        return results;
    }

    private SeriesResult scoreSeries(SeriesKey key, LocalDate from, DetectionWindow window) {
        List<MetricPoint> points = reader.readSeries(key, from, window.getTo());
        List<AnomalyCandidate> candidates = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            try {
                candidates.addAll(detector.detect(points, window));
            } catch (RuntimeException e) {
                LOG.warn("Detector {} failed on {}; skipping", detector.kind().key(), key, e);
            }
        }
        if (!candidates.isEmpty()) {
            LOG.debug("Series {}: {} candidate(s)", key, candidates.size());
        }
        return new SeriesResult(key, points, candidates);
    }

    // ---------------------------------------------------------------
    // Alerting
    // ---------------------------------------------------------------

    private void raise(Trigger trigger, RunReport.Builder report) {
        for (Alert alert : ruleEngine.evaluate(trigger)) {
            if (alerts.saveIfAbsent(alert)) {
                report.alertRaised();
            } else if (awaitsAdmission(alert.getId())) {
                LOG.info("Alert {} is still OPEN from an earlier run - retrying admission", alert.getId());
            } else {
                LOG.trace("Alert {} already raised - skipping", alert.getId());
                continue;
            }
            Optional<AlertRule> rule = ruleEngine.rule(alert.getRuleId());
            if (rule.isEmpty()) {
                LOG.error("Alert {} refers to unknown rule '{}'", alert.getId(), alert.getRuleId());
                continue;
            }
            try {
                AdmissionResult admitted = suppression.admit(alert, rule.get());
                report.admitted(admitted.getAdmission()).jobsEnqueued(admitted.getEnqueuedJobs().size());
                alerts.updateStatus(alert.getId(), alertStatusFor(admitted.getAdmission()));
                if (alert.getAnomalyId() != null) {
                    markAnomaly(alert.getAnomalyId(), admitted.getAdmission());
                }
            } catch (RuntimeException e) {
                LOG.error("Admission failed for alert {}; left OPEN for the next run", alert.getId(), e);
            }
        }
    }

    /**
     * An alert stays OPEN only until suppression has decided on it; a stored
     * OPEN alert therefore lost its admission to a failure.
     */
    private boolean awaitsAdmission(String alertId) {
        return alerts.findById(alertId)
                .map(stored -> stored.getStatus() == AlertStatus.OPEN)
                .orElse(false);
    }

    private static AlertStatus alertStatusFor(Admission admission) {
        return switch (admission) {
            case NEW -> AlertStatus.NOTIFIED;
            case AGGREGATED -> AlertStatus.AGGREGATED;
            case SUPPRESSED -> AlertStatus.SUPPRESSED;
        };
    }

    private void markAnomaly(String anomalyId, Admission admission) {
        Instant now = clock.instant();
        anomalies.compute(anomalyId, existing -> {
            if (existing == null || !existing.getStatus().isActive()) {
                return existing;
            }
            if (admission != Admission.SUPPRESSED) {
                existing.setStatus(AnomalyStatus.ALERTED);
            } else if (existing.getStatus() == AnomalyStatus.NEW) {
                existing.setStatus(AnomalyStatus.SUPPRESSED);
            }
            existing.setUpdatedAt(now);
            return existing;
        });
    }

    private static final class SeriesResult {
        final SeriesKey key;
        final List<MetricPoint> points;
        final List<AnomalyCandidate> candidates;

        SeriesResult(SeriesKey key, List<MetricPoint> points, List<AnomalyCandidate> candidates) {
            this.key = key;
            this.points = points;
            this.candidates = candidates;
        }
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    public static class Builder {
        private MetricSeriesReader reader;
        private List<AnomalyDetector> detectors;
        private FusionEngine fusion;
        private AnomalyResolver resolver;
        private RuleEngine ruleEngine;
        private SuppressionManager suppression;
        private AnomalyRepository anomalies;
        private AlertRepository alerts;
        private ExecutorService executor;
        private int lookbackDays = 90;
        private Clock clock = Clock.systemUTC();

        private Builder() {
        }

        public Builder reader(MetricSeriesReader reader) {
            this.reader = reader;
            return this;
        }

        public Builder detectors(List<AnomalyDetector> detectors) {
            this.detectors = detectors;
            return this;
        }

        public Builder fusion(FusionEngine fusion) {
            this.fusion = fusion;
            return this;
        }

        public Builder resolver(AnomalyResolver resolver) {
            this.resolver = resolver;
            return this;
        }

        public Builder ruleEngine(RuleEngine ruleEngine) {
            this.ruleEngine = ruleEngine;
            return this;
        }

        public Builder suppression(SuppressionManager suppression) {
            this.suppression = suppression;
            return this;
        }

        public Builder anomalies(AnomalyRepository anomalies) {
            this.anomalies = anomalies;
            return this;
        }

        public Builder alerts(AlertRepository alerts) {
            this.alerts = alerts;
            return this;
        }

        public Builder executor(ExecutorService executor) {
            this.executor = executor;
            return this;
        }

        /**
         * @param lookbackDays days of history read before the window start
         */
        public Builder lookbackDays(int lookbackDays) {
            this.lookbackDays = lookbackDays;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public AnomalyPipeline build() {
            return new AnomalyPipeline(this);
        }
    }
}
