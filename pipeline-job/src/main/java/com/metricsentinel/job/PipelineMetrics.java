package com.metricsentinel.job;

import com.metricsentinel.core.delivery.DeliveryListener;
import com.metricsentinel.core.model.Admission;
import com.metricsentinel.core.model.DeliveryAttempt;
import com.metricsentinel.core.model.NotificationJob;
import com.metricsentinel.core.pipeline.RunReport;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;

import java.util.Locale;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer meters of the pipeline, exported in Prometheus text format.
 *
 * <h3>Exposed metrics</h3>
 * <ul>
 * <li>{@code sentinel_runs_total}, {@code sentinel_run_duration_seconds}</li>
 * <li>{@code sentinel_anomalies_fused_total}, {@code sentinel_alerts_raised_total}</li>
 * <li>{@code sentinel_admissions_total{admission}}</li>
 * <li>{@code sentinel_delivery_attempts_total{channel,outcome}},
 * {@code sentinel_delivery_latency_seconds{channel}}</li>
 * <li>{@code sentinel_jobs_dead_total}, gauge {@code sentinel_jobs_pending}</li>
 * </ul>
 */
public class PipelineMetrics implements DeliveryListener {

    private final PrometheusMeterRegistry registry;
    private final Counter runs;
    private final Timer runDuration;
    private final Counter anomaliesFused;
    private final Counter alertsRaised;
    private final Counter jobsDead;

    public PipelineMetrics() {
        this(new PrometheusMeterRegistry(PrometheusConfig.DEFAULT));
    }

    PipelineMetrics(PrometheusMeterRegistry registry) {
        this.registry = registry;
        this.runs = registry.counter("sentinel.runs");
        this.runDuration = Timer.builder("sentinel.run.duration").register(registry);
        this.anomaliesFused = registry.counter("sentinel.anomalies.fused");
        this.alertsRaised = registry.counter("sentinel.alerts.raised");
        this.jobsDead = registry.counter("sentinel.jobs.dead");
    }

    public void bindPendingJobs(Supplier<Number> pending) {
        Gauge.builder("sentinel.jobs.pending", pending, s -> s.get().doubleValue())
                .strongReference(true)
                .register(registry);
    }

    public void recordRun(RunReport report) {
        runs.increment();
        runDuration.record(report.duration());
        anomaliesFused.increment(report.getAnomalies());
        alertsRaised.increment(report.getAlertsRaised());
        for (Admission admission : Admission.values()) {
            int n = report.admitted(admission);
            if (n > 0) {
                registry.counter("sentinel.admissions", "admission", admission.name().toLowerCase(Locale.ROOT)).increment(n);
            }
        }
    }

    // ---------------------------------------------------------------
    // DeliveryListener
    // ---------------------------------------------------------------

    @Override
    public void onAttempt(NotificationJob job, DeliveryAttempt attempt, long elapsedMillis) {
        registry.counter("sentinel.delivery.attempts",
                "channel", job.getChannel(),
                "outcome", attempt.getOutcome().name().toLowerCase(Locale.ROOT)).increment();
        Timer.builder("sentinel.delivery.latency")
                .tag("channel", job.getChannel())
                .register(registry)
                .record(elapsedMillis, TimeUnit.MILLISECONDS);
    }

    @Override
    public void onDead(NotificationJob job) {
        jobsDead.increment();
    }

    public String scrape() {
        return registry.scrape();
    }

    MeterRegistry registry() {
        return registry;
    }
}
