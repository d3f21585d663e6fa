package com.metricsentinel.core.pipeline;

import com.metricsentinel.core.model.Admission;

import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Counters describing one pipeline run.
 *
 * @since 1.0.0
 */
public final class RunReport {

    private final Instant startedAt;
    private final Instant finishedAt;
    private final int seriesScanned;
    private final int seriesFailed;
    private final int candidates;
    private final int anomalies;
    private final int resolved;
    private final int alertsRaised;
    private final Map<Admission, Integer> admissions;
    private final int jobsEnqueued;
    private final String cancelledAt;

    private RunReport(Builder b) {
        this.startedAt = b.startedAt;
        this.finishedAt = b.finishedAt;
        this.seriesScanned = b.seriesScanned;
        this.seriesFailed = b.seriesFailed;
        this.candidates = b.candidates;
        this.anomalies = b.anomalies;
        this.resolved = b.resolved;
        this.alertsRaised = b.alertsRaised;
        this.admissions = Collections.unmodifiableMap(new EnumMap<>(b.admissions));
        this.jobsEnqueued = b.jobsEnqueued;
        this.cancelledAt = b.cancelledAt;
    }

    static Builder builder(Instant startedAt) {
        return new Builder(startedAt);
    }

    static final class Builder {
        private final Instant startedAt;
        private Instant finishedAt;
        private int seriesScanned;
        private int seriesFailed;
        private int candidates;
        private int anomalies;
        private int resolved;
        private int alertsRaised;
        private final Map<Admission, Integer> admissions = new EnumMap<>(Admission.class);
        private int jobsEnqueued;
        private String cancelledAt;

        private Builder(Instant startedAt) {
            this.startedAt = startedAt;
        }

        Builder seriesScanned(int n) {
            this.seriesScanned = n;
            return this;
        }

        Builder seriesFailed(int n) {
            this.seriesFailed = n;
            return this;
        }

        Builder candidates(int n) {
            this.candidates = n;
            return this;
        }

        Builder anomalies(int n) {
            this.anomalies = n;
            return this;
        }

        Builder resolved(int n) {
            this.resolved = n;
            return this;
        }

        Builder alertRaised() {
            this.alertsRaised++;
            return this;
        }

        Builder admitted(Admission admission) {
            admissions.merge(admission, 1, Integer::sum);
            return this;
        }

        Builder jobsEnqueued(int n) {
            this.jobsEnqueued += n;
            return this;
        }

        Builder cancelledAt(String stage) {
            this.cancelledAt = stage;
            return this;
        }

        RunReport build(Instant finishedAt) {
            this.finishedAt = finishedAt;
            return new RunReport(this);
        }
    }

    public Instant getStartedAt() {
        return startedAt;
    }

    public Instant getFinishedAt() {
        return finishedAt;
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    public int getSeriesScanned() {
        return seriesScanned;
    }

    public int getSeriesFailed() {
        return seriesFailed;
    }

    public int getCandidates() {
        return candidates;
    }

    public int getAnomalies() {
        return anomalies;
    }

    public int getResolved() {
        return resolved;
    }

    public int getAlertsRaised() {
        return alertsRaised;
    }

    public int admitted(Admission admission) {
        return admissions.getOrDefault(admission, 0);
    }

    public int getJobsEnqueued() {
        return jobsEnqueued;
    }

    public boolean isCancelled() {
        return cancelledAt != null;
    }

    /**
     * @return description of the point the run was cancelled at, or
     *         {@code null} if it completed
     */
    public String getCancelledAt() {
        return cancelledAt;
    }

    @Override
    public String toString() {
        return "RunReport{" +
                "series=" + seriesScanned +
                ", seriesFailed=" + seriesFailed +
                ", candidates=" + candidates +
                ", anomalies=" + anomalies +
                ", resolved=" + resolved +
                ", alerts=" + alertsRaised +
                ", admissions=" + admissions +
                ", jobs=" + jobsEnqueued +
                (cancelledAt != null ? ", cancelled=" + cancelledAt : "") +
                '}';
    }
}
