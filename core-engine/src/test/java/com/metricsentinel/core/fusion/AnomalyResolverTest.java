package com.metricsentinel.core.fusion;

import com.metricsentinel.core.config.DetectionSettings;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.AnomalyStatus;
import com.metricsentinel.core.model.Direction;
import com.metricsentinel.core.model.Fingerprints;
import com.metricsentinel.core.model.MetricPoint;
import com.metricsentinel.core.model.Severity;
import com.metricsentinel.core.store.InMemoryAnomalyRepository;
import com.metricsentinel.core.store.InMemoryMetricSeriesReader;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link AnomalyResolver}.
 */
class AnomalyResolverTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);
    private static final LocalDate ANOMALY_DAY = START.plusDays(28);
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-02-20T00:00:00Z"), ZoneOffset.UTC);

    private InMemoryAnomalyRepository repository;
    private InMemoryMetricSeriesReader reader;
    private AnomalyResolver resolver;
    private String anomalyId;

    @BeforeEach
    void setUp() {
        repository = new InMemoryAnomalyRepository();
        reader = new InMemoryMetricSeriesReader();
        resolver = new AnomalyResolver(repository, reader, new DetectionSettings(), 7, CLOCK);

        for (int i = 0; i < 28; i++) {
            reader.add(point(START.plusDays(i), i % 2 == 0 ? 90 : 110));
        }
        reader.add(point(ANOMALY_DAY, 200));

        anomalyId = Fingerprints.anomalyId("/pricing", "clicks", ANOMALY_DAY, Direction.ABOVE);
        repository.compute(anomalyId, existing -> Anomaly.builder()
                .id(anomalyId)
                .entityId("/pricing")
                .metric("clicks")
                .date(ANOMALY_DAY)
                .direction(Direction.ABOVE)
                .severity(Severity.MEDIUM)
                .confidence(0.6)
                .actualValue(200)
                .expectedValue(100.0)
                .detectedAt(CLOCK.instant())
                .build());
    }

    @Test
    @DisplayName("Should resolve an old anomaly once the metric is back to baseline")
    void shouldResolveWhenBackToNormal() {
        reader.add(point(ANOMALY_DAY.plusDays(10), 104));

        List<Anomaly> resolved = resolver.resolveStale(ANOMALY_DAY.plusDays(10));

        assertThat(resolved).extracting(Anomaly::getId).containsExactly(anomalyId);
        Anomaly stored = repository.findById(anomalyId).orElseThrow();
        assertThat(stored.getStatus()).isEqualTo(AnomalyStatus.RESOLVED);
        assertThat(stored.getResolvedAt()).isEqualTo(CLOCK.instant());
    }

    @Test
    @DisplayName("Should keep an old anomaly open while the metric is still anomalous")
    void shouldKeepWhileStillAnomalous() {
        reader.add(point(ANOMALY_DAY.plusDays(10), 220));

        assertThat(resolver.resolveStale(ANOMALY_DAY.plusDays(10))).isEmpty();
        assertThat(repository.findById(anomalyId).orElseThrow().getStatus()).isEqualTo(AnomalyStatus.NEW);
    }

    @Test
    @DisplayName("Should keep anomalies younger than the retention window")
    void shouldKeepRecentAnomalies() {
        reader.add(point(ANOMALY_DAY.plusDays(3), 100));

        assertThat(resolver.resolveStale(ANOMALY_DAY.plusDays(3))).isEmpty();
    }

    @Test
    @DisplayName("Should force-resolve once and report unknown or resolved ids as empty")
    void shouldForceResolve() {
        Optional<Anomaly> first = resolver.forceResolve(anomalyId);
        Optional<Anomaly> second = resolver.forceResolve(anomalyId);

        assertThat(first).isPresent();
        assertThat(first.get().getStatus()).isEqualTo(AnomalyStatus.RESOLVED);
        assertThat(second).isEmpty();
        assertThat(resolver.forceResolve("missing")).isEmpty();
    }

    private static MetricPoint point(LocalDate date, double value) {
        return MetricPoint.of("/pricing", "clicks", date, value);
    }
}
