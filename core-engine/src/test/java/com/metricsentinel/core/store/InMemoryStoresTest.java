package com.metricsentinel.core.store;

import com.metricsentinel.core.model.Alert;
import com.metricsentinel.core.model.AlertStatus;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.Direction;
import com.metricsentinel.core.model.MetricPoint;
import com.metricsentinel.core.model.SeriesKey;
import com.metricsentinel.core.model.Severity;
import com.metricsentinel.core.model.Suppression;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for the in-memory repositories.
 */
class InMemoryStoresTest {

    private static final Instant NOW = Instant.parse("2024-03-10T08:00:00Z");
    private static final LocalDate DAY = LocalDate.of(2024, 3, 9);

    @Test
    @DisplayName("Should store each alert id once and update its status")
    void shouldSaveAlertsOnce() {
        InMemoryAlertRepository alerts = new InMemoryAlertRepository();
        Alert alert = alert("a1", "/pricing");

        assertThat(alerts.saveIfAbsent(alert)).isTrue();
        assertThat(alerts.saveIfAbsent(alert("a1", "/other"))).isFalse();
        assertThat(alerts.findById("a1")).hasValueSatisfying(
                a -> assertThat(a.getEntityId()).isEqualTo("/pricing"));

        assertThat(alerts.updateStatus("a1", AlertStatus.NOTIFIED)).isPresent();
        assertThat(alerts.updateStatus("missing", AlertStatus.NOTIFIED)).isEmpty();
        assertThat(alerts.findByStatus(AlertStatus.NOTIFIED)).hasSize(1);
        assertThat(alerts.findByEntity("/pricing")).hasSize(1);
        assertThat(alerts.findByDateRange(DAY, DAY)).hasSize(1);
        assertThat(alerts.findByDateRange(DAY.plusDays(1), DAY.plusDays(2))).isEmpty();
    }

    @Test
    @DisplayName("Should compute anomalies atomically and refuse id changes")
    void shouldComputeAnomalies() {
        InMemoryAnomalyRepository anomalies = new InMemoryAnomalyRepository();
        Anomaly stored = anomalies.compute("x1", existing -> anomaly("x1"));

        assertThat(stored.getId()).isEqualTo("x1");
        assertThat(anomalies.findById("x1")).isPresent();
        assertThat(anomalies.findByEntity("/pricing")).hasSize(1);
        assertThat(anomalies.findAll()).hasSize(1);

        assertThatThrownBy(() -> anomalies.compute("x1", existing -> anomaly("x2")))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should hand out daily slots up to the cap per rule and day")
    void shouldCountDailySlots() {
        InMemorySuppressionRepository suppressions = new InMemorySuppressionRepository();

        assertThat(suppressions.tryAcquireDailySlot("r1", DAY, 2)).isTrue();
        assertThat(suppressions.tryAcquireDailySlot("r1", DAY, 2)).isTrue();
        assertThat(suppressions.tryAcquireDailySlot("r1", DAY, 2)).isFalse();
        assertThat(suppressions.tryAcquireDailySlot("r2", DAY, 2)).isTrue();
        assertThat(suppressions.tryAcquireDailySlot("r1", DAY.plusDays(1), 2)).isTrue();
    }

    @Test
    @DisplayName("Should evict counters of earlier days once a new day is counted")
    void shouldEvictOldDailyCounters() {
        InMemorySuppressionRepository suppressions = new InMemorySuppressionRepository();
        for (int i = 0; i < 30; i++) {
            suppressions.tryAcquireDailySlot("r1", DAY.plusDays(i), 5);
            suppressions.tryAcquireDailySlot("r2", DAY.plusDays(i), 5);
        }

        assertThat(suppressions.dailyCounterCount()).isEqualTo(2);
    }

    @Test
    @DisplayName("Should report windows whose end has passed as expired")
    void shouldFindExpiredWindows() {
        InMemorySuppressionRepository suppressions = new InMemorySuppressionRepository();
        suppressions.compute("k1", existing -> new Suppression("k1", "r1", NOW, NOW.plusSeconds(60)));
        suppressions.compute("k2", existing -> new Suppression("k2", "r1", NOW, NOW.plusSeconds(600)));

        assertThat(suppressions.findExpiredKeys(NOW.plusSeconds(60))).containsExactly("k1");
        assertThat(suppressions.find("k2")).isPresent();

        suppressions.compute("k1", existing -> null);
        assertThat(suppressions.find("k1")).isEmpty();
    }

    @Test
    @DisplayName("Should read a series by inclusive date range")
    void shouldReadSeriesRange() {
        InMemoryMetricSeriesReader reader = new InMemoryMetricSeriesReader();
        for (int i = 0; i < 10; i++) {
            reader.add(MetricPoint.of("/a", "clicks", DAY.minusDays(i), i));
        }
        reader.add(MetricPoint.of("/a", "clicks", DAY, 99.0));
        reader.add(MetricPoint.of("/b", "clicks", DAY, 1.0));

        assertThat(reader.listSeries()).containsExactly(SeriesKey.of("/a", "clicks"), SeriesKey.of("/b", "clicks"));
        assertThat(reader.readSeries(SeriesKey.of("/a", "clicks"), DAY.minusDays(2), DAY))
                .extracting(MetricPoint::getValue).containsExactly(2.0, 1.0, 99.0);
        assertThat(reader.readSeries(SeriesKey.of("/c", "clicks"), DAY, DAY)).isEmpty();
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static Alert alert(String id, String entity) {
        return Alert.builder()
                .id(id)
                .ruleId("r1")
                .entityId(entity)
                .metric("clicks")
                .date(DAY)
                .severity(Severity.LOW)
                .createdAt(NOW)
                .dedupKey("dk")
                .build();
    }

    private static Anomaly anomaly(String id) {
        return Anomaly.builder()
                .id(id)
                .entityId("/pricing")
                .metric("clicks")
                .date(DAY)
                .direction(Direction.BELOW)
                .severity(Severity.LOW)
                .confidence(0.3)
                .detectedAt(NOW)
                .build();
    }
}
