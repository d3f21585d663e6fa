package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectionSettings;
import com.metricsentinel.core.model.AnomalyCandidate;
import com.metricsentinel.core.model.DetectorKind;
import com.metricsentinel.core.model.Direction;
import com.metricsentinel.core.model.MetricPoint;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link StatisticalBaselineDetector}.
 */
class StatisticalBaselineDetectorTest {

    private static final LocalDate START = LocalDate.of(2024, 3, 1);

    private DetectionSettings settings;
    private StatisticalBaselineDetector detector;

    @BeforeEach
    void setUp() {
        settings = new DetectionSettings();
        settings.setMetricThresholds(Map.of("clicks", 3.0));
        detector = new StatisticalBaselineDetector(settings);
    }

    @Test
    @DisplayName("Should score z = 3.5 against a 100 ± 10 baseline with confidence 0.7")
    void shouldScoreSpikeAgainstBaseline() {
        List<MetricPoint> series = alternating(28, 90, 110);
        LocalDate day = START.plusDays(28);
        series.add(MetricPoint.of("/pricing", "clicks", day, 135));

        List<AnomalyCandidate> candidates = detector.detect(series, DetectionWindow.single(day));

        assertThat(candidates).hasSize(1);
        AnomalyCandidate c = candidates.get(0);
        assertThat(c.getDetector()).isEqualTo(DetectorKind.STATISTICAL);
        assertThat(c.getDirection()).isEqualTo(Direction.ABOVE);
        assertThat(c.getRawScore()).isCloseTo(3.5, within(1e-9));
        assertThat(c.getConfidence()).isCloseTo(0.7, within(1e-9));
        assertThat(c.getExpectedValue()).isCloseTo(100.0, within(1e-9));
    }

    @Test
    @DisplayName("Should NOT fire when |z| stays within the metric threshold")
    void shouldNotFireWithinThreshold() {
        List<MetricPoint> series = alternating(28, 90, 110);
        LocalDate day = START.plusDays(28);
        series.add(MetricPoint.of("/pricing", "clicks", day, 125));

        assertThat(detector.detect(series, DetectionWindow.single(day))).isEmpty();
    }

    @Test
    @DisplayName("Should fall back to the default threshold for unlisted metrics")
    void shouldUseDefaultThreshold() {
        List<MetricPoint> series = new ArrayList<>();
        for (int i = 0; i < 28; i++) {
            series.add(MetricPoint.of("/pricing", "impressions", START.plusDays(i), i % 2 == 0 ? 90 : 110));
        }
        LocalDate day = START.plusDays(28);
        series.add(MetricPoint.of("/pricing", "impressions", day, 72));

        List<AnomalyCandidate> candidates = detector.detect(series, DetectionWindow.single(day));

        assertThat(candidates).hasSize(1);
        assertThat(candidates.get(0).getDirection()).isEqualTo(Direction.BELOW);
        assertThat(candidates.get(0).getRawScore()).isCloseTo(-2.8, within(1e-9));
    }

    @Test
    @DisplayName("Should return nothing when the baseline is too short")
    void shouldSkipShortBaseline() {
        List<MetricPoint> series = alternating(5, 90, 110);
        LocalDate day = START.plusDays(5);
        series.add(MetricPoint.of("/pricing", "clicks", day, 500));

        assertThat(detector.detect(series, DetectionWindow.single(day))).isEmpty();
    }

    @Test
    @DisplayName("Should return nothing when the baseline is flat")
    void shouldSkipFlatBaseline() {
        List<MetricPoint> series = alternating(28, 100, 100);
        LocalDate day = START.plusDays(28);
        series.add(MetricPoint.of("/pricing", "clicks", day, 500));

        assertThat(detector.detect(series, DetectionWindow.single(day))).isEmpty();
    }

    @Test
    @DisplayName("Should cap confidence at 1.0")
    void shouldCapConfidence() {
        List<MetricPoint> series = alternating(28, 90, 110);
        LocalDate day = START.plusDays(28);
        series.add(MetricPoint.of("/pricing", "clicks", day, 1_000));

        assertThat(detector.detect(series, DetectionWindow.single(day)))
                .singleElement()
                .extracting(AnomalyCandidate::getConfidence)
                .isEqualTo(1.0);
    }

    @Test
    @DisplayName("Should only score dates inside the window")
    void shouldIgnoreDatesOutsideWindow() {
        List<MetricPoint> series = alternating(28, 90, 110);
        series.add(MetricPoint.of("/pricing", "clicks", START.plusDays(28), 1_000));

        DetectionWindow earlier = DetectionWindow.single(START.plusDays(27));
        assertThat(detector.detect(series, earlier)).isEmpty();
    }

    // ------------------------------------------------------------------
    // Helper
    // ------------------------------------------------------------------

    static List<MetricPoint> alternating(int days, double even, double odd) {
        List<MetricPoint> series = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            series.add(MetricPoint.of("/pricing", "clicks", START.plusDays(i), i % 2 == 0 ? even : odd));
        }
        return series;
    }
}
