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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link OutlierClassifierDetector} with the Mahalanobis
 * scorer.
 */
class OutlierClassifierDetectorTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    private DetectionSettings settings;
    private OutlierClassifierDetector detector;

    @BeforeEach
    void setUp() {
        settings = new DetectionSettings();
        detector = new OutlierClassifierDetector(settings, new MahalanobisOutlierScorer());
    }

    @Test
    @DisplayName("Should flag an extreme value after a stable history")
    void shouldFlagExtremeValue() {
        List<MetricPoint> series = weeklyHistory(40);
        LocalDate day = START.plusDays(40);
        series.add(MetricPoint.of("example.com", "clicks", day, 500));

        List<AnomalyCandidate> candidates = detector.detect(series, DetectionWindow.single(day));

        assertThat(candidates).hasSize(1);
        AnomalyCandidate c = candidates.get(0);
        assertThat(c.getDetector()).isEqualTo(DetectorKind.OUTLIER);
        assertThat(c.getDirection()).isEqualTo(Direction.ABOVE);
        assertThat(c.getConfidence()).isBetween(0.95, 1.0);
    }

    @Test
    @DisplayName("Should NOT flag a value repeating the weekly pattern")
    void shouldNotFlagTypicalValue() {
        List<MetricPoint> series = weeklyHistory(40);
        LocalDate day = START.plusDays(40);
        series.add(MetricPoint.of("example.com", "clicks", day, weeklyValue(40)));

        assertThat(detector.detect(series, DetectionWindow.single(day))).isEmpty();
    }

    @Test
    @DisplayName("Should return nothing with fewer history points than required")
    void shouldSkipShortHistory() {
        List<MetricPoint> series = weeklyHistory(5);
        LocalDate day = START.plusDays(5);
        series.add(MetricPoint.of("example.com", "clicks", day, 500));

        assertThat(detector.detect(series, DetectionWindow.single(day))).isEmpty();
    }

    @Test
    @DisplayName("Should return nothing when the scorer cannot fit a model")
    void shouldContainScorerFailure() {
        OutlierClassifierDetector failing = new OutlierClassifierDetector(settings, training -> {
            throw new IllegalArgumentException("singular");
        });
        List<MetricPoint> series = weeklyHistory(40);
        LocalDate day = START.plusDays(40);
        series.add(MetricPoint.of("example.com", "clicks", day, 500));

        assertThat(failing.detect(series, DetectionWindow.single(day))).isEmpty();
    }

    @Test
    @DisplayName("Should build value, trend and weekday features from past points only")
    void shouldBuildFeatures() {
        List<MetricPoint> series = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            series.add(MetricPoint.of("example.com", "clicks", START.plusDays(i), 10 * i));
        }

        double[] features = detector.features(series, 7);

        assertThat(features[0]).isEqualTo(70.0);
        assertThat(features[1]).isCloseTo(10.0, within(1e-9));
        assertThat(features[2]).isEqualTo(70.0);
    }

    /** Same value every week, so later weeks repeat earlier feature vectors exactly. */
    private static List<MetricPoint> weeklyHistory(int days) {
        List<MetricPoint> series = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            series.add(MetricPoint.of("example.com", "clicks", START.plusDays(i), weeklyValue(i)));
        }
        return series;
    }

    private static double weeklyValue(int day) {
        return 94 + 2 * (day % 7);
    }
}
