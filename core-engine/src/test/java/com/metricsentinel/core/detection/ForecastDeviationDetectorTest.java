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
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link ForecastDeviationDetector} and
 * {@link HoltWintersForecaster}.
 */
class ForecastDeviationDetectorTest {

    private static final LocalDate START = LocalDate.of(2024, 2, 5);

    private HoltWintersForecaster forecaster;
    private ForecastDeviationDetector detector;

    @BeforeEach
    void setUp() {
        forecaster = new HoltWintersForecaster(new DetectionSettings());
        detector = new ForecastDeviationDetector(forecaster);
    }

    @Test
    @DisplayName("Should forecast the next value of a purely weekly series exactly")
    void shouldForecastWeeklySeries() {
        double[] history = new double[28];
        for (int i = 0; i < history.length; i++) {
            history[i] = weekly(i);
        }

        Optional<Forecast> forecast = forecaster.forecast(history, 1);

        assertThat(forecast).isPresent();
        assertThat(forecast.get().getPredicted()).isCloseTo(weekly(28), within(1e-9));
        assertThat(forecast.get().width()).isCloseTo(0.0, within(1e-9));
    }

    @Test
    @DisplayName("Should decline to forecast with less than two seasons of history")
    void shouldRequireTwoSeasons() {
        assertThat(forecaster.forecast(new double[13], 1)).isEmpty();
    }

    @Test
    @DisplayName("Should flag a value outside the forecast band")
    void shouldFlagValueOutsideBand() {
        List<MetricPoint> series = weeklySeries(28);
        LocalDate day = START.plusDays(28);
        series.add(MetricPoint.of("/blog", "clicks", day, 40));

        List<AnomalyCandidate> candidates = detector.detect(series, DetectionWindow.single(day));

        assertThat(candidates).hasSize(1);
        AnomalyCandidate c = candidates.get(0);
        assertThat(c.getDetector()).isEqualTo(DetectorKind.FORECAST);
        assertThat(c.getDirection()).isEqualTo(Direction.BELOW);
        assertThat(c.getConfidence()).isEqualTo(1.0);
        assertThat(c.getExpectedValue()).isCloseTo(weekly(28), within(1e-9));
    }

    @Test
    @DisplayName("Should NOT flag a value on the forecast")
    void shouldNotFlagForecastValue() {
        List<MetricPoint> series = new ArrayList<>();
        double[] history = new double[28];
        for (int i = 0; i < history.length; i++) {
            history[i] = weekly(i) + ((i * 3) % 5) - 2;
            series.add(MetricPoint.of("/blog", "clicks", START.plusDays(i), history[i]));
        }
        Forecast expected = forecaster.forecast(history, 1).orElseThrow();
        LocalDate day = START.plusDays(28);
        series.add(MetricPoint.of("/blog", "clicks", day, expected.getPredicted()));

        assertThat(expected.width()).isPositive();
        assertThat(detector.detect(series, DetectionWindow.single(day))).isEmpty();
    }

    @Test
    @DisplayName("Should forward-fill missing days before forecasting")
    void shouldForwardFillGaps() {
        List<MetricPoint> points = List.of(
                MetricPoint.of("/blog", "clicks", START, 10),
                MetricPoint.of("/blog", "clicks", START.plusDays(3), 40),
                MetricPoint.of("/blog", "clicks", START.plusDays(4), 50));

        double[] history = ForecastDeviationDetector.dailyHistory(points, 2);

        assertThat(history).containsExactly(10, 10, 10, 40);
    }

    @Test
    @DisplayName("Should restart the history after a gap longer than a week")
    void shouldRestartHistoryAfterLongGap() {
        List<MetricPoint> points = List.of(
                MetricPoint.of("/blog", "clicks", START, 10),
                MetricPoint.of("/blog", "clicks", START.plusDays(9), 70),
                MetricPoint.of("/blog", "clicks", START.plusDays(11), 90),
                MetricPoint.of("/blog", "clicks", START.plusDays(12), 95));

        double[] history = ForecastDeviationDetector.dailyHistory(points, 3);

        assertThat(history).containsExactly(70, 70, 90);
    }

    @Test
    @DisplayName("Should not score a point whose history was cut short by a long gap")
    void shouldSkipPointAfterLongGap() {
        List<MetricPoint> series = weeklySeries(28);
        LocalDate day = START.plusDays(40);
        series.add(MetricPoint.of("/blog", "clicks", day, 5));

        assertThat(detector.detect(series, DetectionWindow.single(day))).isEmpty();
    }

    private static double weekly(int day) {
        return 100 + 10 * (day % 7);
    }

    private static List<MetricPoint> weeklySeries(int days) {
        List<MetricPoint> series = new ArrayList<>();
        for (int i = 0; i < days; i++) {
            series.add(MetricPoint.of("/blog", "clicks", START.plusDays(i), weekly(i)));
        }
        return series;
    }
}
