package com.metricsentinel.core.detection;

import com.metricsentinel.core.model.MetricPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

/**
 * Unit tests for {@link SeriesMath}.
 */
class SeriesMathTest {

    private static final LocalDate START = LocalDate.of(2024, 3, 4);

    @Test
    @DisplayName("Should measure slope per calendar day across missing days")
    void shouldMeasureSlopeAcrossGaps() {
        List<MetricPoint> points = List.of(
                point(0, 100),
                point(1, 102),
                point(4, 108),
                point(5, 110));

        assertThat(SeriesMath.slope(points)).isCloseTo(2.0, within(1e-9));
    }

    @Test
    @DisplayName("Should fit a noisy series by least squares")
    void shouldFitNoisySeries() {
        List<MetricPoint> points = List.of(
                point(0, 1),
                point(1, 3),
                point(2, 2),
                point(3, 5));

        // x mean 1.5, y mean 2.75, Sxy 5.5, Sxx 5
        assertThat(SeriesMath.slope(points)).isCloseTo(1.1, within(1e-9));
    }

    @Test
    @DisplayName("Should return zero slope for a single point")
    void shouldReturnZeroForSinglePoint() {
        assertThat(SeriesMath.slope(List.of(point(0, 42)))).isZero();
        assertThat(SeriesMath.slope(List.of())).isZero();
    }

    @Test
    @DisplayName("Should keep the last point when a date repeats")
    void shouldKeepLastDuplicate() {
        List<MetricPoint> normalised = SeriesMath.normalise(List.of(
                point(2, 30),
                point(0, 10),
                point(2, 35)));

        assertThat(normalised).extracting(MetricPoint::getValue).containsExactly(10.0, 35.0);
    }

    // Helper

    private static MetricPoint point(int day, double value) {
        return MetricPoint.of("/pricing", "clicks", START.plusDays(day), value);
    }
}
