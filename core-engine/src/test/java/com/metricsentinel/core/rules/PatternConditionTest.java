package com.metricsentinel.core.rules;

import com.metricsentinel.core.model.MetricPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link PatternCondition}.
 */
class PatternConditionTest {

    private static final LocalDate START = LocalDate.of(2024, 1, 1);

    @Test
    @DisplayName("Should fire on a strict decline over the last N points")
    void shouldDetectDecline() {
        PatternCondition condition = new PatternCondition(PatternType.CONSECUTIVE_DECLINE, 3);

        assertThat(condition.evaluate(series(50, 40, 30, 20))).hasValueSatisfying(
                reason -> assertThat(reason).contains("consecutive decline").contains("last 3 points"));
    }

    @Test
    @DisplayName("Should not treat a flat step as a decline")
    void shouldRequireStrictDecline() {
        PatternCondition condition = new PatternCondition(PatternType.CONSECUTIVE_DECLINE, 3);

        assertThat(condition.evaluate(series(50, 40, 40, 30))).isEmpty();
    }

    @Test
    @DisplayName("Should fire on consecutive growth")
    void shouldDetectGrowth() {
        PatternCondition condition = new PatternCondition(PatternType.CONSECUTIVE_GROWTH, 4);

        assertThat(condition.evaluate(series(1, 2, 3, 4))).isPresent();
        assertThat(condition.evaluate(series(1, 2, 3))).isEmpty();
    }

    @Test
    @DisplayName("Should detect a decline followed by growth as a trend reversal")
    void shouldDetectReversal() {
        PatternCondition condition = new PatternCondition(PatternType.TREND_REVERSAL, 3);

        assertThat(condition.evaluate(series(90, 80, 70, 75, 85, 95))).isPresent();
        assertThat(condition.evaluate(series(10, 20, 30, 40, 50, 60))).isEmpty();
    }

    @Test
    @DisplayName("Should classify trends from the net direction of steps")
    void shouldClassifyTrend() {
        assertThat(PatternCondition.trendOf(new double[] {1, 3, 2, 4})).isEqualTo(PatternCondition.Trend.GROWTH);
        assertThat(PatternCondition.trendOf(new double[] {4, 2, 3, 1})).isEqualTo(PatternCondition.Trend.DECLINE);
        assertThat(PatternCondition.trendOf(new double[] {2, 2, 2})).isEqualTo(PatternCondition.Trend.STABLE);
    }

    @Test
    @DisplayName("Should reject a duration shorter than two points")
    void shouldRejectShortDuration() {
        assertThatThrownBy(() -> new PatternCondition(PatternType.CONSECUTIVE_DECLINE, 1))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should resolve pattern keys case-insensitively")
    void shouldParsePatternKeys() {
        assertThat(PatternType.fromKey("Trend_Reversal")).isEqualTo(PatternType.TREND_REVERSAL);
        assertThatThrownBy(() -> PatternType.fromKey("zigzag"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("zigzag");
    }

    // Helper

    private static MetricTrigger series(double... values) {
        List<MetricPoint> points = new ArrayList<>();
        for (int i = 0; i < values.length; i++) {
            points.add(MetricPoint.of("/home", "clicks", START.plusDays(i), values[i]));
        }
        return new MetricTrigger("/home", "clicks", points);
    }
}
