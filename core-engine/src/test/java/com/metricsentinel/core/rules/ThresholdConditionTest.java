package com.metricsentinel.core.rules;

import com.metricsentinel.core.model.MetricPoint;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link ThresholdCondition} and {@link ComparisonOperator}.
 */
class ThresholdConditionTest {

    @ParameterizedTest(name = "{0} {1} {2} -> {3}")
    @CsvSource({
            "12.0, >, 10.0, true",
            "10.0, >, 10.0, false",
            "10.0, >=, 10.0, true",
            "9.0, <, 10.0, true",
            "10.0, <=, 10.0, true",
            "10.0, ==, 10.0, true",
            "10.0, =, 10.0, true",
            "10.5, !=, 10.0, true",
            "10.0, <>, 10.0, false"
    })
    @DisplayName("Should compare the latest value against a single threshold")
    void shouldCompare(double value, String symbol, double threshold, boolean expected) {
        ThresholdCondition condition = new ThresholdCondition(ComparisonOperator.fromSymbol(symbol), threshold);

        assertThat(condition.evaluate(trigger(value)).isPresent()).isEqualTo(expected);
    }

    @Test
    @DisplayName("Should treat range bounds as inclusive for between")
    void shouldEvaluateRanges() {
        ThresholdCondition between = ThresholdCondition.range(ComparisonOperator.BETWEEN, 5.0, 10.0);
        ThresholdCondition outside = ThresholdCondition.range(ComparisonOperator.NOT_BETWEEN, 5.0, 10.0);

        assertThat(between.evaluate(trigger(5.0))).isPresent();
        assertThat(between.evaluate(trigger(10.0))).isPresent();
        assertThat(between.evaluate(trigger(10.1))).isEmpty();
        assertThat(outside.evaluate(trigger(4.9))).hasValueSatisfying(
                reason -> assertThat(reason).contains("not_between [5.00, 10.00]"));
    }

    @Test
    @DisplayName("Should only look at the most recent point")
    void shouldUseLatestPoint() {
        ThresholdCondition condition = new ThresholdCondition(ComparisonOperator.GREATER_THAN, 10.0);
        MetricTrigger trigger = new MetricTrigger("/a", "position", List.of(
                MetricPoint.of("/a", "position", LocalDate.of(2024, 1, 2), 8.0),
                MetricPoint.of("/a", "position", LocalDate.of(2024, 1, 1), 20.0)));

        assertThat(condition.evaluate(trigger)).isEmpty();
    }

    @Test
    @DisplayName("Should reject unknown operators and non-range operators for ranges")
    void shouldRejectInvalidOperators() {
        assertThatThrownBy(() -> ComparisonOperator.fromSymbol("~"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown comparison operator");
        assertThatThrownBy(() -> ThresholdCondition.range(ComparisonOperator.GREATER_THAN, 1.0, 2.0))
                .isInstanceOf(IllegalArgumentException.class);
    }

    // Helper

    private static MetricTrigger trigger(double latest) {
        return new MetricTrigger("/a", "position", List.of(
                MetricPoint.of("/a", "position", LocalDate.of(2024, 1, 1), latest)));
    }
}
