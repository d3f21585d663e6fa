package com.metricsentinel.core.rules;

import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * Compares the latest value of a raw metric series against a threshold or an
 * inclusive range.
 *
 * @since 1.0.0
 */
public final class ThresholdCondition implements RuleCondition {

    private final ComparisonOperator operator;
    private final double threshold;
    private final double lowerBound;
    private final double upperBound;

    public ThresholdCondition(ComparisonOperator operator, double threshold) {
        this(operator, threshold, Double.NaN, Double.NaN);
    }

    public ThresholdCondition(ComparisonOperator operator, double threshold, double lowerBound, double upperBound) {
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.threshold = threshold;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public static ThresholdCondition range(ComparisonOperator operator, double lowerBound, double upperBound) {
        if (!operator.isRange()) {
            throw new IllegalArgumentException("Operator '" + operator.getSymbol() + "' is not a range operator");
        }
        return new ThresholdCondition(operator, Double.NaN, lowerBound, upperBound);
    }

    @Override
    public Optional<String> evaluate(Trigger trigger) {
        if (!(trigger instanceof MetricTrigger metricTrigger)) {
            return Optional.empty();
        }
        double value = metricTrigger.latest().getValue();
        if (!operator.test(value, threshold, lowerBound, upperBound)) {
            return Optional.empty();
        }
        String bound = operator.isRange()
                ? String.format(Locale.ROOT, "[%.2f, %.2f]", lowerBound, upperBound)
                : String.format(Locale.ROOT, "%.2f", threshold);
        return Optional.of(String.format(Locale.ROOT, "%s = %.2f on %s (%s %s)",
                metricTrigger.getMetric(), value, metricTrigger.getDate(), operator.getSymbol(), bound));
    }

    @Override
    public String toString() {
        return "ThresholdCondition{" + operator.getSymbol()
                + (operator.isRange() ? " [" + lowerBound + ", " + upperBound + "]" : " " + threshold) + '}';
    }
}
