package com.metricsentinel.core.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

/**
 * Recognises consecutive decline, consecutive growth and trend reversal over
 * the most recent values of a raw metric series.
 *
 * <p>
 * Consecutive patterns look at the last {@code duration} values. A trend
 * reversal compares the last {@code duration} values with the
 * {@code duration} values before them and needs at least
 * {@code duration + 2} values.
 * </p>
 *
 * @since 1.0.0
 */
public final class PatternCondition implements RuleCondition {

    private static final Logger LOG = LoggerFactory.getLogger(PatternCondition.class);

    public static final int DEFAULT_DURATION = 3;

    private final PatternType pattern;
    private final int duration;

    enum Trend {
        GROWTH, DECLINE, STABLE
    }

    public PatternCondition(PatternType pattern, int duration) {
        this.pattern = Objects.requireNonNull(pattern, "pattern must not be null");
        if (duration < 2) {
            throw new IllegalArgumentException("duration must be >= 2, got " + duration);
        }
        this.duration = duration;
    }

    @Override
    public Optional<String> evaluate(Trigger trigger) {
        if (!(trigger instanceof MetricTrigger metricTrigger)) {
            return Optional.empty();
        }
        double[] values = metricTrigger.values();
        if (values.length < duration) {
            LOG.trace("Not enough points for {} on {}: {} < {}", pattern.key(), metricTrigger, values.length,
                    duration);
            return Optional.empty();
        }
        double[] recent = Arrays.copyOfRange(values, values.length - duration, values.length);
        boolean matched = switch (pattern) {
            case CONSECUTIVE_DECLINE -> isMonotonic(recent, false);
            case CONSECUTIVE_GROWTH -> isMonotonic(recent, true);
            case TREND_REVERSAL -> isReversal(values);
        };
        if (!matched) {
            return Optional.empty();
        }
        return Optional.of(metricTrigger.getMetric() + " shows " + pattern.key().replace('_', ' ')
                + " over the last " + duration + " points ending " + metricTrigger.getDate());
    }

    private static boolean isMonotonic(double[] values, boolean growth) {
        for (int i = 1; i < values.length; i++) {
            if (growth ? values[i] <= values[i - 1] : values[i] >= values[i - 1]) {
                return false;
            }
        }
        return true;
    }

    private boolean isReversal(double[] values) {
        if (values.length < duration + 2) {
            return false;
        }
        int prevEnd = values.length - duration;
        double[] previous = Arrays.copyOfRange(values, Math.max(0, prevEnd - duration), prevEnd);
        double[] recent = Arrays.copyOfRange(values, prevEnd, values.length);
        Trend before = trendOf(previous);
        Trend after = trendOf(recent);
        return (before == Trend.DECLINE && after == Trend.GROWTH)
                || (before == Trend.GROWTH && after == Trend.DECLINE);
    }

    static Trend trendOf(double[] values) {
        if (values.length < 2) {
            return Trend.STABLE;
        }
        int increases = 0;
        int decreases = 0;
        for (int i = 1; i < values.length; i++) {
            if (values[i] > values[i - 1]) {
                increases++;
            } else if (values[i] < values[i - 1]) {
                decreases++;
            }
        }
        double first = values[0];
        double last = values[values.length - 1];
        if (last > first && increases > decreases) {
            return Trend.GROWTH;
        }
        if (last < first && decreases > increases) {
            return Trend.DECLINE;
        }
        return Trend.STABLE;
    }

    @Override
    public String toString() {
        return "PatternCondition{" + pattern.key() + ", duration=" + duration + '}';
    }
}
