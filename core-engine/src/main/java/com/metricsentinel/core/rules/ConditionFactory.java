package com.metricsentinel.core.rules;

import com.metricsentinel.core.config.AlertRule;
import com.metricsentinel.core.config.ConditionSpec;
import com.metricsentinel.core.model.Direction;
import com.metricsentinel.core.model.Severity;

import java.util.EnumSet;
import java.util.Objects;
import java.util.Set;

/**
 * Factory that creates {@link RuleCondition} instances from the condition
 * block of an {@link AlertRule}.
 *
 * <p>
 * This is the single point of extension when adding new rule types:
 * register the new type string here and create the corresponding condition.
 * </p>
 *
 * @since 1.0.0
 */
public final class ConditionFactory {

    private ConditionFactory() {
        // not instantiable
    }

    /**
     * Create the condition for the given rule.
     *
     * @param rule a validated rule; must not be {@code null}
     * @return the rule's condition
     * @throws NullPointerException     if {@code rule} or its type is {@code null}
     * @throws IllegalArgumentException if the rule type or a condition value is unknown
     */
    public static RuleCondition create(AlertRule rule) {
        Objects.requireNonNull(rule, "AlertRule must not be null");
        Objects.requireNonNull(rule.getType(), "Rule type must not be null");
        ConditionSpec spec = Objects.requireNonNull(rule.getCondition(),
                "Rule '" + rule.getId() + "' has no condition");

        return switch (rule.getType()) {
            case "anomaly" -> anomaly(spec);
            case "threshold" -> threshold(spec);
            case "pattern" -> new PatternCondition(
                    PatternType.fromKey(spec.getPattern()),
                    spec.getDuration() != null ? spec.getDuration() : PatternCondition.DEFAULT_DURATION);
            default -> throw new IllegalArgumentException(
                    "Unknown rule type: '" + rule.getType()
                            + "'. Supported types: anomaly, threshold, pattern");
        };
    }

    private static RuleCondition anomaly(ConditionSpec spec) {
        Set<Direction> directions = EnumSet.noneOf(Direction.class);
        for (String d : spec.getDirections()) {
            directions.add(Direction.fromKey(d));
        }
        return new AnomalyCondition(
                spec.getMinSeverity() != null ? Severity.fromKey(spec.getMinSeverity()) : null,
                spec.getMinConfidence() != null ? spec.getMinConfidence() : 0.0,
                spec.getMinMagnitudePct() != null ? spec.getMinMagnitudePct() : 0.0,
                directions,
                spec.getMinDetectors() != null ? spec.getMinDetectors() : 1);
    }

    private static RuleCondition threshold(ConditionSpec spec) {
        ComparisonOperator operator = ComparisonOperator.fromSymbol(spec.getOperator());
        if (operator.isRange()) {
            return ThresholdCondition.range(operator,
                    Objects.requireNonNull(spec.getLowerBound(), "lowerBound must not be null"),
                    Objects.requireNonNull(spec.getUpperBound(), "upperBound must not be null"));
        }
        return new ThresholdCondition(operator,
                Objects.requireNonNull(spec.getThreshold(), "threshold must not be null"));
    }
}
