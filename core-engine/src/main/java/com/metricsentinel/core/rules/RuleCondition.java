package com.metricsentinel.core.rules;

import java.util.Optional;

/**
 * Condition half of a compiled rule.
 *
 * <p>
 * Implementations are stateless and side-effect free. A condition that does
 * not apply to the kind of trigger it receives (for example a threshold
 * condition handed an anomaly) simply does not match.
 * </p>
 *
 * @since 1.0.0
 */
public interface RuleCondition {

    /**
     * @param trigger the trigger to test
     * @return a human-readable reason if the condition holds, empty otherwise
     */
    Optional<String> evaluate(Trigger trigger);
}
