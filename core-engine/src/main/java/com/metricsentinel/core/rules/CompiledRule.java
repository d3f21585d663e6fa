package com.metricsentinel.core.rules;

import com.metricsentinel.core.config.AlertRule;
import com.metricsentinel.core.model.Severity;

import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * An {@link AlertRule} with its scope, condition and severity mapping
 * resolved once at load time.
 *
 * @since 1.0.0
 */
public final class CompiledRule {

    private final AlertRule rule;
    private final ScopeFilter scope;
    private final RuleCondition condition;
    private final Severity fixedSeverity;
    private final Map<Severity, Severity> severityMapping = new EnumMap<>(Severity.class);

    private CompiledRule(AlertRule rule, ScopeFilter scope, RuleCondition condition) {
        this.rule = rule;
        this.scope = scope;
        this.condition = condition;
        this.fixedSeverity = rule.getSeverity() != null ? Severity.fromKey(rule.getSeverity()) : null;
        rule.getSeverityMapping().forEach(
                (from, to) -> severityMapping.put(Severity.fromKey(from), Severity.fromKey(to)));
    }

    /**
     * @param rule a rule that passed {@link AlertRule#validate()}
     * @return the compiled rule
     * @throws IllegalArgumentException if the rule cannot be compiled
     */
    public static CompiledRule compile(AlertRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        return new CompiledRule(rule,
                ScopeFilter.of(rule.getEntities(), rule.getMetrics()),
                ConditionFactory.create(rule));
    }

    public boolean inScope(Trigger trigger) {
        return scope.matches(trigger.getEntityId(), trigger.getMetric());
    }

    public RuleCondition getCondition() {
        return condition;
    }

    /**
     * A mapping for the trigger's severity wins, then the rule's fixed
     * severity, then the trigger's own severity.
     *
     * @param triggerSeverity severity carried by the trigger
     * @return the alert severity
     */
    public Severity severityFor(Severity triggerSeverity) {
        Severity mapped = severityMapping.get(triggerSeverity);
        if (mapped != null) {
            return mapped;
        }
        return fixedSeverity != null ? fixedSeverity : triggerSeverity;
    }

    public AlertRule getRule() {
        return rule;
    }

    public String getId() {
        return rule.getId();
    }

    @Override
    public String toString() {
        return "CompiledRule{" + rule.getId() + ", " + condition + '}';
    }
}
