package com.metricsentinel.core.rules;

import com.metricsentinel.core.config.AlertRule;
import com.metricsentinel.core.config.RuleRejection;
import com.metricsentinel.core.config.RuleSet;
import com.metricsentinel.core.model.Alert;
import com.metricsentinel.core.model.Fingerprints;
import com.metricsentinel.core.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Evaluates every active rule against a {@link Trigger} and produces one
 * {@link Alert} per matching rule.
 *
 * <p>
 * Evaluation has no side effects: the same rules and trigger always yield
 * alerts with the same ids and dedup keys, so callers may re-run it freely and
 * rely on the alert store to ignore repeats.
 * </p>
 *
 * <h3>Rejected rules</h3>
 * <p>
 * Rules rejected while loading, or that fail to compile here, are kept with
 * their error in {@link #rejectedRules()} and never evaluated. The other rules
 * stay active.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleEngine {

    private static final Logger LOG = LoggerFactory.getLogger(RuleEngine.class);

    private final Map<String, CompiledRule> rules;
    private final List<RuleRejection> rejected;
    private final Clock clock;

    public RuleEngine(RuleSet ruleSet, Clock clock) {
        Objects.requireNonNull(ruleSet, "ruleSet must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        Map<String, CompiledRule> compiled = new LinkedHashMap<>();
        List<RuleRejection> rejections = new ArrayList<>(ruleSet.getRejections());
        for (AlertRule rule : ruleSet.getRules()) {
            try {
                compiled.put(rule.getId(), CompiledRule.compile(rule));
            } catch (RuntimeException e) {
                String reason = e.getMessage() != null ? e.getMessage() : e.toString();
                LOG.error("Rejecting rule '{}' at compile: {}", rule.getId(), reason);
                rejections.add(new RuleRejection(rule.getId(), reason));
            }
        }
        this.rules = Collections.unmodifiableMap(compiled);
        this.rejected = Collections.unmodifiableList(rejections);
        LOG.info("Rule engine ready: {} active rule(s), {} rejected", rules.size(), rejected.size());
    }

    /**
     * Evaluate all active rules against one trigger.
     *
     * @param trigger anomaly or raw-metric trigger
     * @return one alert per rule whose scope and condition match, in rule order
     */
    public List<Alert> evaluate(Trigger trigger) {
        Objects.requireNonNull(trigger, "trigger must not be null");
        List<Alert> alerts = new ArrayList<>();
        for (CompiledRule rule : rules.values()) {
            if (!rule.inScope(trigger)) {
                continue;
            }
            try {
                Optional<String> reason = rule.getCondition().evaluate(trigger);
                if (reason.isPresent()) {
                    Alert alert = buildAlert(rule, trigger, reason.get());
                    LOG.debug("Rule '{}' fired for {} -> alert {}", rule.getId(), trigger, alert.getId());
                    alerts.add(alert);
                }
            } catch (RuntimeException e) {
                LOG.warn("Rule '{}' failed on {}; skipping", rule.getId(), trigger, e);
            }
        }
        return alerts;
    }

    private Alert buildAlert(CompiledRule compiled, Trigger trigger, String reason) {
        AlertRule rule = compiled.getRule();
        Severity severity = compiled.severityFor(trigger.getSeverity());
        String anomalyId = trigger instanceof AnomalyTrigger at ? at.getAnomaly().getId() : null;
        return Alert.builder()
                .id(Fingerprints.alertId(rule.getId(), trigger.key(), severity))
                .ruleId(rule.getId())
                .ruleName(rule.getName())
                .anomalyId(anomalyId)
                .entityId(trigger.getEntityId())
                .metric(trigger.getMetric())
                .date(trigger.getDate())
                .severity(severity)
                .title("[" + severity.name() + "] " + rule.getName() + ": "
                        + trigger.getEntityId() + " / " + trigger.getMetric())
                .message(reason)
                .metricsSnapshot(trigger.snapshot())
                .createdAt(clock.instant())
                .dedupKey(Fingerprints.dedupKey(rule.getId(), trigger.getEntityId(), trigger.getMetric(), severity))
                .build();
    }

    /**
     * @param ruleId rule id
     * @return the active rule, if any
     */
    public Optional<AlertRule> rule(String ruleId) {
        CompiledRule compiled = rules.get(ruleId);
        return compiled != null ? Optional.of(compiled.getRule()) : Optional.empty();
    }

    public List<AlertRule> rules() {
        return rules.values().stream().map(CompiledRule::getRule).toList();
    }

    /**
     * @return rules excluded at load or compile time, with their errors
     */
    public List<RuleRejection> rejectedRules() {
        return rejected;
    }
}
