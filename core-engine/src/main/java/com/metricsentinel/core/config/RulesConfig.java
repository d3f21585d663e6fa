package com.metricsentinel.core.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Top-level POJO for the rules YAML configuration.
 *
 * <p>
 * Expected YAML structure:
 * </p>
 *
 * <pre>
 * rules:
 *   - id: clicks-drop
 *     name: Clicks dropped
 *     type: anomaly
 *     metrics: [clicks]
 *     condition:
 *       minSeverity: medium
 *       directions: [below]
 *     channels:
 *       - channel: slack
 *         destination: https://hooks.slack.com/services/...
 *     aggregation: digest
 * maintenanceWindows:
 *   - name: migration
 *     start: 2024-03-01T00:00:00Z
 *     end: 2024-03-02T00:00:00Z
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading. Unlike a parse failure, a single
 * malformed rule does not fail the whole configuration: it is rejected and
 * reported while the remaining rules stay active.
 * </p>
 *
 * @since 1.0.0
 */
public class RulesConfig implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(RulesConfig.class);

    private List<AlertRule> rules = new ArrayList<>();
    private List<MaintenanceWindow> maintenanceWindows = new ArrayList<>();

    /**
     * Return the rules list. The returned list is <strong>unmodifiable</strong>.
     *
     * @return unmodifiable list of alert rules
     */
    public List<AlertRule> getRules() {
        return Collections.unmodifiableList(rules);
    }

    /**
     * Set the rules list (used by SnakeYAML during deserialization).
     *
     * @param rules the alert rules
     */
    public void setRules(List<AlertRule> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    public List<MaintenanceWindow> getMaintenanceWindows() {
        return Collections.unmodifiableList(maintenanceWindows);
    }

    public void setMaintenanceWindows(List<MaintenanceWindow> maintenanceWindows) {
        this.maintenanceWindows = maintenanceWindows != null
                ? new ArrayList<>(maintenanceWindows)
                : new ArrayList<>();
    }

    /**
     * Validate every rule and maintenance window in this configuration.
     *
     * <p>
     * Delegates to {@link AlertRule#validate()} for each rule. Rules that fail
     * validation, rules with a duplicate id and disabled rules are left out of
     * the returned {@link RuleSet}; invalid ones are listed as rejections.
     * </p>
     *
     * @return the accepted rules, rejections and valid maintenance windows
     */
    public RuleSet validate() {
        List<AlertRule> accepted = new ArrayList<>();
        List<RuleRejection> rejected = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (int i = 0; i < rules.size(); i++) {
            AlertRule rule = rules.get(i);
            if (rule == null) {
                rejected.add(new RuleRejection(null, "Rule at index " + i + " is null"));
                continue;
            }
            try {
                rule.validate();
            } catch (IllegalStateException e) {
                LOG.error("Rejecting rule '{}': {}", rule.getId(), e.getMessage());
                rejected.add(new RuleRejection(rule.getId(), e.getMessage()));
                continue;
            }
            if (!seenIds.add(rule.getId())) {
                String reason = "Duplicate rule id '" + rule.getId() + "' at index " + i;
                LOG.error("Rejecting rule '{}': {}", rule.getId(), reason);
                rejected.add(new RuleRejection(rule.getId(), reason));
                continue;
            }
            if (!rule.isEnabled()) {
                LOG.info("Rule '{}' is disabled - skipping", rule.getId());
                continue;
            }
            accepted.add(rule);
        }

        List<MaintenanceWindow> windows = new ArrayList<>();
        for (MaintenanceWindow window : maintenanceWindows) {
            if (window == null) {
                continue;
            }
            try {
                window.validate();
                windows.add(window);
            } catch (IllegalStateException e) {
                LOG.error("Rejecting maintenance window '{}': {}", window.getName(), e.getMessage());
                rejected.add(new RuleRejection("maintenance:" + window.getName(), e.getMessage()));
            }
        }

        return new RuleSet(accepted, rejected, windows);
    }

    @Override
    public String toString() {
        return "RulesConfig{rules=" + rules + ", maintenanceWindows=" + maintenanceWindows + '}';
    }
}
