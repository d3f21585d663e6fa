package com.metricsentinel.core.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of loading a rules configuration: the rules accepted for
 * evaluation, the entries rejected as malformed, and the maintenance
 * windows.
 *
 * @since 1.0.0
 */
public final class RuleSet {

    private final List<AlertRule> rules;
    private final List<RuleRejection> rejections;
    private final List<MaintenanceWindow> maintenanceWindows;

    public RuleSet(List<AlertRule> rules, List<RuleRejection> rejections,
            List<MaintenanceWindow> maintenanceWindows) {
        this.rules = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(rules, "rules must not be null")));
        this.rejections = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(rejections, "rejections must not be null")));
        this.maintenanceWindows = Collections.unmodifiableList(new ArrayList<>(
                Objects.requireNonNull(maintenanceWindows, "maintenanceWindows must not be null")));
    }

    public static RuleSet of(List<AlertRule> rules) {
        return new RuleSet(rules, List.of(), List.of());
    }

    public static RuleSet empty() {
        return new RuleSet(List.of(), List.of(), List.of());
    }

    public List<AlertRule> getRules() {
        return rules;
    }

    public List<RuleRejection> getRejections() {
        return rejections;
    }

    public List<MaintenanceWindow> getMaintenanceWindows() {
        return maintenanceWindows;
    }

    @Override
    public String toString() {
        return "RuleSet{rules=" + rules.size()
                + ", rejections=" + rejections.size()
                + ", maintenanceWindows=" + maintenanceWindows.size() + '}';
    }
}
