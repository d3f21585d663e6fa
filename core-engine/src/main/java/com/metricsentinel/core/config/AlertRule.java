package com.metricsentinel.core.config;

import com.metricsentinel.core.model.Direction;
import com.metricsentinel.core.model.Severity;
import com.metricsentinel.core.rules.ComparisonOperator;
import com.metricsentinel.core.rules.PatternType;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Describes a single operator-defined alert rule loaded from configuration.
 *
 * <p>
 * Supported rule types:
 * </p>
 * <ul>
 * <li>{@code anomaly} - condition over canonical anomalies (severity,
 * confidence, magnitude, direction, number of agreeing detectors)</li>
 * <li>{@code threshold} - comparison of the latest raw metric value</li>
 * <li>{@code pattern} - consecutive decline/growth or trend reversal over the
 * most recent values</li>
 * </ul>
 *
 * <p>
 * Call {@link #validate()} after construction / deserialization to verify
 * that all required fields for the declared rule type are present and valid.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertRule implements Serializable {

    private static final long serialVersionUID = 1L;

    public static final int DEFAULT_SUPPRESSION_WINDOW_MINUTES = 24 * 60;
    public static final int DEFAULT_BURST_THRESHOLD = 10;

    /** Stable identifier used in dedup keys and alert ids. */
    private String id;

    /** Human-readable name used in alert titles and logs. */
    private String name;

    /** Rule type: "anomaly", "threshold", or "pattern". */
    private String type;

    private boolean enabled = true;

    // --- Scope ---
    /** Entity glob patterns; empty matches every entity. */
    private List<String> entities = new ArrayList<>();

    /** Metric names; empty matches every metric. */
    private List<String> metrics = new ArrayList<>();

    private ConditionSpec condition = new ConditionSpec();

    // --- Severity ---
    /** Fixed alert severity; {@code null} inherits the trigger's severity. */
    private String severity;

    /** Anomaly severity → alert severity overrides. */
    private Map<String, String> severityMapping = new LinkedHashMap<>();

    // --- Delivery ---
    private List<ChannelTarget> channels = new ArrayList<>();
    private int suppressionWindowMinutes = DEFAULT_SUPPRESSION_WINDOW_MINUTES;
    private String aggregation = "none";
    private int burstThreshold = DEFAULT_BURST_THRESHOLD;

    /** Daily cap on admitted alerts for this rule; 0 disables the cap. */
    private int maxAlertsPerDay;

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate that all required fields for the declared rule type are present
     * and contain legal values.
     *
     * @throws IllegalStateException if validation fails
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        String label = id != null ? id : name;

        if (id == null || id.isBlank()) {
            errors.add("Rule 'id' is required");
        }
        if (name == null || name.isBlank()) {
            errors.add("Rule '" + label + "' requires 'name'");
        }
        if (type == null || type.isBlank()) {
            errors.add("Rule '" + label + "' requires 'type'");
        }
        if (condition == null) {
            errors.add("Rule '" + label + "' requires a 'condition' block");
        }

        if (type != null && condition != null) {
            switch (type) {
                case "anomaly" -> validateAnomalyCondition(label, errors);
                case "threshold" -> validateThresholdCondition(label, errors);
                case "pattern" -> validatePatternCondition(label, errors);
                default -> errors.add("Unknown rule type: '" + type
                        + "'. Supported: anomaly, threshold, pattern");
            }
        }

        if (severity != null) {
            checkSeverity(label, "severity", severity, errors);
        }
        for (Map.Entry<String, String> e : severityMapping.entrySet()) {
            checkSeverity(label, "severityMapping key", e.getKey(), errors);
            checkSeverity(label, "severityMapping value", e.getValue(), errors);
        }

        if (channels.isEmpty()) {
            errors.add("Rule '" + label + "' requires at least one entry in 'channels'");
        }
        Set<String> seenChannels = new HashSet<>();
        for (ChannelTarget target : channels) {
            if (target == null || target.getChannel() == null || target.getChannel().isBlank()) {
                errors.add("Rule '" + label + "' has a channel target without 'channel'");
            } else if (!seenChannels.add(target.getChannel())) {
                errors.add("Rule '" + label + "' lists channel '" + target.getChannel() + "' twice");
            }
        }

        if (suppressionWindowMinutes <= 0) {
            errors.add("Rule '" + label + "' requires 'suppressionWindowMinutes' > 0");
        }
        try {
            AggregationMode.fromKey(aggregation);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + label + "': " + e.getMessage());
        }
        if (burstThreshold < 1) {
            errors.add("Rule '" + label + "' requires 'burstThreshold' >= 1");
        }
        if (maxAlertsPerDay < 0) {
            errors.add("Rule '" + label + "' requires 'maxAlertsPerDay' >= 0");
        }

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Invalid AlertRule: " + String.join("; ", errors));
        }
    }

    private void validateAnomalyCondition(String label, List<String> errors) {
        if (condition.getMinSeverity() != null) {
            checkSeverity(label, "minSeverity", condition.getMinSeverity(), errors);
        }
        Double minConfidence = condition.getMinConfidence();
        if (minConfidence != null && (minConfidence < 0.0 || minConfidence > 1.0)) {
            errors.add("Anomaly rule '" + label + "' requires 'minConfidence' in [0, 1]");
        }
        Double minMagnitude = condition.getMinMagnitudePct();
        if (minMagnitude != null && minMagnitude < 0.0) {
            errors.add("Anomaly rule '" + label + "' requires 'minMagnitudePct' >= 0");
        }
        Integer minDetectors = condition.getMinDetectors();
        if (minDetectors != null && (minDetectors < 1 || minDetectors > 3)) {
            errors.add("Anomaly rule '" + label + "' requires 'minDetectors' in [1, 3]");
        }
        for (String direction : condition.getDirections()) {
            try {
                Direction.fromKey(direction);
            } catch (IllegalArgumentException e) {
                errors.add("Anomaly rule '" + label + "': " + e.getMessage());
            }
        }
    }

    private void validateThresholdCondition(String label, List<String> errors) {
        if (metrics.isEmpty()) {
            errors.add("Threshold rule '" + label + "' requires 'metrics'");
        }
        ComparisonOperator operator;
        try {
            operator = ComparisonOperator.fromSymbol(condition.getOperator());
        } catch (IllegalArgumentException e) {
            errors.add("Threshold rule '" + label + "': " + e.getMessage());
            return;
        }
        if (operator.isRange()) {
            if (condition.getLowerBound() == null || condition.getUpperBound() == null) {
                errors.add("Threshold rule '" + label + "' requires 'lowerBound' and 'upperBound' for '"
                        + operator.getSymbol() + "'");
            } else if (condition.getLowerBound() > condition.getUpperBound()) {
                errors.add("Threshold rule '" + label + "' requires 'lowerBound' <= 'upperBound'");
            }
        } else if (condition.getThreshold() == null) {
            errors.add("Threshold rule '" + label + "' requires 'threshold'");
        }
    }

    private void validatePatternCondition(String label, List<String> errors) {
        if (metrics.isEmpty()) {
            errors.add("Pattern rule '" + label + "' requires 'metrics'");
        }
        try {
            PatternType.fromKey(condition.getPattern());
        } catch (IllegalArgumentException e) {
            errors.add("Pattern rule '" + label + "': " + e.getMessage());
        }
        Integer duration = condition.getDuration();
        if (duration != null && duration < 2) {
            errors.add("Pattern rule '" + label + "' requires 'duration' >= 2");
        }
    }

    private static void checkSeverity(String label, String field, String value, List<String> errors) {
        try {
            Severity.fromKey(value);
        } catch (IllegalArgumentException e) {
            errors.add("Rule '" + label + "' " + field + ": " + e.getMessage());
        }
    }

    // ---------------------------------------------------------------
    // Derived accessors
    // ---------------------------------------------------------------

    public Duration suppressionWindow() {
        return Duration.ofMinutes(suppressionWindowMinutes);
    }

    public AggregationMode aggregationMode() {
        return AggregationMode.fromKey(aggregation);
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getType() {
        return type;
    }

    /**
     * Set the rule type, normalised to lowercase.
     *
     * @param type rule type string
     */
    public void setType(String type) {
        this.type = type != null ? type.trim().toLowerCase(Locale.ROOT) : null;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<String> getEntities() {
        return entities;
    }

    public void setEntities(List<String> entities) {
        this.entities = entities != null ? new ArrayList<>(entities) : new ArrayList<>();
    }

    public List<String> getMetrics() {
        return metrics;
    }

    public void setMetrics(List<String> metrics) {
        this.metrics = metrics != null ? new ArrayList<>(metrics) : new ArrayList<>();
    }

    public ConditionSpec getCondition() {
        return condition;
    }

    public void setCondition(ConditionSpec condition) {
        this.condition = condition;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public Map<String, String> getSeverityMapping() {
        return severityMapping;
    }

    public void setSeverityMapping(Map<String, String> severityMapping) {
        this.severityMapping = severityMapping != null
                ? new LinkedHashMap<>(severityMapping)
                : new LinkedHashMap<>();
    }

    public List<ChannelTarget> getChannels() {
        return channels;
    }

    public void setChannels(List<ChannelTarget> channels) {
        this.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
    }

    public int getSuppressionWindowMinutes() {
        return suppressionWindowMinutes;
    }

    public void setSuppressionWindowMinutes(int suppressionWindowMinutes) {
        this.suppressionWindowMinutes = suppressionWindowMinutes;
    }

    public String getAggregation() {
        return aggregation;
    }

    public void setAggregation(String aggregation) {
        this.aggregation = aggregation;
    }

    public int getBurstThreshold() {
        return burstThreshold;
    }

    public void setBurstThreshold(int burstThreshold) {
        this.burstThreshold = burstThreshold;
    }

    public int getMaxAlertsPerDay() {
        return maxAlertsPerDay;
    }

    public void setMaxAlertsPerDay(int maxAlertsPerDay) {
        this.maxAlertsPerDay = maxAlertsPerDay;
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRule that))
            return false;
        return Objects.equals(id, that.id) && Objects.equals(type, that.type);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, type);
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", type='" + type + '\'' +
                ", enabled=" + enabled +
                ", entities=" + entities +
                ", metrics=" + metrics +
                ", condition=" + condition +
                ", severity='" + severity + '\'' +
                ", channels=" + channels +
                ", suppressionWindowMinutes=" + suppressionWindowMinutes +
                ", aggregation='" + aggregation + '\'' +
                '}';
    }
}
