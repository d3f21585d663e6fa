package com.metricsentinel.core.config;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Condition block of an {@link AlertRule} as written in YAML.
 *
 * <p>
 * Which fields apply depends on the rule type:
 * </p>
 * <ul>
 * <li>{@code anomaly} - {@code minSeverity}, {@code minConfidence},
 * {@code minMagnitudePct}, {@code directions}, {@code minDetectors}</li>
 * <li>{@code threshold} - {@code operator} with {@code threshold}, or with
 * {@code lowerBound}/{@code upperBound} for {@code between} and
 * {@code not_between}</li>
 * <li>{@code pattern} - {@code pattern} and {@code duration}</li>
 * </ul>
 *
 * @since 1.0.0
 */
public class ConditionSpec implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- Anomaly fields ---
    private String minSeverity;
    private Double minConfidence;
    private Double minMagnitudePct;
    private List<String> directions = new ArrayList<>();
    private Integer minDetectors;

    // --- Threshold fields ---
    private String operator;
    private Double threshold;
    private Double lowerBound;
    private Double upperBound;

    // --- Pattern fields ---
    private String pattern;
    private Integer duration;

    public String getMinSeverity() {
        return minSeverity;
    }

    public void setMinSeverity(String minSeverity) {
        this.minSeverity = minSeverity;
    }

    public Double getMinConfidence() {
        return minConfidence;
    }

    public void setMinConfidence(Double minConfidence) {
        this.minConfidence = minConfidence;
    }

    public Double getMinMagnitudePct() {
        return minMagnitudePct;
    }

    public void setMinMagnitudePct(Double minMagnitudePct) {
        this.minMagnitudePct = minMagnitudePct;
    }

    public List<String> getDirections() {
        return directions;
    }

    public void setDirections(List<String> directions) {
        this.directions = directions != null ? new ArrayList<>(directions) : new ArrayList<>();
    }

    public Integer getMinDetectors() {
        return minDetectors;
    }

    public void setMinDetectors(Integer minDetectors) {
        this.minDetectors = minDetectors;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public Double getThreshold() {
        return threshold;
    }

    public void setThreshold(Double threshold) {
        this.threshold = threshold;
    }

    public Double getLowerBound() {
        return lowerBound;
    }

    public void setLowerBound(Double lowerBound) {
        this.lowerBound = lowerBound;
    }

    public Double getUpperBound() {
        return upperBound;
    }

    public void setUpperBound(Double upperBound) {
        this.upperBound = upperBound;
    }

    public String getPattern() {
        return pattern;
    }

    public void setPattern(String pattern) {
        this.pattern = pattern;
    }

    public Integer getDuration() {
        return duration;
    }

    public void setDuration(Integer duration) {
        this.duration = duration;
    }

    @Override
    public String toString() {
        return "ConditionSpec{" +
                "minSeverity='" + minSeverity + '\'' +
                ", minConfidence=" + minConfidence +
                ", minMagnitudePct=" + minMagnitudePct +
                ", directions=" + directions +
                ", minDetectors=" + minDetectors +
                ", operator='" + operator + '\'' +
                ", threshold=" + threshold +
                ", lowerBound=" + lowerBound +
                ", upperBound=" + upperBound +
                ", pattern='" + pattern + '\'' +
                ", duration=" + duration +
                '}';
    }
}
