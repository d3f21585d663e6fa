package com.metricsentinel.core.config;

import java.io.Serializable;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Tuning of the three detectors. Every field has a working default so an
 * empty {@code detection:} block is valid.
 *
 * @since 1.0.0
 */
public class DetectionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    // --- Statistical baseline ---
    private double defaultZThreshold = 2.5;

    /** Per-metric z-score threshold overrides. */
    private Map<String, Double> metricThresholds = new LinkedHashMap<>();

    /** |z| at which statistical confidence saturates at 1.0. */
    private double confidenceCeiling = 5.0;

    private int baselineWindowDays = 28;
    private int minBaselinePoints = 7;

    // --- Outlier classifier ---
    private double outlierPercentile = 95.0;
    private double outlierMinScore = 0.5;
    private int minOutlierHistory = 10;
    private int trendWindow = 7;

    // --- Forecast ---
    private int seasonLength = 7;
    private double forecastIntervalZ = 1.96;
    private double levelSmoothing = 0.3;
    private double trendSmoothing = 0.05;
    private double seasonalSmoothing = 0.2;

    /**
     * @param metric metric name
     * @return the z-score threshold for {@code metric}
     */
    public double zThresholdFor(String metric) {
        Double override = metricThresholds.get(metric);
        return override != null ? override : defaultZThreshold;
    }

    void collectErrors(List<String> errors) {
        if (defaultZThreshold <= 0) {
            errors.add("detection.defaultZThreshold must be > 0");
        }
        metricThresholds.forEach((metric, z) -> {
            if (z == null || z <= 0) {
                errors.add("detection.metricThresholds." + metric + " must be > 0");
            }
        });
        if (confidenceCeiling <= 0) {
            errors.add("detection.confidenceCeiling must be > 0");
        }
        if (baselineWindowDays < 2) {
            errors.add("detection.baselineWindowDays must be >= 2");
        }
        if (minBaselinePoints < 2 || minBaselinePoints > baselineWindowDays) {
            errors.add("detection.minBaselinePoints must be in [2, baselineWindowDays]");
        }
        if (outlierPercentile <= 0 || outlierPercentile > 100) {
            errors.add("detection.outlierPercentile must be in (0, 100]");
        }
        if (outlierMinScore < 0 || outlierMinScore >= 1) {
            errors.add("detection.outlierMinScore must be in [0, 1)");
        }
        if (minOutlierHistory < 4) {
            errors.add("detection.minOutlierHistory must be >= 4");
        }
        if (trendWindow < 2) {
            errors.add("detection.trendWindow must be >= 2");
        }
        if (seasonLength < 2) {
            errors.add("detection.seasonLength must be >= 2");
        }
        if (forecastIntervalZ <= 0) {
            errors.add("detection.forecastIntervalZ must be > 0");
        }
        checkUnit("levelSmoothing", levelSmoothing, errors);
        checkUnit("trendSmoothing", trendSmoothing, errors);
        checkUnit("seasonalSmoothing", seasonalSmoothing, errors);
    }

    private static void checkUnit(String name, double value, List<String> errors) {
        if (value <= 0 || value >= 1) {
            errors.add("detection." + name + " must be in (0, 1)");
        }
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public double getDefaultZThreshold() {
        return defaultZThreshold;
    }

    public void setDefaultZThreshold(double defaultZThreshold) {
        this.defaultZThreshold = defaultZThreshold;
    }

    public Map<String, Double> getMetricThresholds() {
        return metricThresholds;
    }

    public void setMetricThresholds(Map<String, Double> metricThresholds) {
        this.metricThresholds = metricThresholds != null ? new LinkedHashMap<>(metricThresholds) : new LinkedHashMap<>();
    }

    public double getConfidenceCeiling() {
        return confidenceCeiling;
    }

    public void setConfidenceCeiling(double confidenceCeiling) {
        this.confidenceCeiling = confidenceCeiling;
    }

    public int getBaselineWindowDays() {
        return baselineWindowDays;
    }

    public void setBaselineWindowDays(int baselineWindowDays) {
        this.baselineWindowDays = baselineWindowDays;
    }

    public int getMinBaselinePoints() {
        return minBaselinePoints;
    }

    public void setMinBaselinePoints(int minBaselinePoints) {
        this.minBaselinePoints = minBaselinePoints;
    }

    public double getOutlierPercentile() {
        return outlierPercentile;
    }

    public void setOutlierPercentile(double outlierPercentile) {
        this.outlierPercentile = outlierPercentile;
    }

    public double getOutlierMinScore() {
        return outlierMinScore;
    }

    public void setOutlierMinScore(double outlierMinScore) {
        this.outlierMinScore = outlierMinScore;
    }

    public int getMinOutlierHistory() {
        return minOutlierHistory;
    }

    public void setMinOutlierHistory(int minOutlierHistory) {
        this.minOutlierHistory = minOutlierHistory;
    }

    public int getTrendWindow() {
        return trendWindow;
    }

    public void setTrendWindow(int trendWindow) {
        this.trendWindow = trendWindow;
    }

    public int getSeasonLength() {
        return seasonLength;
    }

    public void setSeasonLength(int seasonLength) {
        this.seasonLength = seasonLength;
    }

    public double getForecastIntervalZ() {
        return forecastIntervalZ;
    }

    public void setForecastIntervalZ(double forecastIntervalZ) {
        this.forecastIntervalZ = forecastIntervalZ;
    }

    public double getLevelSmoothing() {
        return levelSmoothing;
    }

    public void setLevelSmoothing(double levelSmoothing) {
        this.levelSmoothing = levelSmoothing;
    }

    public double getTrendSmoothing() {
        return trendSmoothing;
    }

    public void setTrendSmoothing(double trendSmoothing) {
        this.trendSmoothing = trendSmoothing;
    }

    public double getSeasonalSmoothing() {
        return seasonalSmoothing;
    }

    public void setSeasonalSmoothing(double seasonalSmoothing) {
        this.seasonalSmoothing = seasonalSmoothing;
    }
}
