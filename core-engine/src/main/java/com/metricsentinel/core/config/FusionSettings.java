package com.metricsentinel.core.config;

import com.metricsentinel.core.model.DetectorKind;

import java.io.Serializable;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Detector trust weights, severity band cutoffs and the anomaly retention
 * horizon.
 *
 * <p>
 * Weights need not sum to one; each scales how much a single detector can
 * contribute to the combined confidence.
 * </p>
 *
 * @since 1.0.0
 */
public class FusionSettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private Map<String, Double> weights = defaultWeights();
    private double mediumCutoff = 0.5;
    private double highCutoff = 0.8;
    private int retentionDays = 7;

    private static Map<String, Double> defaultWeights() {
        Map<String, Double> w = new LinkedHashMap<>();
        w.put("statistical", 0.4);
        w.put("outlier", 0.3);
        w.put("forecast", 0.3);
        return w;
    }

    /**
     * @return weight per detector kind; kinds missing from the configuration
     *         keep their default
     */
    public Map<DetectorKind, Double> detectorWeights() {
        Map<DetectorKind, Double> resolved = new EnumMap<>(DetectorKind.class);
        defaultWeights().forEach((k, v) -> resolved.put(DetectorKind.fromKey(k), v));
        weights.forEach((k, v) -> resolved.put(DetectorKind.fromKey(k), v));
        return resolved;
    }

    void collectErrors(List<String> errors) {
        for (Map.Entry<String, Double> e : weights.entrySet()) {
            try {
                DetectorKind.fromKey(e.getKey());
            } catch (IllegalArgumentException ex) {
                errors.add("fusion.weights: " + ex.getMessage());
            }
            Double w = e.getValue();
            if (w == null || w < 0.0 || w > 1.0) {
                errors.add("fusion.weights." + e.getKey() + " must be in [0, 1]");
            }
        }
        if (!(mediumCutoff > 0.0 && mediumCutoff < highCutoff && highCutoff <= 1.0)) {
            errors.add("fusion cutoffs must satisfy 0 < mediumCutoff < highCutoff <= 1, got medium="
                    + mediumCutoff + ", high=" + highCutoff);
        }
        if (retentionDays < 1) {
            errors.add("fusion.retentionDays must be >= 1");
        }
    }

    public Map<String, Double> getWeights() {
        return weights;
    }

    public void setWeights(Map<String, Double> weights) {
        this.weights = weights != null ? new LinkedHashMap<>(weights) : defaultWeights();
    }

    public double getMediumCutoff() {
        return mediumCutoff;
    }

    public void setMediumCutoff(double mediumCutoff) {
        this.mediumCutoff = mediumCutoff;
    }

    public double getHighCutoff() {
        return highCutoff;
    }

    public void setHighCutoff(double highCutoff) {
        this.highCutoff = highCutoff;
    }

    public int getRetentionDays() {
        return retentionDays;
    }

    public void setRetentionDays(int retentionDays) {
        this.retentionDays = retentionDays;
    }
}
