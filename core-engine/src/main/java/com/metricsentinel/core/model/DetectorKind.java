package com.metricsentinel.core.model;

import java.util.Locale;

/**
 * The three independent detection methods whose opinions are fused into a
 * canonical {@link Anomaly}.
 *
 * @since 1.0.0
 */
public enum DetectorKind {

    /** Rolling mean / standard deviation z-score. */
    STATISTICAL,

    /** Density based outlier scoring over multivariate context. */
    OUTLIER,

    /** Seasonal forecast confidence band. */
    FORECAST;

    /**
     * Parse a configuration key such as {@code statistical}.
     *
     * @param value case-insensitive name
     * @return the detector kind
     * @throws IllegalArgumentException if the name is unknown
     */
    public static DetectorKind fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Detector kind must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown detector kind: '" + value
                    + "'. Supported: statistical, outlier, forecast", e);
        }
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
