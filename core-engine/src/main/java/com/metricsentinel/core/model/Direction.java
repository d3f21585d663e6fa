package com.metricsentinel.core.model;

import java.util.Locale;

/**
 * Side of the baseline an observation fell on. Part of an anomaly's identity:
 * an "above" and a "below" finding for the same day are never merged.
 *
 * @since 1.0.0
 */
public enum Direction {
    ABOVE,
    BELOW;

    public static Direction of(double actual, double expected) {
        return actual >= expected ? ABOVE : BELOW;
    }

    public static Direction fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Direction must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown direction: '" + value
                    + "'. Supported: above, below", e);
        }
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
