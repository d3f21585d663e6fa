package com.metricsentinel.core.model;

import java.util.Locale;

/**
 * Ordered severity scale shared by anomalies, alerts and notification jobs.
 * Declaration order is significant: {@link #compareTo} ranks
 * {@code HIGH} above {@code LOW}.
 *
 * @since 1.0.0
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH;

    public boolean isAtLeast(Severity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parse a configuration value such as {@code medium}.
     *
     * @param value case-insensitive severity name
     * @return the severity
     * @throws IllegalArgumentException if the value is blank or unknown
     */
    public static Severity fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Severity must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown severity: '" + value
                    + "'. Supported: low, medium, high", e);
        }
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
