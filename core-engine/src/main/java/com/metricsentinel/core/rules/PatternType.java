package com.metricsentinel.core.rules;

import java.util.Locale;

/**
 * Temporal patterns recognised by {@code pattern} rules.
 *
 * @since 1.0.0
 */
public enum PatternType {

    /** Every one of the last {@code duration} values is below its predecessor. */
    CONSECUTIVE_DECLINE,

    /** Every one of the last {@code duration} values is above its predecessor. */
    CONSECUTIVE_GROWTH,

    /**
     * The trend of the last {@code duration} values is opposite to the trend of
     * the {@code duration} values before them.
     */
    TREND_REVERSAL;

    /**
     * @param value pattern name such as {@code consecutive_decline}
     * @return the pattern
     * @throws IllegalArgumentException if the value is blank or unknown
     */
    public static PatternType fromKey(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Pattern must not be blank");
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown pattern: '" + value
                    + "'. Supported: consecutive_decline, consecutive_growth, trend_reversal", e);
        }
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }
}
