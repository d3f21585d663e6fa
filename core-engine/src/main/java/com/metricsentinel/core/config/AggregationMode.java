package com.metricsentinel.core.config;

import java.util.Locale;

/**
 * How alerts collapsed into a suppression window are delivered.
 *
 * @since 1.0.0
 */
public enum AggregationMode {

    /** Deliver the first alert of a window; drop the rest after counting them. */
    NONE,

    /** Hold every alert of a window and deliver one combined digest. */
    DIGEST;

    public static AggregationMode fromKey(String value) {
        if (value == null || value.isBlank()) {
            return NONE;
        }
        try {
            return valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown aggregation mode: '" + value
                    + "'. Supported: none, digest", e);
        }
    }
}
