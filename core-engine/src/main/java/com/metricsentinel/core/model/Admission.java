package com.metricsentinel.core.model;

/**
 * Decision taken by the suppression layer for one alert.
 *
 * @since 1.0.0
 */
public enum Admission {
    /** First alert of its window; delivered on its own. */
    NEW,
    /** Collapsed into an open window, muted, or over the daily cap. */
    SUPPRESSED,
    /** Held and delivered as part of a digest. */
    AGGREGATED
}
