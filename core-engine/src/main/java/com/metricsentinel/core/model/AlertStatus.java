package com.metricsentinel.core.model;

/**
 * Status of an {@link Alert}. The status is the only attribute of an alert
 * that changes after creation.
 *
 * @since 1.0.0
 */
public enum AlertStatus {
    /** Created by the rule engine, not yet admitted. */
    OPEN,
    /** Admitted as new; notification jobs were queued. */
    NOTIFIED,
    /** Held for a digest notification. */
    AGGREGATED,
    /** Collapsed into an existing suppression window or muted. */
    SUPPRESSED,
    RESOLVED,
    FALSE_POSITIVE
}
