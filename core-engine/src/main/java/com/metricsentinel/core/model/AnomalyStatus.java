package com.metricsentinel.core.model;

/**
 * Lifecycle of a canonical {@link Anomaly}.
 *
 * @since 1.0.0
 */
public enum AnomalyStatus {
    NEW,
    SUPPRESSED,
    ALERTED,
    RESOLVED;

    public boolean isActive() {
        return this != RESOLVED;
    }
}
