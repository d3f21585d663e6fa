package com.metricsentinel.core.rules;

import com.metricsentinel.core.model.Severity;

import java.time.LocalDate;
import java.util.Map;

/**
 * Input of one rule-engine evaluation.
 *
 * @since 1.0.0
 */
public interface Trigger {

    String getEntityId();

    String getMetric();

    /** Date the trigger refers to: the anomaly date or the latest metric date. */
    LocalDate getDate();

    /**
     * Stable identity of the trigger. Combined with a rule id it yields the
     * alert id, so re-evaluating the same trigger never creates a second alert.
     *
     * @return the trigger key
     */
    String key();

    /** Severity an alert inherits when its rule sets none. */
    Severity getSeverity();

    /**
     * @return values copied into the alert's metrics snapshot
     */
    Map<String, Object> snapshot();
}
