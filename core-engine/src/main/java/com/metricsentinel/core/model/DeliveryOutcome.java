package com.metricsentinel.core.model;

/**
 * Result classification of a single channel send.
 *
 * @since 1.0.0
 */
public enum DeliveryOutcome {
    SUCCESS,
    TRANSIENT_FAILURE,
    PERMANENT_FAILURE
}
