package com.metricsentinel.core.store;

import com.metricsentinel.core.model.DeliveryAttempt;

import java.util.List;

/**
 * Append-only record of delivery attempts.
 *
 * @since 1.0.0
 */
public interface DeliveryLog {

    void append(DeliveryAttempt attempt);

    /** Attempts of one job in append order. */
    List<DeliveryAttempt> attemptsFor(String jobId);

    List<DeliveryAttempt> all();
}
