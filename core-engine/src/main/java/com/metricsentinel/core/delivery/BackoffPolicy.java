package com.metricsentinel.core.delivery;

import java.time.Duration;

/**
 * Delay before the next delivery attempt.
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface BackoffPolicy {

    /**
     * @param failedAttempts attempts made so far, at least 1
     * @return delay before the next attempt
     */
    Duration delay(int failedAttempts);
}
