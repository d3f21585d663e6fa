package com.metricsentinel.core.delivery;

import com.metricsentinel.core.model.DeliveryAttempt;
import com.metricsentinel.core.model.NotificationJob;

/**
 * Callbacks from the {@link Dispatcher}, e.g. for metrics. Called on worker
 * threads; implementations must be thread-safe and must not block.
 *
 * @since 1.0.0
 */
public interface DeliveryListener {

    default void onAttempt(NotificationJob job, DeliveryAttempt attempt, long elapsedMillis) {
    }

    default void onDelivered(NotificationJob job) {
    }

    default void onRetryScheduled(NotificationJob job) {
    }

    default void onDead(NotificationJob job) {
    }
}
