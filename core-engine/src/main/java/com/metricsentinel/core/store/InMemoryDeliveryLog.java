package com.metricsentinel.core.store;

import com.metricsentinel.core.model.DeliveryAttempt;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * {@link DeliveryLog} held in memory.
 *
 * @since 1.0.0
 */
public class InMemoryDeliveryLog implements DeliveryLog {

    private final List<DeliveryAttempt> attempts = new CopyOnWriteArrayList<>();

    @Override
    public void append(DeliveryAttempt attempt) {
        attempts.add(Objects.requireNonNull(attempt, "attempt must not be null"));
    }

    @Override
    public List<DeliveryAttempt> attemptsFor(String jobId) {
        return attempts.stream().filter(a -> a.getJobId().equals(jobId)).toList();
    }

    @Override
    public List<DeliveryAttempt> all() {
        return List.copyOf(attempts);
    }
}
