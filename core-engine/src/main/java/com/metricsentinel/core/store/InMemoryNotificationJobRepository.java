package com.metricsentinel.core.store;

import com.metricsentinel.core.model.JobStatus;
import com.metricsentinel.core.model.NotificationJob;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * {@link NotificationJobRepository} held in memory. Every operation is
 * {@code synchronized}, which makes claiming atomic across dispatcher workers.
 *
 * <p>
 * Subclasses persist state by overriding {@link #afterMutation()}, which is
 * called while the lock is held after every change.
 * </p>
 *
 * @since 1.0.0
 */
public class InMemoryNotificationJobRepository implements NotificationJobRepository {

    static final Comparator<NotificationJob> CLAIM_ORDER = Comparator
            .comparing(NotificationJob::getSeverity, Comparator.reverseOrder())
            .thenComparing(NotificationJob::getCreatedAt)
            .thenComparing(NotificationJob::getId);

    private final Map<String, NotificationJob> jobs = new LinkedHashMap<>();
    private final Map<String, String> idsByDeliveryKey = new HashMap<>();

    @Override
    public synchronized boolean insertIfAbsent(NotificationJob job) {
        Objects.requireNonNull(job, "job must not be null");
        if (idsByDeliveryKey.containsKey(job.deliveryKey()) || jobs.containsKey(job.getId())) {
            return false;
        }
        put(job.copy());
        afterMutation();
        return true;
    }

    @Override
    public synchronized List<NotificationJob> claimDue(Instant now, int limit) {
        List<NotificationJob> due = jobs.values().stream()
                .filter(j -> j.isDue(now))
                .sorted(CLAIM_ORDER)
                .limit(limit)
                .toList();
        if (due.isEmpty()) {
            return List.of();
        }
        List<NotificationJob> claimed = new ArrayList<>(due.size());
        for (NotificationJob job : due) {
            job.setStatus(JobStatus.IN_FLIGHT);
            job.setUpdatedAt(now);
            claimed.add(job.copy());
        }
        afterMutation();
        return claimed;
    }

    @Override
    public synchronized void update(NotificationJob job) {
        Objects.requireNonNull(job, "job must not be null");
        if (!jobs.containsKey(job.getId())) {
            throw new IllegalArgumentException("Unknown notification job: " + job.getId());
        }
        jobs.put(job.getId(), job.copy());
        afterMutation();
    }

    @Override
    public synchronized Optional<NotificationJob> findById(String id) {
        NotificationJob job = jobs.get(id);
        return job != null ? Optional.of(job.copy()) : Optional.empty();
    }

    @Override
    public synchronized List<NotificationJob> findByStatus(JobStatus status) {
        return jobs.values().stream()
                .filter(j -> j.getStatus() == status)
                .map(NotificationJob::copy)
                .toList();
    }

    @Override
    public synchronized List<NotificationJob> findAll() {
        return jobs.values().stream().map(NotificationJob::copy).toList();
    }

    @Override
    public synchronized int recoverInFlight(Instant now) {
        int recovered = 0;
        for (NotificationJob job : jobs.values()) {
            if (job.getStatus() == JobStatus.IN_FLIGHT) {
                job.setStatus(JobStatus.QUEUED);
                job.setNextAttemptAt(now);
                job.setUpdatedAt(now);
                recovered++;
            }
        }
        if (recovered > 0) {
            afterMutation();
        }
        return recovered;
    }

    /**
     * Replace the whole content, e.g. from a journal. Caller holds the lock.
     */
    protected void restore(Collection<NotificationJob> restored) {
        jobs.clear();
        idsByDeliveryKey.clear();
        restored.forEach(this::put);
    }

    /**
     * @return live view of all jobs; caller holds the lock
     */
    protected Collection<NotificationJob> snapshot() {
        return jobs.values();
    }

    /**
     * Hook called with the lock held after each change.
     */
    protected void afterMutation() {
    }

    private void put(NotificationJob job) {
        jobs.put(job.getId(), job);
        idsByDeliveryKey.put(job.deliveryKey(), job.getId());
    }
}
