package com.metricsentinel.core.delivery;

import com.metricsentinel.core.model.JobStatus;
import com.metricsentinel.core.model.NotificationJob;
import com.metricsentinel.core.store.NotificationJobRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Prioritised, durable queue of {@link NotificationJob}s.
 *
 * <h3>State machine</h3>
 * 
 * <pre>
 * QUEUED ──claim──▶ IN_FLIGHT ──success──▶ DELIVERED
 *                       │ ──transient──▶ FAILED (waits for nextAttemptAt, claimable again)
 *                       │ ──permanent / budget spent──▶ DEAD
 * DEAD ──replay──▶ QUEUED
 * </pre>
 *
 * <p>
 * A job never leaves the repository: DELIVERED and DEAD are terminal states,
 * so nothing enqueued is silently lost.
 * </p>
 *
 * @since 1.0.0
 */
public class NotificationQueue {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationQueue.class);

    private final NotificationJobRepository repository;
    private final Clock clock;

    public NotificationQueue(NotificationJobRepository repository, Clock clock) {
        this.repository = Objects.requireNonNull(repository, "repository must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
    }

    /**
     * @return {@code true} if enqueued, {@code false} if a job for the same
     *         alert and channel already exists
     */
    public boolean enqueue(NotificationJob job) {
        Objects.requireNonNull(job, "job must not be null");
        boolean added = repository.insertIfAbsent(job);
        if (added) {
            LOG.debug("Enqueued job {} ({} -> {}, {})", job.getId(), job.getAlertId(), job.getChannel(),
                    job.getSeverity().key());
        } else {
            LOG.trace("Job for {} already exists - not enqueued again", job.deliveryKey());
        }
        return added;
    }

    /**
     * Claim due jobs, highest severity first, then oldest first.
     */
    public List<NotificationJob> claimDue(int limit) {
        if (limit < 1) {
            return List.of();
        }
        return repository.claimDue(clock.instant(), limit);
    }

    public void markDelivered(NotificationJob job) {
        transition(job, JobStatus.DELIVERED, null, null);
    }

    public void scheduleRetry(NotificationJob job, Instant nextAttemptAt, String error) {
        transition(job, JobStatus.FAILED, nextAttemptAt, error);
    }

    public void markDead(NotificationJob job, String error) {
        transition(job, JobStatus.DEAD, null, error);
    }

    private void transition(NotificationJob job, JobStatus status, Instant nextAttemptAt, String error) {
        NotificationJob next = job.copy();
        next.setStatus(status);
        next.setUpdatedAt(clock.instant());
        if (nextAttemptAt != null) {
            next.setNextAttemptAt(nextAttemptAt);
        }
        if (error != null) {
            next.setLastError(error);
        }
        repository.update(next);
    }

    /**
     * @return dead jobs, most recently updated first
     */
    public List<NotificationJob> deadLetters() {
        return repository.findByStatus(JobStatus.DEAD).stream()
                .sorted(Comparator.comparing(NotificationJob::getUpdatedAt,
                        Comparator.nullsLast(Comparator.reverseOrder())))
                .toList();
    }

    /**
     * Requeue a dead job with a fresh attempt budget.
     *
     * @return the requeued job, or empty if the job is unknown or not dead
     */
    public synchronized Optional<NotificationJob> replay(String jobId) {
        Optional<NotificationJob> found = repository.findById(jobId);
        if (found.isEmpty() || found.get().getStatus() != JobStatus.DEAD) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        NotificationJob job = found.get();
        job.setStatus(JobStatus.QUEUED);
        job.setAttempts(0);
        job.setNextAttemptAt(now);
        job.setUpdatedAt(now);
        repository.update(job);
        LOG.info("Replayed dead job {} ({} -> {})", job.getId(), job.getAlertId(), job.getChannel());
        return Optional.of(job);
    }

    /**
     * Return jobs left in flight by an unclean stop to the queue.
     */
    public int recoverInFlight() {
        int recovered = repository.recoverInFlight(clock.instant());
        if (recovered > 0) {
            LOG.warn("Recovered {} job(s) left in flight", recovered);
        }
        return recovered;
    }

    public List<NotificationJob> findByStatus(JobStatus status) {
        return repository.findByStatus(status);
    }

    public Optional<NotificationJob> findById(String jobId) {
        return repository.findById(jobId);
    }

    /**
     * @return jobs not yet in a terminal state
     */
    public long pendingCount() {
        return repository.findAll().stream().filter(j -> !j.getStatus().isTerminal()).count();
    }
}
