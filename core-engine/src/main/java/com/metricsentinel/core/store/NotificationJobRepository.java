package com.metricsentinel.core.store;

import com.metricsentinel.core.model.JobStatus;
import com.metricsentinel.core.model.NotificationJob;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Durable home of {@link NotificationJob}s.
 *
 * <p>
 * Implementations guarantee at most one job per
 * {@link NotificationJob#deliveryKey() (alert id, channel)} and hand out
 * copies only.
 * </p>
 *
 * @since 1.0.0
 */
public interface NotificationJobRepository {

    /**
     * @return {@code true} if stored, {@code false} if a job with the same
     *         delivery key already exists
     */
    boolean insertIfAbsent(NotificationJob job);

    /**
     * Atomically move up to {@code limit} due jobs to
     * {@link JobStatus#IN_FLIGHT}, highest severity first, then oldest first.
     *
     * @return the claimed jobs in claim order
     */
    List<NotificationJob> claimDue(Instant now, int limit);

    /**
     * Replace the stored job with the same id.
     *
     * @throws IllegalArgumentException if no job has this id
     */
    void update(NotificationJob job);

    Optional<NotificationJob> findById(String id);

    List<NotificationJob> findByStatus(JobStatus status);

    List<NotificationJob> findAll();

    /**
     * Return every {@link JobStatus#IN_FLIGHT} job to {@link JobStatus#QUEUED},
     * due immediately. Used at start-up after an unclean stop.
     *
     * @return number of recovered jobs
     */
    int recoverInFlight(Instant now);
}
