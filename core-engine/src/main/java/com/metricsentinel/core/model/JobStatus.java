package com.metricsentinel.core.model;

/**
 * State machine of a {@link NotificationJob}:
 *
 * <pre>
 * QUEUED → IN_FLIGHT → DELIVERED
 *                    → QUEUED (transient failure, retried after backoff)
 *                    → DEAD   (permanent failure or attempts exhausted)
 * </pre>
 *
 * <p>
 * {@code FAILED} marks a job whose last attempt failed transiently and which
 * waits for its {@code nextAttemptAt}; it is claimable exactly like
 * {@code QUEUED}.
 * </p>
 *
 * @since 1.0.0
 */
public enum JobStatus {
    QUEUED,
    IN_FLIGHT,
    DELIVERED,
    FAILED,
    DEAD;

    public boolean isTerminal() {
        return this == DELIVERED || this == DEAD;
    }

    public boolean isClaimable() {
        return this == QUEUED || this == FAILED;
    }
}
