package com.metricsentinel.core.suppression;

import com.metricsentinel.core.model.Admission;
import com.metricsentinel.core.model.NotificationJob;
import com.metricsentinel.core.model.Suppression;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link SuppressionManager#admit}.
 *
 * @since 1.0.0
 */
public final class AdmissionResult {

    private final Admission admission;
    private final Suppression suppression;
    private final List<NotificationJob> enqueuedJobs;
    private final String reason;

    AdmissionResult(Admission admission, Suppression suppression, List<NotificationJob> enqueuedJobs,
            String reason) {
        this.admission = Objects.requireNonNull(admission, "admission must not be null");
        this.suppression = suppression;
        this.enqueuedJobs = enqueuedJobs != null ? List.copyOf(enqueuedJobs) : List.of();
        this.reason = reason;
    }

    public Admission getAdmission() {
        return admission;
    }

    /**
     * @return the dedup window after admission; empty when the alert was muted
     *         without touching a window
     */
    public Optional<Suppression> getSuppression() {
        return Optional.ofNullable(suppression);
    }

    /**
     * @return jobs newly enqueued by this admission, including a burst digest
     */
    public List<NotificationJob> getEnqueuedJobs() {
        return enqueuedJobs;
    }

    public String getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "AdmissionResult{" +
                "admission=" + admission +
                ", jobs=" + enqueuedJobs.size() +
                ", reason='" + reason + '\'' +
                '}';
    }
}
