package com.metricsentinel.core.channel;

import com.metricsentinel.core.model.DeliveryOutcome;

import java.util.Objects;

/**
 * Outcome of one {@link NotificationChannel#send} call.
 *
 * @since 1.0.0
 */
public final class SendResult {

    private static final SendResult SUCCESS = new SendResult(DeliveryOutcome.SUCCESS, null);

    private final DeliveryOutcome outcome;
    private final String detail;

    private SendResult(DeliveryOutcome outcome, String detail) {
        this.outcome = Objects.requireNonNull(outcome, "outcome must not be null");
        this.detail = detail;
    }

    public static SendResult success() {
        return SUCCESS;
    }

    /** Failure worth retrying: timeouts, throttling, server errors. */
    public static SendResult transientFailure(String detail) {
        return new SendResult(DeliveryOutcome.TRANSIENT_FAILURE, detail);
    }

    /** Failure that no retry will fix: bad destination, rejected request. */
    public static SendResult permanentFailure(String detail) {
        return new SendResult(DeliveryOutcome.PERMANENT_FAILURE, detail);
    }

    public DeliveryOutcome getOutcome() {
        return outcome;
    }

    public boolean isSuccess() {
        return outcome == DeliveryOutcome.SUCCESS;
    }

    public String getDetail() {
        return detail;
    }

    @Override
    public String toString() {
        return detail == null ? outcome.name() : outcome + ": " + detail;
    }
}
