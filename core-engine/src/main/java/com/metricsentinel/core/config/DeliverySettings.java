package com.metricsentinel.core.config;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Retry, backoff and worker-pool settings of the notification dispatcher.
 *
 * @since 1.0.0
 */
public class DeliverySettings implements Serializable {

    private static final long serialVersionUID = 1L;

    private int maxAttempts = 5;
    private long backoffBaseSeconds = 30;
    private long backoffCapSeconds = 3600;
    private double backoffJitter = 0.2;
    private int workerPoolSize = 4;
    private long sendTimeoutSeconds = 10;
    private long pollIntervalSeconds = 5;
    private int batchSize = 50;

    void collectErrors(List<String> errors) {
        if (maxAttempts < 1) {
            errors.add("delivery.maxAttempts must be >= 1");
        }
        if (backoffBaseSeconds < 1) {
            errors.add("delivery.backoffBaseSeconds must be >= 1");
        }
        if (backoffCapSeconds < backoffBaseSeconds) {
            errors.add("delivery.backoffCapSeconds must be >= backoffBaseSeconds");
        }
        if (backoffJitter < 0 || backoffJitter >= 1) {
            errors.add("delivery.backoffJitter must be in [0, 1)");
        }
        if (workerPoolSize < 1) {
            errors.add("delivery.workerPoolSize must be >= 1");
        }
        if (sendTimeoutSeconds < 1) {
            errors.add("delivery.sendTimeoutSeconds must be >= 1");
        }
        if (pollIntervalSeconds < 1) {
            errors.add("delivery.pollIntervalSeconds must be >= 1");
        }
        if (batchSize < 1) {
            errors.add("delivery.batchSize must be >= 1");
        }
    }

    public Duration backoffBase() {
        return Duration.ofSeconds(backoffBaseSeconds);
    }

    public Duration backoffCap() {
        return Duration.ofSeconds(backoffCapSeconds);
    }

    public Duration sendTimeout() {
        return Duration.ofSeconds(sendTimeoutSeconds);
    }

    public Duration pollInterval() {
        return Duration.ofSeconds(pollIntervalSeconds);
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public void setMaxAttempts(int maxAttempts) {
        this.maxAttempts = maxAttempts;
    }

    public long getBackoffBaseSeconds() {
        return backoffBaseSeconds;
    }

    public void setBackoffBaseSeconds(long backoffBaseSeconds) {
        this.backoffBaseSeconds = backoffBaseSeconds;
    }

    public long getBackoffCapSeconds() {
        return backoffCapSeconds;
    }

    public void setBackoffCapSeconds(long backoffCapSeconds) {
        this.backoffCapSeconds = backoffCapSeconds;
    }

    public double getBackoffJitter() {
        return backoffJitter;
    }

    public void setBackoffJitter(double backoffJitter) {
        this.backoffJitter = backoffJitter;
    }

    public int getWorkerPoolSize() {
        return workerPoolSize;
    }

    public void setWorkerPoolSize(int workerPoolSize) {
        this.workerPoolSize = workerPoolSize;
    }

    public long getSendTimeoutSeconds() {
        return sendTimeoutSeconds;
    }

    public void setSendTimeoutSeconds(long sendTimeoutSeconds) {
        this.sendTimeoutSeconds = sendTimeoutSeconds;
    }

    public long getPollIntervalSeconds() {
        return pollIntervalSeconds;
    }

    public void setPollIntervalSeconds(long pollIntervalSeconds) {
        this.pollIntervalSeconds = pollIntervalSeconds;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }
}
