package com.metricsentinel.core.pipeline;

import java.util.concurrent.CancellationException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Cooperative cancellation flag for a pipeline run, checked between stages.
 *
 * @since 1.0.0
 */
public final class CancellationToken {

    private final AtomicBoolean cancelled = new AtomicBoolean();

    public static CancellationToken none() {
        return new CancellationToken();
    }

    public void cancel() {
        cancelled.set(true);
    }

    public boolean isCancelled() {
        return cancelled.get();
    }

    /**
     * @param stage the stage about to start, for the exception message
     * @throws CancellationException if {@link #cancel()} was called
     */
    public void throwIfCancelled(String stage) {
        if (cancelled.get()) {
            throw new CancellationException("Run cancelled before " + stage);
        }
    }
}
