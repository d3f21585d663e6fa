package com.metricsentinel.core.delivery;

import com.metricsentinel.core.config.DeliverySettings;

import java.time.Duration;
import java.util.Objects;
import java.util.Random;

/**
 * {@code min(cap, base * 2^(n-1))}, shortened by up to {@code jitter} of itself
 * at random so that jobs failing together do not retry together.
 *
 * @since 1.0.0
 */
public class ExponentialBackoff implements BackoffPolicy {

    private final Duration base;
    private final Duration cap;
    private final double jitter;
    private final Random random;

    public ExponentialBackoff(Duration base, Duration cap, double jitter, Random random) {
        this.base = Objects.requireNonNull(base, "base must not be null");
        this.cap = Objects.requireNonNull(cap, "cap must not be null");
        if (base.isNegative() || base.isZero() || cap.compareTo(base) < 0) {
            throw new IllegalArgumentException("Require 0 < base <= cap, got base=" + base + ", cap=" + cap);
        }
        if (jitter < 0 || jitter >= 1) {
            throw new IllegalArgumentException("jitter must be in [0, 1), got " + jitter);
        }
        this.jitter = jitter;
        this.random = Objects.requireNonNull(random, "random must not be null");
    }

    public static ExponentialBackoff from(DeliverySettings settings) {
        return new ExponentialBackoff(settings.backoffBase(), settings.backoffCap(), settings.getBackoffJitter(),
                new Random());
    }

    @Override
    public Duration delay(int failedAttempts) {
        if (failedAttempts < 1) {
            throw new IllegalArgumentException("failedAttempts must be >= 1, got " + failedAttempts);
        }
        long baseMillis = base.toMillis();
        long capMillis = cap.toMillis();
        int shift = Math.min(failedAttempts - 1, 30);
        long raw = baseMillis > (capMillis >> shift) ? capMillis : Math.min(capMillis, baseMillis << shift);
        double factor;
        synchronized (random) {
            factor = 1.0 - jitter * random.nextDouble();
        }
        return Duration.ofMillis(Math.max(1L, Math.round(raw * factor)));
    }
}
