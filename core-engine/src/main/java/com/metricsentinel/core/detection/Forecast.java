package com.metricsentinel.core.detection;

import java.io.Serializable;

/**
 * Point forecast with its prediction interval.
 *
 * @since 1.0.0
 */
public final class Forecast implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double predicted;
    private final double lower;
    private final double upper;

    public Forecast(double predicted, double lower, double upper) {
        if (lower > upper) {
            throw new IllegalArgumentException("lower bound " + lower + " exceeds upper bound " + upper);
        }
        this.predicted = predicted;
        this.lower = lower;
        this.upper = upper;
    }

    public boolean contains(double value) {
        return value >= lower && value <= upper;
    }

    public double width() {
        return upper - lower;
    }

    public double getPredicted() {
        return predicted;
    }

    public double getLower() {
        return lower;
    }

    public double getUpper() {
        return upper;
    }

    @Override
    public String toString() {
        return "Forecast{" + predicted + " in [" + lower + ", " + upper + "]}";
    }
}
