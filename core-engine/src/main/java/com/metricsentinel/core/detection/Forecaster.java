package com.metricsentinel.core.detection;

import java.util.Optional;

/**
 * Produces a forecast with a prediction interval from an evenly spaced daily
 * history.
 *
 * @since 1.0.0
 */
public interface Forecaster {

    /**
     * @param history daily values, oldest first, without gaps
     * @param horizon steps ahead of the last history value, at least 1
     * @return the forecast, or empty if the history is too short
     */
    Optional<Forecast> forecast(double[] history, int horizon);
}
