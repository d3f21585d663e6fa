package com.metricsentinel.core.detection;

import com.metricsentinel.core.config.DetectionSettings;

import java.util.Objects;
import java.util.Optional;

/**
 * Additive Holt-Winters (triple exponential smoothing) forecaster.
 *
 * <p>
 * Level, trend and season are initialised from the first two seasons and then
 * smoothed over the rest of the history. The interval half-width is
 * {@code forecastIntervalZ} times the population standard deviation of the
 * one-step-ahead residuals.
 * </p>
 *
 * <h3>Warm-up</h3>
 * <p>
 * At least two full seasons of history are required.
 * </p>
 *
 * @since 1.0.0
 */
public class HoltWintersForecaster implements Forecaster {

    private final int seasonLength;
    private final double alpha;
    private final double beta;
    private final double gamma;
    private final double intervalZ;

    public HoltWintersForecaster(DetectionSettings settings) {
        Objects.requireNonNull(settings, "DetectionSettings must not be null");
        this.seasonLength = settings.getSeasonLength();
        this.alpha = settings.getLevelSmoothing();
        this.beta = settings.getTrendSmoothing();
        this.gamma = settings.getSeasonalSmoothing();
        this.intervalZ = settings.getForecastIntervalZ();
    }

    public int minimumHistory() {
        return 2 * seasonLength;
    }

    @Override
    public Optional<Forecast> forecast(double[] history, int horizon) {
        Objects.requireNonNull(history, "history must not be null");
        if (horizon < 1) {
            throw new IllegalArgumentException("horizon must be >= 1, got " + horizon);
        }
        int m = seasonLength;
        if (history.length < minimumHistory()) {
            return Optional.empty();
        }

        // --- Initial components from the first two seasons ---
        double firstMean = 0;
        double secondMean = 0;
        for (int i = 0; i < m; i++) {
            firstMean += history[i];
            secondMean += history[m + i];
        }
        firstMean /= m;
        secondMean /= m;

        double level = firstMean;
        double trend = (secondMean - firstMean) / m;
        double[] season = new double[m];
        for (int i = 0; i < m; i++) {
            season[i] = history[i] - firstMean;
        }

        // --- Smoothing with one-step-ahead residuals from the second season on ---
        double residualSum = 0;
        double residualSq = 0;
        int residualCount = 0;
        for (int t = m; t < history.length; t++) {
            int s = t % m;
            double oneStep = level + trend + season[s];
            double residual = history[t] - oneStep;
            residualSum += residual;
            residualSq += residual * residual;
            residualCount++;

            double previousLevel = level;
            level = alpha * (history[t] - season[s]) + (1 - alpha) * (level + trend);
            trend = beta * (level - previousLevel) + (1 - beta) * trend;
            season[s] = gamma * (history[t] - level) + (1 - gamma) * season[s];
        }

        double residualMean = residualSum / residualCount;
        double variance = Math.max(0.0, residualSq / residualCount - residualMean * residualMean);
        double halfWidth = intervalZ * Math.sqrt(variance);

        int target = history.length - 1 + horizon;
        double predicted = level + horizon * trend + season[target % m];
        return Optional.of(new Forecast(predicted, predicted - halfWidth, predicted + halfWidth));
    }
}
