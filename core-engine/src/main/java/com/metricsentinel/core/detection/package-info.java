/**
 * Anomaly detection methods for daily metric series.
 *
 * <p>
 * Three independent detectors implement
 * {@link com.metricsentinel.core.detection.AnomalyDetector}:
 * </p>
 * <ul>
 * <li>{@link com.metricsentinel.core.detection.StatisticalBaselineDetector}
 * - trailing z-score</li>
 * <li>{@link com.metricsentinel.core.detection.OutlierClassifierDetector}
 * - multivariate outlier score via an
 * {@link com.metricsentinel.core.detection.OutlierScorer}</li>
 * <li>{@link com.metricsentinel.core.detection.ForecastDeviationDetector}
 * - Holt-Winters prediction interval</li>
 * </ul>
 *
 * <p>
 * Use {@link com.metricsentinel.core.detection.DetectorFactory} to create
 * them from configuration.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.detection;
