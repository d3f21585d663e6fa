/**
 * Domain model classes for Metric Sentinel.
 *
 * <p>
 * This package contains the records shared by every pipeline stage:
 * </p>
 * <ul>
 * <li>{@link com.metricsentinel.core.model.MetricPoint} - one daily
 * observation</li>
 * <li>{@link com.metricsentinel.core.model.AnomalyCandidate} - a single
 * detector's opinion</li>
 * <li>{@link com.metricsentinel.core.model.Anomaly} - canonical fused
 * finding</li>
 * <li>{@link com.metricsentinel.core.model.Alert} - one rule match</li>
 * <li>{@link com.metricsentinel.core.model.Suppression} - open dedup
 * window</li>
 * <li>{@link com.metricsentinel.core.model.NotificationJob} and
 * {@link com.metricsentinel.core.model.DeliveryAttempt} - delivery work and
 * its audit log</li>
 * </ul>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.model;
