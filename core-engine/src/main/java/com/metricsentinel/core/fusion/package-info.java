/**
 * Fusion of detector candidates into canonical anomalies and their
 * resolution.
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.fusion;
