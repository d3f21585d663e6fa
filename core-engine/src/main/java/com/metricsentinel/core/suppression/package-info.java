/**
 * Dedup windows, digest aggregation and maintenance muting of alerts.
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.suppression;
