/**
 * Runnable pipeline job: configuration from the environment, scheduling,
 * metrics and the operations HTTP endpoints.
 *
 * @since 1.0.0
 */
package com.metricsentinel.job;
