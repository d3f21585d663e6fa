/**
 * Notification queue, dispatcher and retry policy.
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.delivery;
