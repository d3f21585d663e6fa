/**
 * Outbound channel adapters: chat (Slack), generic webhook and e-mail.
 *
 * <p>
 * Every adapter implements
 * {@link com.metricsentinel.core.channel.NotificationChannel} and classifies
 * its failures as transient or permanent instead of throwing.
 * </p>
 *
 * @since 1.0.0
 */
package com.metricsentinel.core.channel;
