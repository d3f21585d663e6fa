package com.metricsentinel.core.channel;

import com.metricsentinel.core.model.NotificationPayload;

/**
 * Adapter to one outbound channel.
 *
 * <p>
 * Expected failures are reported through the returned {@link SendResult},
 * never thrown. Implementations must be thread-safe: dispatcher workers call
 * {@link #send} concurrently.
 * </p>
 *
 * @since 1.0.0
 */
public interface NotificationChannel {

    /**
     * @return the channel name rules refer to, e.g. {@code slack}
     */
    String name();

    /**
     * @param destination channel specific address: URL, e-mail address
     * @param payload     rendered notification
     * @return the classified outcome
     */
    SendResult send(String destination, NotificationPayload payload);
}
