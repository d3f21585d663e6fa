package com.metricsentinel.core.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricsentinel.core.model.NotificationPayload;

import java.net.http.HttpClient;
import java.time.Duration;

/**
 * Generic webhook: POSTs the {@link NotificationPayload} itself as JSON.
 *
 * @since 1.0.0
 */
public class WebhookChannel extends HttpJsonChannel {

    public static final String NAME = "webhook";

    public WebhookChannel(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
        super(httpClient, objectMapper, requestTimeout);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Object body(NotificationPayload payload) {
        return payload;
    }
}
