package com.metricsentinel.core.channel;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricsentinel.core.model.NotificationPayload;
import com.metricsentinel.core.model.Severity;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chat channel posting to a Slack incoming-webhook URL.
 *
 * @since 1.0.0
 */
public class SlackChannel extends HttpJsonChannel {

    public static final String NAME = "slack";

    public SlackChannel(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
        super(httpClient, objectMapper, requestTimeout);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    protected Object body(NotificationPayload payload) {
        Map<String, Object> attachment = new LinkedHashMap<>();
        attachment.put("color", color(payload.getSeverity()));
        attachment.put("title", payload.getTitle());
        attachment.put("text", payload.getMessage());
        if (payload.isDigest()) {
            attachment.put("footer", payload.getAlertCount() + " alert(s) in this digest");
        }

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("text", emoji(payload.getSeverity()) + " " + payload.getTitle());
        body.put("attachments", List.of(attachment));
        return body;
    }

    private static String color(Severity severity) {
        return switch (severity) {
            case HIGH -> "#d00000";
            case MEDIUM -> "#ffaa00";
            case LOW -> "#439fe0";
        };
    }

    private static String emoji(Severity severity) {
        return switch (severity) {
            case HIGH -> ":rotating_light:";
            case MEDIUM -> ":warning:";
            case LOW -> ":information_source:";
        };
    }
}
