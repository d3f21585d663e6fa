package com.metricsentinel.core.channel;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricsentinel.core.model.NotificationPayload;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.Objects;

/**
 * Base for channels that POST a JSON document to an HTTP endpoint.
 *
 * <h3>Classification</h3>
 * <ul>
 * <li>2xx - success</li>
 * <li>408, 429, 5xx, I/O errors and timeouts - transient</li>
 * <li>other statuses, malformed URLs and unserialisable bodies - permanent</li>
 * </ul>
 *
 * @since 1.0.0
 */
public abstract class HttpJsonChannel implements NotificationChannel {

    private static final Logger LOG = LoggerFactory.getLogger(HttpJsonChannel.class);
    private static final String CONTENT_TYPE = "application/json";
    private static final int MAX_ERROR_BODY = 200;

    private final HttpClient httpClient;
    protected final ObjectMapper objectMapper;
    private final Duration requestTimeout;

    protected HttpJsonChannel(HttpClient httpClient, ObjectMapper objectMapper, Duration requestTimeout) {
        this.httpClient = Objects.requireNonNull(httpClient, "httpClient must not be null");
        this.objectMapper = Objects.requireNonNull(objectMapper, "objectMapper must not be null");
        this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout must not be null");
    }

    /**
     * @return the document to POST for {@code payload}
     */
    protected abstract Object body(NotificationPayload payload);

    @Override
    public SendResult send(String destination, NotificationPayload payload) {
        URI uri;
        try {
            uri = URI.create(Objects.requireNonNull(destination, "destination"));
            if (uri.getScheme() == null || !uri.getScheme().startsWith("http")) {
                return SendResult.permanentFailure("Not an HTTP destination: " + destination);
            }
        } catch (IllegalArgumentException | NullPointerException e) {
            return SendResult.permanentFailure("Invalid destination '" + destination + "': " + e.getMessage());
        }

        String json;
        try {
            json = objectMapper.writeValueAsString(body(payload));
        } catch (JsonProcessingException e) {
            return SendResult.permanentFailure("Unserialisable payload: " + e.getOriginalMessage());
        }

        HttpRequest request = HttpRequest.newBuilder()
                .uri(uri)
                .header("Content-Type", CONTENT_TYPE)
                .timeout(requestTimeout)
                .POST(HttpRequest.BodyPublishers.ofString(json))
                .build();
        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            return classify(response.statusCode(), response.body());
        } catch (HttpTimeoutException e) {
            return SendResult.transientFailure("Timed out after " + requestTimeout);
        } catch (IOException e) {
            return SendResult.transientFailure("I/O error: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return SendResult.transientFailure("Interrupted");
        }
    }

    static SendResult classify(int status, String body) {
        if (status >= 200 && status < 300) {
            return SendResult.success();
        }
        String detail = "HTTP " + status + abbreviate(body);
        if (status == 408 || status == 429 || status >= 500) {
            LOG.warn("Transient channel failure: {}", detail);
            return SendResult.transientFailure(detail);
        }
        LOG.error("Permanent channel failure: {}", detail);
        return SendResult.permanentFailure(detail);
    }

    private static String abbreviate(String body) {
        if (body == null || body.isBlank()) {
            return "";
        }
        return " - " + (body.length() > MAX_ERROR_BODY ? body.substring(0, MAX_ERROR_BODY) + "..." : body);
    }
}
