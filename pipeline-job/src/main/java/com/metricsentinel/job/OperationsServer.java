package com.metricsentinel.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.metricsentinel.core.delivery.NotificationQueue;
import com.metricsentinel.core.fusion.AnomalyResolver;
import com.metricsentinel.core.model.Alert;
import com.metricsentinel.core.model.AlertStatus;
import com.metricsentinel.core.model.Anomaly;
import com.metricsentinel.core.model.JsonMapping;
import com.metricsentinel.core.model.NotificationJob;
import com.metricsentinel.core.rules.RuleEngine;
import com.metricsentinel.core.store.AlertRepository;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

/**
 * Lightweight HTTP server exposing health checks, Prometheus metrics and the
 * operator actions of the pipeline.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} - {@code 200 {"status":"UP"}}</li>
 * <li>{@code GET /readiness} - {@code 200} once the first run finished,
 * {@code 503} before</li>
 * <li>{@code GET /dead-letters} - dead notification jobs</li>
 * <li>{@code POST /dead-letters/{jobId}/replay} - requeue a dead job</li>
 * <li>{@code POST /anomalies/{id}/resolve} - force-resolve an anomaly</li>
 * <li>{@code POST /alerts/{id}/resolve[?falsePositive=true]} - close an
 * alert</li>
 * <li>{@code GET /rules/rejected} - rules excluded at load</li>
 * <li>{@code GET /metrics} - Prometheus scrape</li>
 * </ul>
 *
 * <p>
 * Uses the JDK built-in {@link HttpServer}.
 * </p>
 *
 * @since 1.0.0
 */
public class OperationsServer {

    private static final Logger LOG = LoggerFactory.getLogger(OperationsServer.class);
    private static final String JSON = "application/json";

    private final NotificationQueue queue;
    private final AnomalyResolver resolver;
    private final AlertRepository alerts;
    private final RuleEngine ruleEngine;
    private final PipelineMetrics metrics;
    private final BooleanSupplier ready;
    private final ObjectMapper mapper = JsonMapping.newMapper();

    private HttpServer server;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public OperationsServer(NotificationQueue queue, AnomalyResolver resolver, AlertRepository alerts,
            RuleEngine ruleEngine, PipelineMetrics metrics, BooleanSupplier ready) {
        this.queue = Objects.requireNonNull(queue, "queue must not be null");
        this.resolver = Objects.requireNonNull(resolver, "resolver must not be null");
        this.alerts = Objects.requireNonNull(alerts, "alerts must not be null");
        this.ruleEngine = Objects.requireNonNull(ruleEngine, "ruleEngine must not be null");
        this.metrics = Objects.requireNonNull(metrics, "metrics must not be null");
        this.ready = Objects.requireNonNull(ready, "ready must not be null");
    }

    /**
     * Start the server.
     *
     * @param port TCP port to bind to, in [0, 65535]; 0 picks a free port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Operations port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", guarded(this::handleHealth));
            server.createContext("/readiness", guarded(this::handleReadiness));
            server.createContext("/dead-letters", guarded(this::handleDeadLetters));
            server.createContext("/anomalies/", guarded(this::handleAnomalyResolve));
            server.createContext("/alerts/", guarded(this::handleAlertResolve));
            server.createContext("/rules/rejected", guarded(this::handleRejectedRules));
            server.createContext("/metrics", guarded(this::handleMetrics));

            server.setExecutor(Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "operations-server");
                t.setDaemon(true);
                return t;
            }));

            server.start();
            running.set(true);
            LOG.info("Operations server started on port {}", getPort());
        } catch (IOException e) {
            LOG.error("Failed to start operations server on port {}: {}", port, e.getMessage(), e);
        }
    }

    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            LOG.info("Operations server stopped");
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return the bound port, or -1 if not running
     */
    public int getPort() {
        return server != null && running.get() ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private void handleHealth(HttpExchange exchange) throws IOException {
        if (requireMethod(exchange, "GET")) {
            respond(exchange, 200, JSON, "{\"status\":\"UP\"}");
        }
    }

    private void handleReadiness(HttpExchange exchange) throws IOException {
        if (!requireMethod(exchange, "GET")) {
            return;
        }
        if (ready.getAsBoolean()) {
            respond(exchange, 200, JSON, "{\"status\":\"READY\"}");
        } else {
            respond(exchange, 503, JSON, "{\"status\":\"STARTING\"}");
        }
    }

    /** {@code GET /dead-letters} and {@code POST /dead-letters/{jobId}/replay}. */
    private void handleDeadLetters(HttpExchange exchange) throws IOException {
        String[] parts = segments(exchange);
        if (parts.length == 1) {
            if (requireMethod(exchange, "GET")) {
                respondJson(exchange, 200, queue.deadLetters());
            }
            return;
        }
        if (parts.length == 3 && "replay".equals(parts[2])) {
            if (!requireMethod(exchange, "POST")) {
                return;
            }
            Optional<NotificationJob> replayed = queue.replay(parts[1]);
            if (replayed.isPresent()) {
                respondJson(exchange, 200, replayed.get());
            } else {
                respondError(exchange, 404, "No dead job '" + parts[1] + "'");
            }
            return;
        }
        respondError(exchange, 404, "Not found");
    }

    /** {@code POST /anomalies/{id}/resolve}. */
    private void handleAnomalyResolve(HttpExchange exchange) throws IOException {
        String[] parts = segments(exchange);
        if (parts.length != 3 || !"resolve".equals(parts[2])) {
            respondError(exchange, 404, "Not found");
            return;
        }
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        Optional<Anomaly> resolved = resolver.forceResolve(parts[1]);
        if (resolved.isPresent()) {
            respondJson(exchange, 200, resolved.get());
        } else {
            respondError(exchange, 404, "No active anomaly '" + parts[1] + "'");
        }
    }

    /** {@code POST /alerts/{id}/resolve[?falsePositive=true]}. */
    private void handleAlertResolve(HttpExchange exchange) throws IOException {
        String[] parts = segments(exchange);
        if (parts.length != 3 || !"resolve".equals(parts[2])) {
            respondError(exchange, 404, "Not found");
            return;
        }
        if (!requireMethod(exchange, "POST")) {
            return;
        }
        String query = exchange.getRequestURI().getQuery();
        boolean falsePositive = query != null && query.contains("falsePositive=true");
        AlertStatus status = falsePositive ? AlertStatus.FALSE_POSITIVE : AlertStatus.RESOLVED;
        Optional<Alert> updated = alerts.updateStatus(parts[1], status);
        if (updated.isPresent()) {
            LOG.info("Alert {} closed as {}", parts[1], status);
            respondJson(exchange, 200, updated.get());
        } else {
            respondError(exchange, 404, "No alert '" + parts[1] + "'");
        }
    }

    private void handleRejectedRules(HttpExchange exchange) throws IOException {
        if (requireMethod(exchange, "GET")) {
            respondJson(exchange, 200, ruleEngine.rejectedRules());
        }
    }

    private void handleMetrics(HttpExchange exchange) throws IOException {
        if (requireMethod(exchange, "GET")) {
            respond(exchange, 200, "text/plain; version=0.0.4; charset=utf-8", metrics.scrape());
        }
    }

    // ---------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------

    private static HttpHandler guarded(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (RuntimeException e) {
                LOG.error("Operations request {} {} failed: {}", exchange.getRequestMethod(),
                        exchange.getRequestURI(), e.getMessage(), e);
                respond(exchange, 500, JSON, "{\"error\":\"internal error\"}");
            } finally {
                exchange.close();
            }
        };
    }

    private static String[] segments(HttpExchange exchange) {
        String path = exchange.getRequestURI().getPath();
        String trimmed = path.replaceAll("^/+|/+$", "");
        return trimmed.isEmpty() ? new String[0] : trimmed.split("/");
    }

    private static boolean requireMethod(HttpExchange exchange, String method) throws IOException {
        if (method.equalsIgnoreCase(exchange.getRequestMethod())) {
            return true;
        }
        exchange.getResponseHeaders().set("Allow", method);
        respond(exchange, 405, JSON, "{\"error\":\"method not allowed\"}");
        return false;
    }

    private void respondJson(HttpExchange exchange, int status, Object body) throws IOException {
        String json;
        try {
            json = mapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialise response: " + e.getMessage(), e);
        }
        respond(exchange, status, JSON, json);
    }

    private void respondError(HttpExchange exchange, int status, String message) throws IOException {
        respondJson(exchange, status, Map.of("error", message));
    }

    private static void respond(HttpExchange exchange, int status, String contentType, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }
}
