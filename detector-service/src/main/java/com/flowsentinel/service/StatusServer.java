package com.flowsentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.flowsentinel.core.detection.DetectionOrchestrator;
import com.flowsentinel.core.model.Anomaly;
import com.flowsentinel.core.store.AnomalyJson;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Lightweight HTTP server exposing liveness and the most recent anomalies.
 *
 * <h3>Endpoints</h3>
 * <ul>
 * <li>{@code GET /health} – {@code {"status":"UP"}}</li>
 * <li>{@code GET /readiness} – same; readiness probe target</li>
 * <li>{@code GET /api/anomalies?limit=N} – the {@code N} most recent
 * anomalies (default {@value #DEFAULT_LIMIT}), oldest first, with the stored
 * and processed totals</li>
 * </ul>
 *
 * <p>
 * Reads go through {@link DetectionOrchestrator#snapshot(int)}, so a request
 * never blocks detection for longer than one copy of the buffer.
 * </p>
 *
 * @since 1.0.0
 */
public class StatusServer {

    private static final Logger LOG = LoggerFactory.getLogger(StatusServer.class);
    private static final byte[] HEALTH_RESPONSE = "{\"status\":\"UP\"}".getBytes(StandardCharsets.UTF_8);

    static final int DEFAULT_LIMIT = 50;

    private final DetectionOrchestrator orchestrator;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private HttpServer server;
    private ExecutorService executor;

    public StatusServer(DetectionOrchestrator orchestrator) {
        this.orchestrator = Objects.requireNonNull(orchestrator, "DetectionOrchestrator must not be null");
    }

    /**
     * Start the server.
     *
     * @param port TCP port to bind to; {@code 0} picks an ephemeral port
     * @throws IllegalArgumentException if port is out of range
     */
    public void start(int port) {
        if (port < 0 || port > 65_535) {
            throw new IllegalArgumentException(
                    "Status port must be in range [0, 65535], got: " + port);
        }
        try {
            server = HttpServer.create(new InetSocketAddress(port), 0);
            server.createContext("/health", StatusServer::handleHealthCheck);
            server.createContext("/readiness", StatusServer::handleHealthCheck);
            server.createContext("/api/anomalies", this::handleAnomalies);

            executor = Executors.newSingleThreadExecutor(r -> {
                Thread t = new Thread(r, "status-server");
                t.setDaemon(true);
                return t;
            });
            server.setExecutor(executor);

            server.start();
            running.set(true);
            LOG.info("Status server started on port {}", server.getAddress().getPort());
        } catch (IOException e) {
            LOG.error("Failed to start status server on port {}: {}", port, e.getMessage(), e);
        }
    }

    /**
     * Stop the server gracefully.
     */
    public void stop() {
        if (server != null && running.compareAndSet(true, false)) {
            server.stop(0);
            executor.shutdownNow();
            LOG.info("Status server stopped");
        }
    }

    /**
     * @return {@code true} if the server is currently running
     */
    public boolean isRunning() {
        return running.get();
    }

    /**
     * @return bound port, or {@code -1} if not running
     */
    public int getPort() {
        return running.get() ? server.getAddress().getPort() : -1;
    }

    // ---------------------------------------------------------------
    // Handlers
    // ---------------------------------------------------------------

    private static void handleHealthCheck(HttpExchange exchange) throws IOException {
        respond(exchange, 200, HEALTH_RESPONSE);
    }

    private void handleAnomalies(HttpExchange exchange) throws IOException {
        if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
            respond(exchange, 405, error("Method not allowed"));
            return;
        }
        int limit;
        try {
            limit = parseLimit(exchange.getRequestURI().getRawQuery());
        } catch (IllegalArgumentException e) {
            respond(exchange, 400, error(e.getMessage()));
            return;
        }

        List<Anomaly> anomalies = orchestrator.snapshot(limit);
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("anomalies", anomalies);
        body.put("total", orchestrator.anomalyCount());
        body.put("processed", orchestrator.totalProcessed());
        respond(exchange, 200, AnomalyJson.mapper().writeValueAsBytes(body));
    }

    /**
     * @param rawQuery request query string, may be {@code null}
     * @return requested limit, {@value #DEFAULT_LIMIT} when absent
     * @throws IllegalArgumentException if the limit is not a non-negative
     *                                  integer
     */
    static int parseLimit(String rawQuery) {
        if (rawQuery == null || rawQuery.isEmpty()) {
            return DEFAULT_LIMIT;
        }
        for (String pair : rawQuery.split("&")) {
            int eq = pair.indexOf('=');
            String name = eq < 0 ? pair : pair.substring(0, eq);
            if (!"limit".equals(name)) {
                continue;
            }
            String value = eq < 0 ? "" : pair.substring(eq + 1);
            try {
                int limit = Integer.parseInt(value);
                if (limit < 0) {
                    throw new IllegalArgumentException("limit must be >= 0, got: " + value);
                }
                return limit;
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("limit must be an integer, got: '" + value + "'", e);
            }
        }
        return DEFAULT_LIMIT;
    }

    private static byte[] error(String message) throws JsonProcessingException {
        return AnomalyJson.mapper().writeValueAsBytes(Map.of("error", message));
    }

    private static void respond(HttpExchange exchange, int status, byte[] body) throws IOException {
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }
}
