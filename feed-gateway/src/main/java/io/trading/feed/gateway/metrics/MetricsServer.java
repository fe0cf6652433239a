package io.trading.feed.gateway.metrics;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.trading.feed.gateway.supervisor.AgentState;
import io.trading.feed.gateway.supervisor.AgentStatus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.StringWriter;
import java.io.Writer;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.function.Supplier;

/**
 * HTTP server for Prometheus metrics and agent status.
 * Serves /metrics, /health and /api/status.
 */
public class MetricsServer implements AutoCloseable {

    private static final Logger LOGGER = LoggerFactory.getLogger(MetricsServer.class);

    private final int port;
    private final CollectorRegistry registry;
    private final Supplier<List<AgentStatus>> statusSupplier;
    private final ObjectMapper objectMapper;
    private final long startTime;
    private HttpServer server;

    /**
     * @param port           Listen port; 0 binds an ephemeral port
     * @param metrics        Metrics to expose
     * @param statusSupplier Source of the per-agent status snapshot
     */
    public MetricsServer(int port, FeedMetrics metrics, Supplier<List<AgentStatus>> statusSupplier) {
        this.port = port;
        this.registry = metrics.getRegistry();
        this.statusSupplier = statusSupplier;
        this.objectMapper = new ObjectMapper();
        this.startTime = System.currentTimeMillis();
    }

    /**
     * Starts the HTTP server.
     */
    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(port), 0);
        server.createContext("/metrics", handleMetrics());
        server.createContext("/health", handleHealth());
        server.createContext("/api/status", handleStatus());
        server.setExecutor(null);
        server.start();

        LOGGER.info("HTTP server started on port {}", port());
        LOGGER.info("  Prometheus: http://localhost:{}/metrics", port());
        LOGGER.info("  Health:     http://localhost:{}/health", port());
        LOGGER.info("  API Status: http://localhost:{}/api/status", port());
    }

    /**
     * Bound port, or the configured one before {@link #start()}.
     */
    public int port() {
        return server != null ? server.getAddress().getPort() : port;
    }

    private HttpHandler handleMetrics() {
        return exchange -> {
            try {
                Writer writer = new StringWriter();
                TextFormat.write004(writer, registry.metricFamilySamples());
                send(exchange, 200, TextFormat.CONTENT_TYPE_004, writer.toString());
            } catch (Exception e) {
                LOGGER.error("Error serving metrics", e);
                exchange.sendResponseHeaders(500, -1);
            }
        };
    }

    private HttpHandler handleHealth() {
        return exchange -> {
            try {
                HealthResponse health = health(statusSupplier.get());
                send(exchange, health.healthy() ? 200 : 503, "application/json",
                    objectMapper.writeValueAsString(health));
            } catch (Exception e) {
                LOGGER.error("Error handling health request", e);
                send(exchange, 500, "application/json", "{\"error\":\"Internal server error\"}");
            }
        };
    }

    private HttpHandler handleStatus() {
        return exchange -> {
            try {
                send(exchange, 200, "application/json", renderStatus());
            } catch (Exception e) {
                LOGGER.error("Error handling status request", e);
                send(exchange, 500, "application/json", "{\"error\":\"Internal server error\"}");
            }
        };
    }

    /**
     * Status document served on /api/status.
     */
    String renderStatus() throws JsonProcessingException {
        List<AgentInfo> agents = statusSupplier.get().stream()
            .map(s -> new AgentInfo(
                s.name(),
                s.feed().venue().id(),
                s.feed().isAll() ? List.of("all") : s.feed().symbols(),
                s.state().name(),
                s.consecutiveFailures(),
                s.restarts(),
                s.messages(),
                s.lastError(),
                s.stateSince()))
            .toList();
        StatusResponse response = new StatusResponse(System.currentTimeMillis() - startTime, agents);
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(response);
    }

    // Healthy while at least one agent has not failed.
    static HealthResponse health(List<AgentStatus> statuses) {
        long failed = statuses.stream().filter(s -> s.state() == AgentState.FAILED).count();
        if (!statuses.isEmpty() && failed == statuses.size()) {
            return new HealthResponse(false, "All agents failed");
        }
        if (failed > 0) {
            return new HealthResponse(true, failed + " of " + statuses.size() + " agents failed");
        }
        return new HealthResponse(true, "All systems operational");
    }

    private void send(HttpExchange exchange, int statusCode, String contentType, String response) throws IOException {
        byte[] body = response.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType);
        exchange.sendResponseHeaders(statusCode, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    @Override
    public void close() {
        if (server != null) {
            server.stop(0);
            LOGGER.info("HTTP server stopped");
        }
    }

    record StatusResponse(long uptimeMs, List<AgentInfo> agents) {}
    record AgentInfo(String name, String venue, List<String> symbols, String state, int consecutiveFailures,
                     long restarts, long messages, String lastError, long stateSince) {}
    record HealthResponse(boolean healthy, String message) {}
}
