package io.trading.feed.gateway.metrics;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.prometheus.client.CollectorRegistry;
import io.trading.feed.canonical.model.EventKind;
import io.trading.feed.canonical.model.Venue;
import io.trading.feed.gateway.config.FeedSpec;
import io.trading.feed.gateway.supervisor.AgentState;
import io.trading.feed.gateway.supervisor.AgentStatus;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MetricsServerTest {

    private final FeedMetrics metrics = new FeedMetrics(new CollectorRegistry());

    private static AgentStatus status(String name, String feed, AgentState state) {
        return new AgentStatus(name, FeedSpec.fromString(feed), state, 0, 1, 42, null, 1704067200000L);
    }

    @Test
    void testRenderStatus() throws Exception {
        List<AgentStatus> statuses = List.of(
            status("binance-0", "binance:btcusdt", AgentState.STREAMING),
            status("coinbase-0", "coinbase:all", AgentState.FAILED)
        );
        MetricsServer server = new MetricsServer(0, metrics, () -> statuses);

        JsonNode root = new ObjectMapper().readTree(server.renderStatus());

        JsonNode agents = root.get("agents");
        assertEquals(2, agents.size());
        assertEquals("binance-0", agents.get(0).get("name").asText());
        assertEquals("binance", agents.get(0).get("venue").asText());
        assertEquals("btcusdt", agents.get(0).get("symbols").get(0).asText());
        assertEquals("STREAMING", agents.get(0).get("state").asText());
        assertEquals(42, agents.get(0).get("messages").asLong());
        assertEquals("all", agents.get(1).get("symbols").get(0).asText());
    }

    @Test
    void testHealth() {
        assertTrue(MetricsServer.health(List.of()).healthy());
        assertTrue(MetricsServer.health(List.of(
            status("binance-0", "binance", AgentState.FAILED),
            status("coinbase-0", "coinbase", AgentState.STREAMING))).healthy());
        assertFalse(MetricsServer.health(List.of(
            status("binance-0", "binance", AgentState.FAILED))).healthy());
    }

    @Test
    void testServesMetricsAndStatus() throws Exception {
        metrics.recordRawEvent(Venue.BINANCE, EventKind.TRADE);
        try (MetricsServer server = new MetricsServer(0, metrics,
            () -> List.of(status("binance-0", "binance:btcusdt", AgentState.STREAMING)))) {
            server.start();
            HttpClient client = HttpClient.newHttpClient();
            String base = "http://localhost:" + server.port();

            HttpResponse<String> prometheus = client.send(
                HttpRequest.newBuilder(URI.create(base + "/metrics")).build(), HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> status = client.send(
                HttpRequest.newBuilder(URI.create(base + "/api/status")).build(), HttpResponse.BodyHandlers.ofString());
            HttpResponse<String> health = client.send(
                HttpRequest.newBuilder(URI.create(base + "/health")).build(), HttpResponse.BodyHandlers.ofString());

            assertEquals(200, prometheus.statusCode());
            assertTrue(prometheus.body().contains("feed_raw_events_total"));
            assertEquals(200, status.statusCode());
            assertTrue(status.body().contains("binance-0"));
            assertEquals(200, health.statusCode());
        }
    }
}
