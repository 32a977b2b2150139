package in.hostsnap.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import in.hostsnap.domain.inventory.ProcessRecord;
import in.hostsnap.infrastructure.jvm.HostCategories;
import in.hostsnap.infrastructure.metrics.PrometheusMetricsHandler;
import in.hostsnap.infrastructure.metrics.PrometheusSnapshotMetrics;
import in.hostsnap.snapshot.RootSnapshot;
import in.hostsnap.source.FailureReason;
import in.hostsnap.testutil.ScriptedInventorySource;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the snapshot HTTP API.
 *
 * Tests:
 * - Snapshot and category rendering, before and after refresh
 * - Refresh endpoint with partial failure
 * - Unknown category
 * - Health and metrics routes
 */
class SnapshotHandlerTest {

    private static final int TEST_PORT = 19191;

    private final ScriptedInventorySource source = new ScriptedInventorySource();
    private RootSnapshot root;
    private Undertow server;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        source.rows("processes", List.of(
                new ProcessRecord(1L, null, "/sbin/init", "root", Instant.parse("2024-01-01T00:00:00Z")),
                new ProcessRecord(77L, 1L, "/usr/sbin/sshd", "root", null)))
            .fail("volumes", FailureReason.PERMISSION_DENIED);

        PrometheusSnapshotMetrics metrics = new PrometheusSnapshotMetrics(new CollectorRegistry());
        root = RootSnapshot.builder(source)
            .register(HostCategories.PROCESSES)
            .register(HostCategories.VOLUMES)
            .metrics(metrics)
            .build();

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(new SnapshotHandler(root).routes(new PrometheusMetricsHandler(metrics.getRegistry())))
            .build();
        server.start();

        httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(5))
            .build();
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop();
        }
        root.close();
    }

    private HttpResponse<String> send(String method, String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .method(method, HttpRequest.BodyPublishers.noBody())
            .timeout(Duration.ofSeconds(10))
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    private static JsonNode json(HttpResponse<String> response) throws Exception {
        return SnapshotJsonMapper.mapper().readTree(response.body());
    }

    @Test
    void testSnapshotBeforeRefresh() throws Exception {
        HttpResponse<String> response = send("GET", "/api/snapshot");

        assertEquals(200, response.statusCode());
        JsonNode body = json(response);
        assertTrue(body.get("freshness").isNull(), "Never refreshed root has null freshness");
        JsonNode processes = body.get("categories").get("processes");
        assertTrue(processes.get("lastUpdated").isNull());
        assertEquals(0, processes.get("recordCount").asInt());
        assertEquals(0, processes.get("refreshCount").asInt());
    }

    @Test
    void testRefreshReportsPartialFailure() throws Exception {
        HttpResponse<String> response = send("POST", "/api/snapshot/refresh");

        assertEquals(200, response.statusCode(), "Partial success is not an HTTP error");
        JsonNode report = json(response);
        assertEquals("processes", report.get("succeeded").get(0).asText());
        assertEquals("PERMISSION_DENIED", report.get("failures").get("volumes").get("reason").asText());
        assertTrue(report.get("durationMs").asLong() >= 0);
    }

    @Test
    void testCategoryAfterRefresh() throws Exception {
        root.refresh();

        HttpResponse<String> response = send("GET", "/api/snapshot/processes");

        assertEquals(200, response.statusCode());
        JsonNode category = json(response);
        assertEquals(2, category.get("recordCount").asInt());
        assertEquals(1, category.get("refreshCount").asInt());
        assertFalse(category.get("lastUpdated").isNull());
        JsonNode first = category.get("records").get(0);
        assertEquals(1, first.get("pid").asInt());
        assertEquals("2024-01-01T00:00:00Z", first.get("startedAt").asText());
    }

    @Test
    void testSnapshotWithoutRecords() throws Exception {
        root.refresh();

        JsonNode body = json(send("GET", "/api/snapshot?records=false"));

        JsonNode processes = body.get("categories").get("processes");
        assertEquals(2, processes.get("recordCount").asInt());
        assertFalse(processes.has("records"));
    }

    @Test
    void testUnknownCategory() throws Exception {
        HttpResponse<String> response = send("GET", "/api/snapshot/kernel_modules");

        assertEquals(404, response.statusCode());
        assertTrue(response.body().contains("kernel_modules"));
    }

    @Test
    void testHealth() throws Exception {
        JsonNode body = json(send("GET", "/health"));

        assertEquals("UP", body.get("status").asText());
        assertEquals(2, body.get("categories").asInt());
    }

    @Test
    void testMetricsRouteReflectsRefresh() throws Exception {
        send("POST", "/api/snapshot/refresh");

        HttpResponse<String> response = send("GET", "/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("hostsnap_category_records{category=\"processes\",} 2.0"),
            response.body());
    }
}
