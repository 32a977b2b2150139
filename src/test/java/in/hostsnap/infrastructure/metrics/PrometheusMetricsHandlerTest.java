package in.hostsnap.infrastructure.metrics;

import in.hostsnap.source.FailureReason;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Handlers;
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

import static org.junit.jupiter.api.Assertions.*;

/**
 * Integration test for the Prometheus /metrics endpoint.
 *
 * Tests:
 * - Prometheus text format
 * - Recorded snapshot metrics are exported
 * - name[] filter
 */
class PrometheusMetricsHandlerTest {

    private static final int TEST_PORT = 19090;
    private Undertow server;
    private PrometheusSnapshotMetrics metrics;
    private HttpClient httpClient;

    @BeforeEach
    void setUp() {
        metrics = new PrometheusSnapshotMetrics(new CollectorRegistry());

        server = Undertow.builder()
            .addHttpListener(TEST_PORT, "localhost")
            .setHandler(Handlers.path()
                .addPrefixPath("/metrics", new PrometheusMetricsHandler(metrics.getRegistry())))
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
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create("http://localhost:" + TEST_PORT + path))
            .GET()
            .build();
        return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
    }

    @Test
    void testExportsRecordedMetrics() throws Exception {
        metrics.recordRefreshSuccess("threads", Duration.ofMillis(3), 17, false, Instant.now());
        metrics.recordRefreshFailure("volumes", FailureReason.TIMEOUT, Duration.ofSeconds(1));

        HttpResponse<String> response = get("/metrics");

        assertEquals(200, response.statusCode());
        assertTrue(response.headers().firstValue("Content-Type").orElse("").startsWith("text/plain"));
        String body = response.body();
        assertTrue(body.contains("# TYPE hostsnap_refresh_total counter"), "Missing TYPE line");
        assertTrue(body.contains("hostsnap_category_records{category=\"threads\",} 17.0"), body);
        assertTrue(body.contains("hostsnap_query_failures_total{category=\"volumes\",reason=\"TIMEOUT\",} 1.0"), body);
    }

    @Test
    void testNameFilter() throws Exception {
        metrics.recordRefreshSuccess("threads", Duration.ofMillis(3), 17, true, Instant.now());

        HttpResponse<String> response = get("/metrics?name%5B%5D=hostsnap_category_records");

        assertEquals(200, response.statusCode());
        assertTrue(response.body().contains("hostsnap_category_records"));
        assertFalse(response.body().contains("hostsnap_refresh_total"), "Filtered families must be omitted");
    }
}
