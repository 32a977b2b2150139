package in.hostsnap.infrastructure.metrics;

import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.exporter.common.TextFormat;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.StringWriter;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

/**
 * HTTP handler for the Prometheus /metrics endpoint.
 *
 * Honors the standard {@code name[]} query parameter to restrict the output to selected
 * metric families, e.g. {@code /metrics?name[]=hostsnap_refresh_total}.
 *
 * Example output:
 * <pre>
 * # HELP hostsnap_refresh_total Total number of category refreshes
 * # TYPE hostsnap_refresh_total counter
 * hostsnap_refresh_total{category="processes",outcome="success"} 42.0
 * hostsnap_refresh_total{category="volumes",outcome="failure"} 1.0
 * </pre>
 */
public class PrometheusMetricsHandler implements HttpHandler {
    private static final Logger log = LoggerFactory.getLogger(PrometheusMetricsHandler.class);

    private final CollectorRegistry registry;

    public PrometheusMetricsHandler(CollectorRegistry registry) {
        this.registry = registry;
    }

    @Override
    public void handleRequest(HttpServerExchange exchange) {
        Set<String> names = requestedNames(exchange);
        StringWriter writer = new StringWriter();
        try {
            if (names.isEmpty()) {
                TextFormat.write004(writer, registry.metricFamilySamples());
            } else {
                TextFormat.write004(writer, registry.filteredMetricFamilySamples(names));
            }
        } catch (IOException e) {
            log.error("[PrometheusMetricsHandler] Failed to export metrics: {}", e.getMessage(), e);
            exchange.setStatusCode(StatusCodes.INTERNAL_SERVER_ERROR);
            exchange.getResponseSender().send("Error exporting metrics: " + e.getMessage());
            return;
        }

        String body = writer.toString();
        exchange.setStatusCode(StatusCodes.OK);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, TextFormat.CONTENT_TYPE_004);
        exchange.getResponseSender().send(body);
        log.debug("[PrometheusMetricsHandler] Served {} bytes (filter={})", body.length(), names);
    }

    private static Set<String> requestedNames(HttpServerExchange exchange) {
        Deque<String> values = exchange.getQueryParameters().get("name[]");
        return values == null ? Set.of() : new HashSet<>(values);
    }
}
