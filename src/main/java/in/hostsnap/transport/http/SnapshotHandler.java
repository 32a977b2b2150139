package in.hostsnap.transport.http;

import com.fasterxml.jackson.databind.JsonNode;
import in.hostsnap.snapshot.CategorySnapshot;
import in.hostsnap.snapshot.RefreshReport;
import in.hostsnap.snapshot.RootSnapshot;
import io.undertow.Handlers;
import io.undertow.server.HttpHandler;
import io.undertow.server.HttpServerExchange;
import io.undertow.server.RoutingHandler;
import io.undertow.util.Headers;
import io.undertow.util.StatusCodes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Deque;
import java.util.Map;
import java.util.Optional;

/**
 * HTTP handler for snapshot endpoints.
 *
 * Provides REST API over one root snapshot:
 * - GET /api/snapshot - All categories (add ?records=false for counts only)
 * - GET /api/snapshot/{category} - One category with its records
 * - POST /api/snapshot/refresh - Concurrent refresh; 200 with the report even on partial failure
 * - GET /health - Liveness
 * - GET /metrics - Prometheus scrape (handler supplied by the caller)
 */
public final class SnapshotHandler {
    private static final Logger log = LoggerFactory.getLogger(SnapshotHandler.class);

    private final RootSnapshot root;

    public SnapshotHandler(RootSnapshot root) {
        this.root = root;
    }

    /**
     * Route table for this handler plus the metrics endpoint.
     */
    public RoutingHandler routes(HttpHandler metricsHandler) {
        return Handlers.routing()
            .get("/api/snapshot", this::getSnapshot)
            .get("/api/snapshot/{category}", this::getCategory)
            .post("/api/snapshot/refresh", this::postRefresh)
            .get("/health", this::health)
            .get("/metrics", metricsHandler);
    }

    /**
     * GET /api/snapshot
     */
    public void getSnapshot(HttpServerExchange exchange) {
        try {
            boolean includeRecords = !"false".equalsIgnoreCase(queryParam(exchange, "records"));
            sendJson(exchange, StatusCodes.OK, SnapshotJsonMapper.toJson(root, includeRecords));
        } catch (Exception e) {
            log.error("Failed to render snapshot: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to render snapshot: " + e.getMessage());
        }
    }

    /**
     * GET /api/snapshot/{category}
     */
    public void getCategory(HttpServerExchange exchange) {
        String name = queryParam(exchange, "category");
        Optional<CategorySnapshot<?>> snapshot = root.category(name);
        if (snapshot.isEmpty()) {
            sendError(exchange, StatusCodes.NOT_FOUND, "Unknown category: " + name);
            return;
        }
        try {
            sendJson(exchange, StatusCodes.OK, SnapshotJsonMapper.toJson(snapshot.get(), true));
        } catch (Exception e) {
            log.error("Failed to render category {}: {}", name, e.getMessage(), e);
            sendError(exchange, StatusCodes.INTERNAL_SERVER_ERROR, "Failed to render category: " + e.getMessage());
        }
    }

    /**
     * POST /api/snapshot/refresh
     */
    public void postRefresh(HttpServerExchange exchange) {
        if (exchange.isInIoThread()) {
            exchange.dispatch(this::postRefresh);
            return;
        }
        try {
            RefreshReport report = root.refreshAsyncAndWait();
            log.info("POST /api/snapshot/refresh → {}", report.summary());
            sendJson(exchange, StatusCodes.OK, SnapshotJsonMapper.toJson(report));
        } catch (Exception e) {
            log.error("Refresh request failed: {}", e.getMessage(), e);
            sendError(exchange, StatusCodes.SERVICE_UNAVAILABLE, "Refresh failed: " + e.getMessage());
        }
    }

    /**
     * GET /health
     */
    public void health(HttpServerExchange exchange) {
        sendJson(exchange, StatusCodes.OK, SnapshotJsonMapper.mapper().valueToTree(
            Map.of("status", "UP", "categories", root.size())));
    }

    private static String queryParam(HttpServerExchange exchange, String name) {
        Deque<String> values = exchange.getQueryParameters().get(name);
        return values == null || values.isEmpty() ? null : values.getFirst();
    }

    private void sendJson(HttpServerExchange exchange, int statusCode, JsonNode body) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");
        exchange.getResponseSender().send(body.toString(), StandardCharsets.UTF_8);
    }

    private void sendError(HttpServerExchange exchange, int statusCode, String message) {
        exchange.setStatusCode(statusCode);
        exchange.getResponseHeaders().put(Headers.CONTENT_TYPE, "text/plain");
        exchange.getResponseSender().send(message, StandardCharsets.UTF_8);
    }
}
