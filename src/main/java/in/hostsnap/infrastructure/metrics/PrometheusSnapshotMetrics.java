package in.hostsnap.infrastructure.metrics;

import in.hostsnap.source.FailureReason;
import io.prometheus.client.CollectorRegistry;
import io.prometheus.client.Counter;
import io.prometheus.client.Gauge;
import io.prometheus.client.Histogram;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Prometheus implementation of SnapshotMetrics interface.
 *
 * Exposes snapshot metrics in Prometheus format for scraping at /metrics.
 *
 * Key Metrics:
 * - hostsnap_refresh_total{category, outcome} - Refresh success/failure counts
 * - hostsnap_refresh_duration_seconds{category} - Refresh latency distribution
 * - hostsnap_category_records{category} - Records held after the last commit
 * - hostsnap_category_changes_total{category} - Commits that changed the record set
 * - hostsnap_category_last_updated_seconds{category} - Epoch seconds of the last commit
 * - hostsnap_query_failures_total{category, reason} - Failures by reason
 *
 * Usage:
 * <pre>
 * PrometheusSnapshotMetrics metrics = new PrometheusSnapshotMetrics();
 * RootSnapshot root = RootSnapshot.builder(source).metrics(metrics)...build();
 *
 * // Expose at /metrics endpoint
 * routes.get("/metrics", new PrometheusMetricsHandler(metrics.getRegistry()));
 * </pre>
 */
public class PrometheusSnapshotMetrics implements SnapshotMetrics {
    private static final Logger log = LoggerFactory.getLogger(PrometheusSnapshotMetrics.class);

    private final CollectorRegistry registry;

    private final Counter refreshCounter;
    private final Histogram refreshLatency;
    private final Gauge recordCount;
    private final Counter changeCounter;
    private final Gauge lastUpdated;
    private final Counter failureCounter;

    public PrometheusSnapshotMetrics() {
        this(CollectorRegistry.defaultRegistry);
    }

    public PrometheusSnapshotMetrics(CollectorRegistry registry) {
        this.registry = registry;

        this.refreshCounter = Counter.build()
            .name("hostsnap_refresh_total")
            .help("Total number of category refreshes")
            .labelNames("category", "outcome")
            .register(registry);

        this.refreshLatency = Histogram.build()
            .name("hostsnap_refresh_duration_seconds")
            .help("Category refresh latency in seconds")
            .labelNames("category")
            .buckets(0.005, 0.01, 0.05, 0.1, 0.5, 1.0, 5.0, 10.0, 30.0)
            .register(registry);

        this.recordCount = Gauge.build()
            .name("hostsnap_category_records")
            .help("Number of records held by the category after its last commit")
            .labelNames("category")
            .register(registry);

        this.changeCounter = Counter.build()
            .name("hostsnap_category_changes_total")
            .help("Total number of refreshes that changed the category record set")
            .labelNames("category")
            .register(registry);

        this.lastUpdated = Gauge.build()
            .name("hostsnap_category_last_updated_seconds")
            .help("Epoch seconds of the category's last committed refresh")
            .labelNames("category")
            .register(registry);

        this.failureCounter = Counter.build()
            .name("hostsnap_query_failures_total")
            .help("Total number of failed category queries")
            .labelNames("category", "reason")
            .register(registry);

        log.info("[PrometheusSnapshotMetrics] Initialized");
    }

    @Override
    public void recordRefreshSuccess(String category, Duration latency, int records, boolean changed,
                                     Instant committedAt) {
        refreshCounter.labels(category, "success").inc();
        refreshLatency.labels(category).observe(latency.toNanos() / 1_000_000_000.0);
        recordCount.labels(category).set(records);
        if (changed) {
            changeCounter.labels(category).inc();
        }
        lastUpdated.labels(category).set(committedAt.toEpochMilli() / 1000.0);
    }

    @Override
    public void recordRefreshFailure(String category, FailureReason reason, Duration latency) {
        refreshCounter.labels(category, "failure").inc();
        refreshLatency.labels(category).observe(latency.toNanos() / 1_000_000_000.0);
        failureCounter.labels(category, reason.name()).inc();
    }

    public CollectorRegistry getRegistry() {
        return registry;
    }
}
