package in.hostsnap.bootstrap;

import com.fasterxml.jackson.databind.node.ObjectNode;
import in.hostsnap.config.SnapshotConfig;
import in.hostsnap.infrastructure.jvm.HostCategories;
import in.hostsnap.infrastructure.jvm.JvmHostInventorySource;
import in.hostsnap.infrastructure.metrics.PrometheusMetricsHandler;
import in.hostsnap.infrastructure.metrics.PrometheusSnapshotMetrics;
import in.hostsnap.service.FieldDumper;
import in.hostsnap.service.SnapshotRefreshScheduler;
import in.hostsnap.snapshot.RefreshReport;
import in.hostsnap.snapshot.RootSnapshot;
import in.hostsnap.source.Category;
import in.hostsnap.source.InventorySource;
import in.hostsnap.source.QueryFailureException;
import in.hostsnap.source.TimedInventorySource;
import in.hostsnap.transport.http.SnapshotHandler;
import in.hostsnap.transport.http.SnapshotJsonMapper;
import io.prometheus.client.CollectorRegistry;
import io.undertow.Undertow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;

/**
 * Core Java entry point (NO framework).
 *
 * Modes (first argument, else RUN_MODE):
 * - snapshot - One concurrent refresh of every configured category, printed as JSON.
 *              Exit code 2 if any category failed.
 * - fields &lt;category&gt; - Raw rows of one category as field maps.
 * - serve - Periodic refresh plus HTTP API on PORT until shutdown.
 */
public final class App {
    private static final Logger log = LoggerFactory.getLogger(App.class);

    static final int EXIT_OK = 0;
    static final int EXIT_CONFIG = 1;
    static final int EXIT_PARTIAL = 2;

    public static void main(String[] args) {
        int code = run(args);
        if (code != EXIT_OK) {
            System.exit(code);
        }
    }

    static int run(String[] args) {
        SnapshotConfig config = SnapshotConfig.load();
        if (args.length > 0) {
            config = config.withRunMode(args[0]);
        }

        try {
            StartupConfigValidator.validate(config);
        } catch (IllegalStateException e) {
            log.error("❌ STARTUP VALIDATION FAILED", e);
            System.err.println("\n" + e.getMessage() + "\n");
            return EXIT_CONFIG;
        }

        String mode = config.runMode().toUpperCase();
        try (InventorySource source = new TimedInventorySource(
                new JvmHostInventorySource(), config.queryTimeout(), config.maxConcurrency())) {
            source.open();
            switch (mode) {
                case "FIELDS":
                    return runFields(source, args);
                case "SERVE":
                    return runServer(source, config);
                default:
                    return runSnapshot(source, config);
            }
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // snapshot
    // ═══════════════════════════════════════════════════════════════

    private static int runSnapshot(InventorySource source, SnapshotConfig config) {
        try (RootSnapshot root = buildRoot(source, config, new PrometheusSnapshotMetrics(new CollectorRegistry()))) {
            RefreshReport report = root.refreshAsyncAndWait();

            ObjectNode out = SnapshotJsonMapper.toJson(root, true);
            out.set("report", SnapshotJsonMapper.toJson(report));
            System.out.println(SnapshotJsonMapper.write(out));

            return report.hasFailures() ? EXIT_PARTIAL : EXIT_OK;
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // fields <category>
    // ═══════════════════════════════════════════════════════════════

    private static int runFields(InventorySource source, String[] args) {
        if (args.length < 2) {
            System.err.println("usage: fields <category>   (one of " + names(HostCategories.ALL) + ")");
            return EXIT_CONFIG;
        }
        Category<?> category = HostCategories.byName(args[1]).orElse(null);
        if (category == null) {
            System.err.println("Unknown category '" + args[1] + "', expected one of " + names(HostCategories.ALL));
            return EXIT_CONFIG;
        }

        try {
            FieldDumper dumper = new FieldDumper(source);
            System.out.println(SnapshotJsonMapper.write(dumper.dump(category)));
            return EXIT_OK;
        } catch (QueryFailureException e) {
            log.error("Query for {} failed: {}", category.name(), e.getMessage(), e);
            System.err.println(e.getMessage());
            return EXIT_PARTIAL;
        }
    }

    // ═══════════════════════════════════════════════════════════════
    // serve
    // ═══════════════════════════════════════════════════════════════

    private static int runServer(InventorySource source, SnapshotConfig config) {
        log.info("═══════════════════════════════════════════════════════════════");
        log.info("=== hostsnap Starting ===");
        log.info("═══════════════════════════════════════════════════════════════");

        PrometheusSnapshotMetrics metrics = new PrometheusSnapshotMetrics();
        log.info("✓ Prometheus metrics initialized");

        try (RootSnapshot root = buildRoot(source, config, metrics)) {
            SnapshotRefreshScheduler scheduler = new SnapshotRefreshScheduler(root, config.refreshInterval());
            scheduler.onCategoryChanged(change -> log.info("Category {} changed: +{} -{}",
                change.category(), change.diff().added().size(), change.diff().removed().size()));
            scheduler.start();

            SnapshotHandler handler = new SnapshotHandler(root);
            Undertow server = Undertow.builder()
                .addHttpListener(config.port(), "0.0.0.0")
                .setHandler(handler.routes(new PrometheusMetricsHandler(metrics.getRegistry())))
                .build();
            server.start();
            log.info("✓ HTTP server listening on port {}", config.port());

            CountDownLatch shutdown = new CountDownLatch(1);
            Runtime.getRuntime().addShutdownHook(new Thread(() -> {
                log.info("Shutting down...");
                scheduler.stop();
                server.stop();
                shutdown.countDown();
            }, "hostsnap-shutdown"));

            try {
                shutdown.await();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                scheduler.stop();
                server.stop();
            }
            return EXIT_OK;
        }
    }

    static RootSnapshot buildRoot(InventorySource source, SnapshotConfig config,
                                  PrometheusSnapshotMetrics metrics) {
        List<Category<?>> categories = new ArrayList<>();
        if (config.categories().isEmpty()) {
            categories.addAll(HostCategories.ALL);
        } else {
            for (String name : config.categories()) {
                HostCategories.byName(name).ifPresent(categories::add);
            }
        }

        return RootSnapshot.builder(source)
            .registerAll(categories)
            .changeDetector(config.changeDetectionMode().detector())
            .firstRefreshPolicy(config.firstRefreshPolicy())
            .maxConcurrency(config.maxConcurrency())
            .metrics(metrics)
            .build();
    }

    private static List<String> names(List<Category<?>> categories) {
        List<String> names = new ArrayList<>();
        for (Category<?> c : categories) {
            names.add(c.name());
        }
        return names;
    }

    private App() {}
}
