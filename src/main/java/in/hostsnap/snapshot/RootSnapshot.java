package in.hostsnap.snapshot;

import in.hostsnap.infrastructure.metrics.SnapshotMetrics;
import in.hostsnap.snapshot.change.ChangeDetector;
import in.hostsnap.snapshot.change.MultisetChangeDetector;
import in.hostsnap.source.Category;
import in.hostsnap.source.InventorySource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * One point of access to many inventory categories.
 *
 * The root owns one {@link CategorySnapshot} per registered category. The set is fixed when
 * the root is built and registration order is the refresh order of {@link #refresh()}.
 *
 * Usage:
 * <pre>
 * try (RootSnapshot root = RootSnapshot.builder(source)
 *         .register(HostCategories.PROCESSES)
 *         .register(HostCategories.THREADS)
 *         .maxConcurrency(4)
 *         .build()) {
 *
 *     RefreshReport report = root.refreshAsync().join();
 *     if (report.hasFailures()) {
 *         log.warn("Stale categories: {}", report.failures().keySet());
 *     }
 *     List&lt;ProcessRecord&gt; processes = root.category(HostCategories.PROCESSES).records();
 * }
 * </pre>
 */
public final class RootSnapshot implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RootSnapshot.class);

    private final Map<String, CategorySnapshot<?>> categories;
    private final RefreshOrchestrator orchestrator;

    private RootSnapshot(Map<String, CategorySnapshot<?>> categories, RefreshOrchestrator orchestrator) {
        this.categories = Collections.unmodifiableMap(categories);
        this.orchestrator = orchestrator;
    }

    public static Builder builder(InventorySource source) {
        return new Builder(source);
    }

    // ════════════════════════════════════════════════════════════════════════
    // REFRESH
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Refresh every category on the calling thread, in registration order.
     * A failing category does not stop the remaining ones.
     */
    public RefreshReport refresh() {
        return orchestrator.refreshSequentially(categories.values());
    }

    /**
     * Refresh every category concurrently.
     *
     * @return future completing, never exceptionally, once every category has settled
     */
    public CompletableFuture<RefreshReport> refreshAsync() {
        return orchestrator.refreshConcurrently(categories.values());
    }

    /**
     * Concurrent refresh that returns only after every category has settled.
     */
    public RefreshReport refreshAsyncAndWait() {
        return refreshAsync().join();
    }

    // ════════════════════════════════════════════════════════════════════════
    // ACCESSORS
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Oldest {@code lastUpdated} among the categories; {@link CategoryState#NEVER} if any
     * category was never refreshed or the root is empty.
     */
    public Instant freshness() {
        if (categories.isEmpty()) {
            return CategoryState.NEVER;
        }
        Instant oldest = null;
        for (CategorySnapshot<?> snapshot : categories.values()) {
            Instant updated = snapshot.lastUpdated();
            if (oldest == null || updated.isBefore(oldest)) {
                oldest = updated;
            }
        }
        return oldest;
    }

    /**
     * Typed accessor.
     *
     * @throws IllegalArgumentException if the category is not registered with this root
     */
    @SuppressWarnings("unchecked")
    public <R> CategorySnapshot<R> category(Category<R> category) {
        CategorySnapshot<?> snapshot = categories.get(category.name());
        if (snapshot == null || !snapshot.category().equals(category)) {
            throw new IllegalArgumentException("Category not registered: " + category);
        }
        return (CategorySnapshot<R>) snapshot;
    }

    public Optional<CategorySnapshot<?>> category(String name) {
        return Optional.ofNullable(categories.get(name));
    }

    public boolean contains(String name) {
        return categories.containsKey(name);
    }

    /**
     * Category names in registration order.
     */
    public List<String> categoryNames() {
        return List.copyOf(categories.keySet());
    }

    public Collection<CategorySnapshot<?>> categories() {
        return categories.values();
    }

    public int size() {
        return categories.size();
    }

    /**
     * Stop the refresh workers. The inventory source has its own lifecycle and is not closed.
     */
    @Override
    public void close() {
        orchestrator.close();
        log.debug("[RootSnapshot] Closed ({} categories)", categories.size());
    }

    // ════════════════════════════════════════════════════════════════════════
    // BUILDER
    // ════════════════════════════════════════════════════════════════════════

    public static final class Builder {
        private final InventorySource source;
        private final List<Category<?>> registered = new ArrayList<>();
        private ChangeDetector changeDetector = MultisetChangeDetector.INSTANCE;
        private FirstRefreshPolicy firstRefreshPolicy = FirstRefreshPolicy.UNCHANGED;
        private Clock clock = Clock.systemUTC();
        private SnapshotMetrics metrics = SnapshotMetrics.NOOP;
        private int maxConcurrency = 4;

        private Builder(InventorySource source) {
            this.source = Objects.requireNonNull(source, "source");
        }

        public Builder register(Category<?> category) {
            Objects.requireNonNull(category, "category");
            for (Category<?> existing : registered) {
                if (existing.name().equals(category.name())) {
                    throw new IllegalArgumentException("Category already registered: " + category.name());
                }
            }
            registered.add(category);
            return this;
        }

        public Builder registerAll(Collection<? extends Category<?>> categories) {
            categories.forEach(this::register);
            return this;
        }

        public Builder changeDetector(ChangeDetector changeDetector) {
            this.changeDetector = Objects.requireNonNull(changeDetector, "changeDetector");
            return this;
        }

        public Builder firstRefreshPolicy(FirstRefreshPolicy firstRefreshPolicy) {
            this.firstRefreshPolicy = Objects.requireNonNull(firstRefreshPolicy, "firstRefreshPolicy");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Objects.requireNonNull(clock, "clock");
            return this;
        }

        public Builder metrics(SnapshotMetrics metrics) {
            this.metrics = metrics == null ? SnapshotMetrics.NOOP : metrics;
            return this;
        }

        public Builder maxConcurrency(int maxConcurrency) {
            if (maxConcurrency < 1) {
                throw new IllegalArgumentException("maxConcurrency must be >= 1: " + maxConcurrency);
            }
            this.maxConcurrency = maxConcurrency;
            return this;
        }

        public RootSnapshot build() {
            Map<String, CategorySnapshot<?>> snapshots = new LinkedHashMap<>();
            for (Category<?> category : registered) {
                snapshots.put(category.name(), newSnapshot(category));
            }
            RefreshOrchestrator orchestrator = new RefreshOrchestrator(maxConcurrency, clock);
            log.info("[RootSnapshot] Built with {} categories {} on {} (max {} concurrent queries)",
                snapshots.size(), snapshots.keySet(), source.name(), maxConcurrency);
            return new RootSnapshot(snapshots, orchestrator);
        }

        private <R> CategorySnapshot<R> newSnapshot(Category<R> category) {
            return new CategorySnapshot<>(category, source, changeDetector, firstRefreshPolicy, clock, metrics);
        }
    }
}
