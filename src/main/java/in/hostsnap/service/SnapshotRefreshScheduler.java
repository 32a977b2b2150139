package in.hostsnap.service;

import in.hostsnap.snapshot.RefreshReport;
import in.hostsnap.snapshot.RootSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;

/**
 * Periodic refresher for a root snapshot.
 *
 * Features:
 * - Fixed-delay concurrent refresh on a daemon thread
 * - Manual refresh trigger
 * - Change notification per category, with the diff against the previous refresh
 * - Report notification after every refresh
 *
 * Usage:
 * <pre>
 * SnapshotRefreshScheduler scheduler = new SnapshotRefreshScheduler(root, Duration.ofSeconds(30));
 * scheduler.onCategoryChanged(change -> log.info("{} changed: +{}", change.category(), change.diff().added()));
 * scheduler.start();
 * ...
 * scheduler.stop();
 * </pre>
 */
public final class SnapshotRefreshScheduler {
    private static final Logger log = LoggerFactory.getLogger(SnapshotRefreshScheduler.class);

    private final RootSnapshot root;
    private final Duration interval;

    private final ScheduledExecutorService scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
        Thread t = new Thread(r, "SnapshotScheduler");
        t.setDaemon(true);
        return t;
    });

    private final List<Consumer<RefreshReport>> reportListeners = new CopyOnWriteArrayList<>();
    private final List<Consumer<CategoryChange>> changeListeners = new CopyOnWriteArrayList<>();

    private volatile boolean running = false;
    private volatile RefreshReport lastReport;
    private ScheduledFuture<?> periodicTask;
    private final AtomicLong completedRefreshes = new AtomicLong();

    public SnapshotRefreshScheduler(RootSnapshot root, Duration interval) {
        this.root = Objects.requireNonNull(root, "root");
        if (interval == null || interval.isZero() || interval.isNegative()) {
            throw new IllegalArgumentException("interval must be positive: " + interval);
        }
        this.interval = interval;
    }

    /**
     * Start refreshing immediately and then every {@code interval} after the previous refresh ended.
     */
    public synchronized void start() {
        if (running) {
            log.warn("[SnapshotScheduler] Already running");
            return;
        }
        running = true;
        periodicTask = scheduler.scheduleWithFixedDelay(
            this::runRefresh, 0, interval.toMillis(), TimeUnit.MILLISECONDS);
        log.info("[SnapshotScheduler] Started: {} categories every {}ms", root.size(), interval.toMillis());
    }

    public synchronized void stop() {
        if (!running) {
            return;
        }
        running = false;
        if (periodicTask != null) {
            periodicTask.cancel(false);
        }
        scheduler.shutdown();
        try {
            if (!scheduler.awaitTermination(10, TimeUnit.SECONDS)) {
                scheduler.shutdownNow();
            }
        } catch (InterruptedException e) {
            scheduler.shutdownNow();
            Thread.currentThread().interrupt();
        }
        log.info("[SnapshotScheduler] Stopped after {} refreshes", completedRefreshes.get());
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Run one refresh now, on the scheduler thread, outside the periodic cadence.
     */
    public CompletableFuture<RefreshReport> triggerRefresh() {
        log.info("[SnapshotScheduler] Manual refresh triggered");
        return CompletableFuture.supplyAsync(this::refreshOnce, scheduler);
    }

    private void runRefresh() {
        try {
            refreshOnce();
        } catch (RuntimeException e) {
            // keep the periodic task alive; the next run retries
            log.error("[SnapshotScheduler] Refresh cycle failed: {}", e.getMessage(), e);
        }
    }

    private RefreshReport refreshOnce() {
        RefreshReport report = root.refreshAsyncAndWait();
        lastReport = report;
        completedRefreshes.incrementAndGet();

        if (report.hasFailures()) {
            report.failures().forEach((name, failure) ->
                log.warn("[SnapshotScheduler] {} stale: {} ({})", name, failure.getMessage(), failure.getReason()));
        }

        // Publish what this refresh committed; the live state may already belong to a later refresh
        report.committed().forEach((name, state) -> {
            if (state.changed()) {
                publishChange(new CategoryChange(name, state));
            }
        });
        for (Consumer<RefreshReport> listener : reportListeners) {
            notifyListener(listener, report, "report");
        }
        return report;
    }

    private void publishChange(CategoryChange change) {
        log.info("[SnapshotScheduler] {} changed (+{} -{})",
            change.category(), change.diff().added().size(), change.diff().removed().size());
        for (Consumer<CategoryChange> listener : changeListeners) {
            notifyListener(listener, change, "change");
        }
    }

    private <T> void notifyListener(Consumer<T> listener, T event, String kind) {
        try {
            listener.accept(event);
        } catch (RuntimeException e) {
            log.warn("[SnapshotScheduler] {} listener {} failed: {}", kind, listener, e.getMessage(), e);
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // EVENT LISTENERS
    // ════════════════════════════════════════════════════════════════════════

    public void onRefreshCompleted(Consumer<RefreshReport> listener) {
        reportListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    public void onCategoryChanged(Consumer<CategoryChange> listener) {
        changeListeners.add(Objects.requireNonNull(listener, "listener"));
    }

    // ════════════════════════════════════════════════════════════════════════
    // STATISTICS
    // ════════════════════════════════════════════════════════════════════════

    public RefreshReport getLastReport() {
        return lastReport;
    }

    public long getCompletedRefreshes() {
        return completedRefreshes.get();
    }

    public Duration getInterval() {
        return interval;
    }
}
