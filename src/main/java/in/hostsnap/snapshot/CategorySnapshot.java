package in.hostsnap.snapshot;

import in.hostsnap.infrastructure.metrics.SnapshotMetrics;
import in.hostsnap.snapshot.change.ChangeDetector;
import in.hostsnap.snapshot.change.MultisetChangeDetector;
import in.hostsnap.source.Category;
import in.hostsnap.source.FailureReason;
import in.hostsnap.source.InventorySource;
import in.hostsnap.source.QueryFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ForkJoinPool;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Most recent known state of one inventory category.
 *
 * Features:
 * - Blocking {@link #refresh()} and non-blocking {@link #refreshAsync()}
 * - Change flag computed by a pluggable {@link ChangeDetector} (multiset semantics)
 * - Atomic commit: records, timestamp, change flag and diff are swapped in as one
 *   {@link CategoryState}
 * - Failed queries leave the previous state untouched and propagate the failure
 * - Single writer: concurrent refreshes of the same instance are serialized
 *
 * Refresh cycle: Idle → Querying → Committed | Failed(unchanged) → Idle.
 *
 * @param <R> record type of the category
 */
public final class CategorySnapshot<R> {
    private static final Logger log = LoggerFactory.getLogger(CategorySnapshot.class);

    private final Category<R> category;
    private final InventorySource source;
    private final ChangeDetector changeDetector;
    private final FirstRefreshPolicy firstRefreshPolicy;
    private final Clock clock;
    private final SnapshotMetrics metrics;

    private final AtomicReference<CategoryState<R>> state = new AtomicReference<>(CategoryState.initial());
    private final ReentrantLock writeLock = new ReentrantLock();

    public CategorySnapshot(Category<R> category, InventorySource source) {
        this(category, source, MultisetChangeDetector.INSTANCE, FirstRefreshPolicy.UNCHANGED,
            Clock.systemUTC(), SnapshotMetrics.NOOP);
    }

    public CategorySnapshot(
        Category<R> category,
        InventorySource source,
        ChangeDetector changeDetector,
        FirstRefreshPolicy firstRefreshPolicy,
        Clock clock,
        SnapshotMetrics metrics
    ) {
        this.category = Objects.requireNonNull(category, "category");
        this.source = Objects.requireNonNull(source, "source");
        this.changeDetector = Objects.requireNonNull(changeDetector, "changeDetector");
        this.firstRefreshPolicy = Objects.requireNonNull(firstRefreshPolicy, "firstRefreshPolicy");
        this.clock = Objects.requireNonNull(clock, "clock");
        this.metrics = metrics == null ? SnapshotMetrics.NOOP : metrics;
    }

    // ════════════════════════════════════════════════════════════════════════
    // REFRESH
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Query the source on the calling thread and commit the result.
     *
     * @return the committed state
     * @throws QueryFailureException if the query failed; the stored state is unchanged
     */
    public CategoryState<R> refresh() {
        writeLock.lock();
        try {
            return doRefresh();
        } finally {
            writeLock.unlock();
        }
    }

    /**
     * Refresh on the common pool.
     *
     * @see #refreshAsync(Executor)
     */
    public CompletableFuture<CategoryState<R>> refreshAsync() {
        return refreshAsync(ForkJoinPool.commonPool());
    }

    /**
     * Refresh without blocking the caller.
     *
     * @param executor executor that runs the query
     * @return future completing with the committed state, or exceptionally with a
     *         {@link QueryFailureException}
     */
    public CompletableFuture<CategoryState<R>> refreshAsync(Executor executor) {
        Objects.requireNonNull(executor, "executor");
        CompletableFuture<CategoryState<R>> result = new CompletableFuture<>();
        executor.execute(() -> {
            try {
                result.complete(refresh());
            } catch (Throwable t) {
                result.completeExceptionally(t);
            }
        });
        return result;
    }

    private CategoryState<R> doRefresh() {
        String name = category.name();
        CategoryState<R> previous = state.get();
        long startNanos = System.nanoTime();

        List<R> rows;
        try {
            rows = source.query(category);
            validate(rows);
        } catch (VirtualMachineError e) {
            throw e;
        } catch (Throwable t) {
            QueryFailureException failure = QueryFailureException.from(name, t);
            Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
            recordMetrics(() -> metrics.recordRefreshFailure(name, failure.getReason(), elapsed));
            log.warn("[CategorySnapshot] {} refresh failed after {}ms ({}), keeping state from {}",
                name, elapsed.toMillis(), failure.getReason(), previous.lastUpdated());
            throw failure;
        }

        boolean changed;
        RecordDiff<R> diff;
        if (previous.isNeverRefreshed()) {
            changed = firstRefreshPolicy.firstRefreshChanged();
            diff = changed ? RecordDiff.between(List.of(), rows) : RecordDiff.empty();
        } else {
            changed = changeDetector.hasChanged(previous.records(), rows);
            diff = changed ? RecordDiff.between(previous.records(), rows) : RecordDiff.empty();
        }

        Instant now = clock.instant();
        CategoryState<R> next = new CategoryState<>(rows, now, changed, previous.refreshCount() + 1, diff);
        state.set(next);

        Duration elapsed = Duration.ofNanos(System.nanoTime() - startNanos);
        recordMetrics(() -> metrics.recordRefreshSuccess(name, elapsed, next.size(), changed, now));
        log.debug("[CategorySnapshot] {} committed {} records (changed={}, +{} -{}) in {}ms",
            name, next.size(), changed, diff.added().size(), diff.removed().size(), elapsed.toMillis());
        return next;
    }

    // Metrics never decide the outcome of a refresh
    private void recordMetrics(Runnable update) {
        try {
            update.run();
        } catch (RuntimeException e) {
            log.warn("[CategorySnapshot] {} metrics update failed: {}", category.name(), e.getMessage(), e);
        }
    }

    private void validate(List<R> rows) {
        if (rows == null) {
            throw new QueryFailureException(category.name(), FailureReason.MALFORMED_RESULT,
                "Source returned no row list");
        }
        Class<R> type = category.recordType();
        for (Object row : rows) {
            if (row == null) {
                throw new QueryFailureException(category.name(), FailureReason.MALFORMED_RESULT,
                    "Source returned a null row");
            }
            if (!type.isInstance(row)) {
                throw new QueryFailureException(category.name(), FailureReason.MALFORMED_RESULT,
                    "Expected " + type.getSimpleName() + " rows but got " + row.getClass().getSimpleName());
            }
        }
    }

    // ════════════════════════════════════════════════════════════════════════
    // ACCESSORS
    // ════════════════════════════════════════════════════════════════════════

    /**
     * Consistent view of records, timestamp, change flag and diff.
     */
    public CategoryState<R> state() {
        return state.get();
    }

    public List<R> records() {
        return state.get().records();
    }

    public Instant lastUpdated() {
        return state.get().lastUpdated();
    }

    public boolean changed() {
        return state.get().changed();
    }

    public RecordDiff<R> lastDiff() {
        return state.get().diff();
    }

    public Category<R> category() {
        return category;
    }

    public String name() {
        return category.name();
    }

    @Override
    public String toString() {
        CategoryState<R> s = state.get();
        return "CategorySnapshot{" + category.name() + ", records=" + s.size()
            + ", lastUpdated=" + s.lastUpdated() + ", changed=" + s.changed() + "}";
    }
}
