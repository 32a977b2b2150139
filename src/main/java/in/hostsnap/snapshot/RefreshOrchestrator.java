package in.hostsnap.snapshot;

import in.hostsnap.source.QueryFailureException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the refreshes of a set of category snapshots and folds the outcomes into one
 * {@link RefreshReport}.
 *
 * Sequential mode refreshes each category on the calling thread in the given order.
 * Concurrent mode submits every category to a fixed worker pool before awaiting any of them,
 * then joins on all; the pool size bounds how many source queries run at once.
 * In both modes a failing category never stops or cancels the others.
 */
public final class RefreshOrchestrator implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(RefreshOrchestrator.class);

    private final int maxConcurrency;
    private final Clock clock;
    private final ExecutorService workers;

    public RefreshOrchestrator(int maxConcurrency, Clock clock) {
        if (maxConcurrency < 1) {
            throw new IllegalArgumentException("maxConcurrency must be >= 1: " + maxConcurrency);
        }
        this.maxConcurrency = maxConcurrency;
        this.clock = clock;

        AtomicInteger counter = new AtomicInteger();
        this.workers = Executors.newFixedThreadPool(maxConcurrency, r -> {
            Thread t = new Thread(r, "hostsnap-refresh-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Refresh each snapshot on the calling thread, in iteration order.
     */
    public RefreshReport refreshSequentially(Collection<CategorySnapshot<?>> snapshots) {
        Instant startedAt = clock.instant();
        Map<String, CategoryState<?>> committed = new LinkedHashMap<>();
        Map<String, QueryFailureException> failures = new LinkedHashMap<>();

        for (CategorySnapshot<?> snapshot : snapshots) {
            try {
                committed.put(snapshot.name(), snapshot.refresh());
            } catch (VirtualMachineError e) {
                throw e;
            } catch (Throwable t) {
                failures.put(snapshot.name(), QueryFailureException.from(snapshot.name(), t));
            }
        }

        RefreshReport report = new RefreshReport(startedAt, clock.instant(), committed, failures);
        log.info("[RefreshOrchestrator] Sequential refresh: {}", report.summary());
        return report;
    }

    /**
     * Start every snapshot's refresh on the worker pool and complete once all have settled.
     *
     * @return future that always completes normally with the report
     * @throws IllegalStateException if the orchestrator is closed
     */
    public CompletableFuture<RefreshReport> refreshConcurrently(Collection<CategorySnapshot<?>> snapshots) {
        if (workers.isShutdown()) {
            throw new IllegalStateException("RefreshOrchestrator is closed");
        }
        Instant startedAt = clock.instant();

        // Fan out: everything is submitted before anything is awaited.
        List<CategorySnapshot<?>> order = new ArrayList<>(snapshots);
        List<CompletableFuture<Outcome>> pending = new ArrayList<>(order.size());
        for (CategorySnapshot<?> snapshot : order) {
            pending.add(snapshot.refreshAsync(workers).handle((committed, error) ->
                error == null
                    ? new Outcome(committed, null)
                    : new Outcome(null, QueryFailureException.from(snapshot.name(), unwrap(error)))));
        }

        // Fan in
        return CompletableFuture.allOf(pending.toArray(new CompletableFuture<?>[0]))
            .thenApply(ignored -> {
                Map<String, CategoryState<?>> committed = new LinkedHashMap<>();
                Map<String, QueryFailureException> failures = new LinkedHashMap<>();
                for (int i = 0; i < order.size(); i++) {
                    String name = order.get(i).name();
                    Outcome outcome = pending.get(i).join();
                    if (outcome.failure() != null) {
                        failures.put(name, outcome.failure());
                    } else {
                        committed.put(name, outcome.committed());
                    }
                }
                RefreshReport report = new RefreshReport(startedAt, clock.instant(), committed, failures);
                log.info("[RefreshOrchestrator] Concurrent refresh (max {} workers): {}",
                    maxConcurrency, report.summary());
                return report;
            });
    }

    public int getMaxConcurrency() {
        return maxConcurrency;
    }

    @Override
    public void close() {
        workers.shutdown();
        try {
            if (!workers.awaitTermination(5, TimeUnit.SECONDS)) {
                workers.shutdownNow();
            }
        } catch (InterruptedException e) {
            workers.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
            && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private record Outcome(CategoryState<?> committed, QueryFailureException failure) {}
}
