package in.hostsnap.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Decorator that puts a deadline on every query of the wrapped source.
 *
 * Platform instrumentation calls can hang. Each query runs on a daemon worker and the caller
 * waits at most {@code timeout}; on expiry the worker is interrupted and the caller receives a
 * {@link QueryFailureException} with reason {@link FailureReason#TIMEOUT}.
 *
 * Worker threads are bounded by {@code maxWorkers}. A call that ignores the interrupt keeps its
 * worker; until it returns, further queries of the same category fail fast with TIMEOUT instead
 * of taking another worker. When every worker and queue slot is held the query fails with
 * TIMEOUT as well. Queries after {@link #close()} fail with CONNECTIVITY.
 *
 * Usage:
 * <pre>
 * InventorySource source = new TimedInventorySource(new JvmHostInventorySource(), Duration.ofSeconds(10), 4);
 * source.open();
 * List&lt;ProcessRecord&gt; rows = source.query(HostCategories.PROCESSES);
 * source.close();  // closes the delegate too
 * </pre>
 */
public class TimedInventorySource implements InventorySource {
    private static final Logger log = LoggerFactory.getLogger(TimedInventorySource.class);

    public static final int DEFAULT_MAX_WORKERS = 4;

    private final InventorySource delegate;
    private final Duration timeout;
    private final int maxWorkers;
    private final ThreadPoolExecutor workers;

    // Timed-out queries whose worker has not returned yet, by category name
    private final Map<String, QueryTask<?>> abandoned = new ConcurrentHashMap<>();

    public TimedInventorySource(InventorySource delegate, Duration timeout) {
        this(delegate, timeout, DEFAULT_MAX_WORKERS);
    }

    public TimedInventorySource(InventorySource delegate, Duration timeout, int maxWorkers) {
        this.delegate = Objects.requireNonNull(delegate, "delegate");
        if (timeout == null || timeout.isZero() || timeout.isNegative()) {
            throw new IllegalArgumentException("timeout must be positive: " + timeout);
        }
        if (maxWorkers < 1) {
            throw new IllegalArgumentException("maxWorkers must be >= 1: " + maxWorkers);
        }
        this.timeout = timeout;
        this.maxWorkers = maxWorkers;

        AtomicInteger counter = new AtomicInteger();
        this.workers = new ThreadPoolExecutor(
            maxWorkers, maxWorkers, 30, TimeUnit.SECONDS,
            new ArrayBlockingQueue<>(maxWorkers),
            r -> {
                Thread t = new Thread(r, "hostsnap-query-" + counter.incrementAndGet());
                t.setDaemon(true);
                return t;
            });
        this.workers.allowCoreThreadTimeOut(true);
    }

    @Override
    public void open() {
        delegate.open();
    }

    @Override
    public <R> List<R> query(Category<R> category) {
        String name = category.name();
        if (workers.isShutdown()) {
            throw new QueryFailureException(name, FailureReason.CONNECTIVITY, "Source is closed");
        }

        QueryTask<?> previous = abandoned.get(name);
        if (previous != null) {
            if (previous.isRunning()) {
                throw new QueryFailureException(name, FailureReason.TIMEOUT,
                    "Previous query still running after its " + timeout.toMillis() + "ms deadline");
            }
            abandoned.remove(name, previous);
        }

        QueryTask<R> task = new QueryTask<>(category);
        Future<List<R>> pending;
        try {
            pending = workers.submit(task);
        } catch (RejectedExecutionException e) {
            if (workers.isShutdown()) {
                throw new QueryFailureException(name, FailureReason.CONNECTIVITY, "Source is closed", e);
            }
            log.warn("[TimedSource] No free query worker for {} ({} workers busy)", name, maxWorkers);
            throw new QueryFailureException(name, FailureReason.TIMEOUT,
                "All " + maxWorkers + " query workers are busy", e);
        }

        try {
            return pending.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            workers.purge();
            abandoned.put(name, task);
            log.warn("[TimedSource] Query for {} exceeded {}ms", name, timeout.toMillis());
            throw new QueryFailureException(name, FailureReason.TIMEOUT,
                "Query exceeded " + timeout.toMillis() + "ms", e);
        } catch (InterruptedException e) {
            pending.cancel(true);
            abandoned.put(name, task);
            Thread.currentThread().interrupt();
            throw new QueryFailureException(name, FailureReason.INTERRUPTED, "Query interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            throw QueryFailureException.from(name, cause);
        }
    }

    @Override
    public boolean supports(Category<?> category) {
        return delegate.supports(category);
    }

    @Override
    public String name() {
        return delegate.name() + "(timeout=" + timeout.toMillis() + "ms)";
    }

    public Duration getTimeout() {
        return timeout;
    }

    public int getMaxWorkers() {
        return maxWorkers;
    }

    @Override
    public void close() {
        workers.shutdownNow();
        abandoned.clear();
        delegate.close();
    }

    /**
     * One delegate query. A task cancelled before a worker picked it up never runs.
     */
    private final class QueryTask<R> implements Callable<List<R>> {
        private final Category<R> category;
        private volatile boolean started;
        private volatile boolean finished;

        QueryTask(Category<R> category) {
            this.category = category;
        }

        @Override
        public List<R> call() {
            started = true;
            try {
                return delegate.query(category);
            } finally {
                finished = true;
            }
        }

        boolean isRunning() {
            return started && !finished;
        }
    }
}
