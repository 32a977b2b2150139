package in.hostsnap.source;

import java.util.List;

/**
 * InventorySource interface for fetching the current rows of one category.
 *
 * Responsibilities:
 * - Run one typed query per category refresh
 * - Report failures as {@link QueryFailureException} with a {@link FailureReason}
 *
 * Thread safety:
 * - A single source is shared by every category of a root snapshot
 * - {@link #query(Category)} may be called concurrently from several refresh workers
 *
 * Lifecycle:
 * 1. open() - Acquire the underlying instrumentation handle
 * 2. query() - Any number of times, from any thread
 * 3. close() - Release the handle; later queries fail with CONNECTIVITY
 */
public interface InventorySource extends AutoCloseable {

    /**
     * Acquire whatever the source needs before the first query.
     * Calling open() on an already open source has no effect.
     */
    void open();

    /**
     * Fetch the current rows of a category.
     *
     * @param category the category to query
     * @return the rows, in source order; never null
     * @throws QueryFailureException if the rows could not be fetched
     */
    <R> List<R> query(Category<R> category);

    /**
     * Whether this source can answer queries for the given category.
     */
    default boolean supports(Category<?> category) {
        return true;
    }

    /**
     * Short name used in logs.
     */
    default String name() {
        return getClass().getSimpleName();
    }

    @Override
    void close();
}
