package in.hostsnap.source;

/**
 * Exception thrown when an inventory source cannot complete the query for one category.
 *
 * The category snapshot that issued the query keeps its previous state untouched and
 * rethrows this exception to its caller.
 */
public class QueryFailureException extends RuntimeException {

    private final String category;
    private final FailureReason reason;

    public QueryFailureException(String category, FailureReason reason, String message) {
        super(String.format("[%s:%s] %s", category, reason, message));
        this.category = category;
        this.reason = reason;
    }

    public QueryFailureException(String category, FailureReason reason, String message, Throwable cause) {
        super(String.format("[%s:%s] %s", category, reason, message), cause);
        this.category = category;
        this.reason = reason;
    }

    /**
     * Normalize any throwable raised while refreshing {@code category} into a query failure.
     * Query failures pass through unchanged; anything else becomes {@link FailureReason#UNKNOWN},
     * or {@link FailureReason#INTERRUPTED} for interrupts.
     */
    public static QueryFailureException from(String category, Throwable error) {
        if (error instanceof QueryFailureException) {
            return (QueryFailureException) error;
        }
        if (error instanceof InterruptedException) {
            return new QueryFailureException(category, FailureReason.INTERRUPTED, "Query interrupted", error);
        }
        String message = error.getMessage() != null ? error.getMessage() : error.getClass().getSimpleName();
        return new QueryFailureException(category, FailureReason.UNKNOWN, message, error);
    }

    public String getCategory() {
        return category;
    }

    public FailureReason getReason() {
        return reason;
    }
}
