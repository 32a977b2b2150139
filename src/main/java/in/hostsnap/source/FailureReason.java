package in.hostsnap.source;

/**
 * Why a category query did not produce rows.
 */
public enum FailureReason {
    /** Source not open, connection lost, or the platform call could not reach the data. */
    CONNECTIVITY,
    /** The platform refused access to the data. */
    PERMISSION_DENIED,
    /** The query exceeded its deadline. */
    TIMEOUT,
    /** The source answered, but with rows that cannot be used (null list, null rows, wrong type). */
    MALFORMED_RESULT,
    /** The querying thread was interrupted. */
    INTERRUPTED,
    /** The source does not know the requested category. */
    UNSUPPORTED,
    UNKNOWN
}
