package in.hostsnap.snapshot;

/**
 * Thrown by {@link RefreshReport#throwIfFailed()} when a caller wants a root refresh to be
 * all-or-nothing. Each per-category failure is attached as a suppressed exception.
 */
public class AggregateRefreshException extends RuntimeException {

    private final RefreshReport report;

    public AggregateRefreshException(RefreshReport report) {
        super(String.format("%d of %d categories failed to refresh: %s",
            report.failures().size(), report.attempted(), report.failures().keySet()));
        this.report = report;
        report.failures().values().forEach(this::addSuppressed);
    }

    public RefreshReport getReport() {
        return report;
    }
}
