package in.hostsnap.infrastructure.metrics;

import in.hostsnap.source.FailureReason;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot metrics interface for monitoring category refreshes.
 *
 * Implementations can publish to Prometheus, CloudWatch, etc.
 *
 * Key metrics:
 * - Refresh success/failure counts per category
 * - Refresh latency per category
 * - Record count and last update time per category
 * - Change count per category
 * - Query failures by reason
 */
public interface SnapshotMetrics {

    /**
     * Metrics sink that records nothing.
     */
    SnapshotMetrics NOOP = new SnapshotMetrics() {
        @Override
        public void recordRefreshSuccess(String category, Duration latency, int recordCount, boolean changed,
                                         Instant lastUpdated) {}

        @Override
        public void recordRefreshFailure(String category, FailureReason reason, Duration latency) {}
    };

    /**
     * Record a committed refresh.
     *
     * @param category Category name
     * @param latency Query plus commit time
     * @param recordCount Number of records committed
     * @param changed Change flag of the committed state
     * @param lastUpdated Timestamp of the committed state
     */
    void recordRefreshSuccess(String category, Duration latency, int recordCount, boolean changed,
                              Instant lastUpdated);

    /**
     * Record a failed refresh; the category kept its previous state.
     *
     * @param category Category name
     * @param reason Failure reason reported by the source
     * @param latency Time to failure
     */
    void recordRefreshFailure(String category, FailureReason reason, Duration latency);
}
