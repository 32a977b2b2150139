package in.hostsnap.config;

import in.hostsnap.snapshot.FirstRefreshPolicy;
import in.hostsnap.snapshot.change.ChangeDetectionMode;
import in.hostsnap.util.Env;

import java.time.Duration;
import java.util.List;

/**
 * Runtime configuration, read through {@link Env}.
 *
 * Values are kept as read; {@link in.hostsnap.bootstrap.StartupConfigValidator} checks them
 * before anything is built from them.
 *
 * @param queryTimeoutMs deadline per source query (HOSTSNAP_QUERY_TIMEOUT_MS)
 * @param maxConcurrency worker-pool bound for concurrent refresh (HOSTSNAP_MAX_CONCURRENCY)
 * @param firstRefreshChanged whether first population counts as a change (HOSTSNAP_FIRST_REFRESH_CHANGED)
 * @param changeDetection MULTISET or CONTENT_HASH (HOSTSNAP_CHANGE_DETECTION)
 * @param refreshIntervalMs scheduler period in serve mode (HOSTSNAP_REFRESH_INTERVAL_MS)
 * @param categories category names to register; empty means all (HOSTSNAP_CATEGORIES)
 * @param port HTTP port in serve mode (PORT)
 * @param runMode SNAPSHOT, FIELDS or SERVE (RUN_MODE)
 */
public record SnapshotConfig(
    long queryTimeoutMs,
    int maxConcurrency,
    boolean firstRefreshChanged,
    String changeDetection,
    long refreshIntervalMs,
    List<String> categories,
    int port,
    String runMode
) {
    public static final long DEFAULT_QUERY_TIMEOUT_MS = 10_000L;
    public static final int DEFAULT_MAX_CONCURRENCY = 4;
    public static final long DEFAULT_REFRESH_INTERVAL_MS = 30_000L;
    public static final int DEFAULT_PORT = 9090;

    public SnapshotConfig {
        categories = categories == null ? List.of() : List.copyOf(categories);
    }

    public static SnapshotConfig load() {
        return new SnapshotConfig(
            Env.getLong("HOSTSNAP_QUERY_TIMEOUT_MS", DEFAULT_QUERY_TIMEOUT_MS),
            Env.getInt("HOSTSNAP_MAX_CONCURRENCY", DEFAULT_MAX_CONCURRENCY),
            Env.getBool("HOSTSNAP_FIRST_REFRESH_CHANGED", false),
            Env.get("HOSTSNAP_CHANGE_DETECTION", ChangeDetectionMode.MULTISET.name()),
            Env.getLong("HOSTSNAP_REFRESH_INTERVAL_MS", DEFAULT_REFRESH_INTERVAL_MS),
            Env.getList("HOSTSNAP_CATEGORIES"),
            Env.getInt("PORT", DEFAULT_PORT),
            Env.get("RUN_MODE", "SNAPSHOT")
        );
    }

    public Duration queryTimeout() {
        return Duration.ofMillis(queryTimeoutMs);
    }

    public Duration refreshInterval() {
        return Duration.ofMillis(refreshIntervalMs);
    }

    public FirstRefreshPolicy firstRefreshPolicy() {
        return firstRefreshChanged ? FirstRefreshPolicy.CHANGED : FirstRefreshPolicy.UNCHANGED;
    }

    /**
     * @throws IllegalArgumentException if the configured mode is unknown
     */
    public ChangeDetectionMode changeDetectionMode() {
        return ChangeDetectionMode.valueOf(changeDetection.trim().toUpperCase());
    }

    public SnapshotConfig withRunMode(String mode) {
        return new SnapshotConfig(queryTimeoutMs, maxConcurrency, firstRefreshChanged, changeDetection,
            refreshIntervalMs, categories, port, mode);
    }
}
