package in.hostsnap.bootstrap;

import in.hostsnap.config.SnapshotConfig;
import in.hostsnap.infrastructure.jvm.HostCategories;
import in.hostsnap.snapshot.change.ChangeDetectionMode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Startup configuration validator.
 *
 * Checks every configured value before the snapshot is built and reports all violations
 * at once. Throws IllegalStateException if configuration is invalid.
 */
public final class StartupConfigValidator {
    private static final Logger log = LoggerFactory.getLogger(StartupConfigValidator.class);

    private static final Set<String> RUN_MODES = Set.of("SNAPSHOT", "FIELDS", "SERVE");

    /**
     * @throws IllegalStateException listing every invalid setting
     */
    public static void validate(SnapshotConfig config) {
        List<String> violations = new ArrayList<>();

        if (config.queryTimeoutMs() <= 0) {
            violations.add("HOSTSNAP_QUERY_TIMEOUT_MS must be positive (got " + config.queryTimeoutMs() + ")");
        }
        if (config.maxConcurrency() < 1) {
            violations.add("HOSTSNAP_MAX_CONCURRENCY must be at least 1 (got " + config.maxConcurrency() + ")");
        }
        if (config.refreshIntervalMs() <= 0) {
            violations.add("HOSTSNAP_REFRESH_INTERVAL_MS must be positive (got " + config.refreshIntervalMs() + ")");
        }
        if (config.port() < 0 || config.port() > 65535) {
            violations.add("PORT must be between 0 and 65535 (got " + config.port() + ")");
        }
        try {
            config.changeDetectionMode();
        } catch (IllegalArgumentException e) {
            violations.add("HOSTSNAP_CHANGE_DETECTION must be one of "
                + Arrays.toString(ChangeDetectionMode.values()) + " (got " + config.changeDetection() + ")");
        }
        Set<String> seen = new HashSet<>();
        for (String name : config.categories()) {
            if (HostCategories.byName(name).isEmpty()) {
                violations.add("HOSTSNAP_CATEGORIES contains unknown category '" + name + "'");
            } else if (!seen.add(name.trim().toLowerCase())) {
                violations.add("HOSTSNAP_CATEGORIES lists category '" + name + "' more than once");
            }
        }
        if (config.runMode() == null || !RUN_MODES.contains(config.runMode().toUpperCase())) {
            violations.add("RUN_MODE must be one of " + RUN_MODES + " (got " + config.runMode() + ")");
        }

        if (!violations.isEmpty()) {
            throw new IllegalStateException(
                "INVALID CONFIG:\n  - " + String.join("\n  - ", violations));
        }

        log.info("✓ Config valid: timeout={}ms, concurrency={}, changeDetection={}, firstRefresh={}, categories={}",
            config.queryTimeoutMs(), config.maxConcurrency(), config.changeDetectionMode(),
            config.firstRefreshPolicy(), config.categories().isEmpty() ? "ALL" : config.categories());
    }

    private StartupConfigValidator() {}
}
