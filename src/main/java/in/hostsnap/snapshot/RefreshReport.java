package in.hostsnap.snapshot;

import in.hostsnap.source.QueryFailureException;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of one root snapshot refresh.
 *
 * Partial success is a normal outcome: failed categories kept their previous state and are
 * listed in {@code failures}; every other attempted category maps to the state its refresh
 * committed. Both maps follow the root's registration order.
 *
 * @param startedAt when the refresh started
 * @param finishedAt when the last category settled
 * @param committed state committed by each successful category during this refresh
 * @param failures failed categories and why
 */
public record RefreshReport(
    Instant startedAt,
    Instant finishedAt,
    Map<String, CategoryState<?>> committed,
    Map<String, QueryFailureException> failures
) {
    public RefreshReport {
        committed = Collections.unmodifiableMap(new LinkedHashMap<>(committed));
        failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }

    /**
     * Categories that committed new state.
     */
    public List<String> succeeded() {
        return List.copyOf(committed.keySet());
    }

    /**
     * Successful categories whose committed state has the change flag set.
     */
    public List<String> changed() {
        List<String> names = new ArrayList<>();
        committed.forEach((name, state) -> {
            if (state.changed()) {
                names.add(name);
            }
        });
        return names;
    }

    /**
     * True if every attempted category committed.
     */
    public boolean isComplete() {
        return failures.isEmpty();
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }

    public boolean hasChanges() {
        return !changed().isEmpty();
    }

    public int attempted() {
        return committed.size() + failures.size();
    }

    public Duration duration() {
        return Duration.between(startedAt, finishedAt);
    }

    /**
     * All-or-nothing view of this report.
     *
     * @throws AggregateRefreshException if any category failed
     */
    public RefreshReport throwIfFailed() {
        if (hasFailures()) {
            throw new AggregateRefreshException(this);
        }
        return this;
    }

    /**
     * One-line summary for logs.
     */
    public String summary() {
        return String.format("%d/%d categories refreshed, %d changed, %d failed%s in %dms",
            committed.size(), attempted(), changed().size(), failures.size(),
            failures.isEmpty() ? "" : " " + failures.keySet(), duration().toMillis());
    }
}
