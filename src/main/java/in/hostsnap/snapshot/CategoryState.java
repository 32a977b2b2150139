package in.hostsnap.snapshot;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable state of one category as of its last committed refresh.
 *
 * A category snapshot publishes a new instance per commit, so records, timestamp,
 * change flag and diff are always read together.
 *
 * @param records records in source order
 * @param lastUpdated commit time, or {@link #NEVER} before the first refresh
 * @param changed whether the commit changed the record set
 * @param refreshCount number of committed refreshes so far
 * @param diff records added and removed by the commit
 */
public record CategoryState<R>(
    List<R> records,
    Instant lastUpdated,
    boolean changed,
    long refreshCount,
    RecordDiff<R> diff
) {
    /** Timestamp of a category that has never been refreshed. */
    public static final Instant NEVER = Instant.EPOCH;

    public CategoryState {
        records = Collections.unmodifiableList(new ArrayList<>(records));
        Objects.requireNonNull(lastUpdated, "lastUpdated");
        Objects.requireNonNull(diff, "diff");
    }

    public static <R> CategoryState<R> initial() {
        return new CategoryState<>(List.of(), NEVER, false, 0L, RecordDiff.empty());
    }

    public boolean isNeverRefreshed() {
        return refreshCount == 0L;
    }

    public int size() {
        return records.size();
    }
}
