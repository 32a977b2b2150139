package in.hostsnap.snapshot;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Multiset difference between two adjacent record sets of one category.
 *
 * {@code added} holds records present in the new set more often than in the old one,
 * {@code removed} the reverse. A record whose count went from 2 to 1 appears once in
 * {@code removed}.
 */
public record RecordDiff<R>(List<R> added, List<R> removed) {

    private static final RecordDiff<?> EMPTY = new RecordDiff<>(List.of(), List.of());

    public RecordDiff {
        added = Collections.unmodifiableList(new ArrayList<>(added));
        removed = Collections.unmodifiableList(new ArrayList<>(removed));
    }

    @SuppressWarnings("unchecked")
    public static <R> RecordDiff<R> empty() {
        return (RecordDiff<R>) EMPTY;
    }

    public static <R> RecordDiff<R> between(Collection<R> previous, Collection<R> current) {
        return new RecordDiff<>(subtract(current, previous), subtract(previous, current));
    }

    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty();
    }

    // Elements of 'from' left over after removing one occurrence per element of 'other', in 'from' order.
    private static <R> List<R> subtract(Collection<R> from, Collection<R> other) {
        Map<R, Integer> counts = new HashMap<>();
        for (R r : other) {
            counts.merge(r, 1, Integer::sum);
        }
        List<R> rest = new ArrayList<>();
        for (R r : from) {
            Integer n = counts.get(r);
            if (n == null) {
                rest.add(r);
            } else if (n == 1) {
                counts.remove(r);
            } else {
                counts.put(r, n - 1);
            }
        }
        return rest;
    }
}
