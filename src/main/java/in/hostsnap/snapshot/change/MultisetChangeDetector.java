package in.hostsnap.snapshot.change;

import java.util.Collection;
import java.util.HashMap;
import java.util.Map;

/**
 * Exact multiset comparison using per-record occurrence counts.
 */
public final class MultisetChangeDetector implements ChangeDetector {

    public static final MultisetChangeDetector INSTANCE = new MultisetChangeDetector();

    private MultisetChangeDetector() {}

    @Override
    public boolean hasChanged(Collection<?> previous, Collection<?> current) {
        if (previous.size() != current.size()) {
            return true;
        }
        if (previous.isEmpty()) {
            return false;
        }

        Map<Object, Integer> counts = new HashMap<>(previous.size() * 2);
        for (Object record : previous) {
            counts.merge(record, 1, Integer::sum);
        }
        for (Object record : current) {
            Integer remaining = counts.get(record);
            if (remaining == null) {
                return true;
            }
            if (remaining == 1) {
                counts.remove(record);
            } else {
                counts.put(record, remaining - 1);
            }
        }
        return !counts.isEmpty();
    }

    @Override
    public String toString() {
        return "MULTISET";
    }
}
