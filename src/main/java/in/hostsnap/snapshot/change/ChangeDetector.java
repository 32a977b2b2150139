package in.hostsnap.snapshot.change;

import java.util.Collection;

/**
 * Decides whether a category's record set changed between two adjacent refreshes.
 *
 * Implementations compare the collections as unordered multisets of value-equal records:
 * order is ignored, multiplicity is not.
 */
public interface ChangeDetector {

    /**
     * @param previous records stored before the refresh
     * @param current records returned by the refresh
     * @return true if the two collections differ as multisets
     */
    boolean hasChanged(Collection<?> previous, Collection<?> current);
}
