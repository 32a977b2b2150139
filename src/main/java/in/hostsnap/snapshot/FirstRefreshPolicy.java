package in.hostsnap.snapshot;

/**
 * How the change flag is set by the very first committed refresh of a category,
 * when there is no earlier record set to compare against.
 */
public enum FirstRefreshPolicy {
    /** First population is a baseline: {@code changed = false}. */
    UNCHANGED,
    /** First population counts as a change: {@code changed = true}, every record reported as added. */
    CHANGED;

    public boolean firstRefreshChanged() {
        return this == CHANGED;
    }
}
