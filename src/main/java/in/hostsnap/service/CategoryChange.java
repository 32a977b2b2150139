package in.hostsnap.service;

import in.hostsnap.snapshot.CategoryState;
import in.hostsnap.snapshot.RecordDiff;

/**
 * A category whose record set changed in the latest refresh.
 *
 * @param category category name
 * @param state committed state, including the diff against the previous refresh
 */
public record CategoryChange(String category, CategoryState<?> state) {

    public RecordDiff<?> diff() {
        return state.diff();
    }
}
