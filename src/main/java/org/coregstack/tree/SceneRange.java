package org.coregstack.tree;

import java.util.List;

import org.coregstack.stack.AcquisitionDate;

/**
 * Dates found on either side of a pivot date.
 *
 * @param earlier dates before the pivot, ascending
 * @param later   dates after the pivot, ascending
 */
public record SceneRange(List<AcquisitionDate> earlier, List<AcquisitionDate> later) {

    public SceneRange {
        earlier = List.copyOf(earlier);
        later = List.copyOf(later);
    }

    public boolean isEmpty() {
        return earlier.isEmpty() && later.isEmpty();
    }
}
