package org.coregstack.tree;

import java.util.List;

import org.coregstack.stack.AcquisitionDate;

/**
 * One level of the coregistration tree.
 *
 * @param index 1-based tier number, tier 1 is aligned directly to the stack reference
 * @param dates the dates of the tier, ascending
 */
public record CoregistrationTier(int index, List<AcquisitionDate> dates) {

    public CoregistrationTier {
        if (index < 1) {
            throw new IllegalArgumentException("Tier index is 1-based, got " + index);
        }
        dates = List.copyOf(dates);
    }

    public AcquisitionDate earliest() {
        return dates.get(0);
    }

    public AcquisitionDate latest() {
        return dates.get(dates.size() - 1);
    }
}
