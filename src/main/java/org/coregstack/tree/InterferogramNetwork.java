package org.coregstack.tree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

import org.coregstack.stack.AcquisitionDate;
import org.coregstack.stack.DatePair;

/**
 * Interferogram pairs of a stack: each date is paired with up to {@code connections} following
 * dates whose temporal baseline does not exceed {@code maxBaselineDays}.
 */
public final class InterferogramNetwork {

    private InterferogramNetwork() {
    }

    public static List<DatePair> sequential(Collection<AcquisitionDate> dates, int connections, int maxBaselineDays) {
        if (connections < 1) {
            throw new IllegalArgumentException("connections must be >= 1, got " + connections);
        }
        List<AcquisitionDate> ordered = new ArrayList<>(new TreeSet<>(dates));
        List<DatePair> pairs = new ArrayList<>();
        for (int i = 0; i < ordered.size(); i++) {
            AcquisitionDate primary = ordered.get(i);
            for (int j = i + 1; j < ordered.size() && j <= i + connections; j++) {
                AcquisitionDate secondary = ordered.get(j);
                if (primary.daysUntil(secondary) > maxBaselineDays) {
                    break;
                }
                pairs.add(new DatePair(primary, secondary));
            }
        }
        return pairs;
    }
}
