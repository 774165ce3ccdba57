package org.coregstack.scheduler;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Nodes a resume has to run again, with the reason for each.
 *
 * @param rescheduled ids of the nodes to run, in dependency order
 * @param reasons     why each rescheduled node runs again
 */
public record ResumePlan(Set<String> rescheduled, Map<String, String> reasons) {

    public ResumePlan {
        rescheduled = Collections.unmodifiableSet(new LinkedHashSet<>(rescheduled));
        reasons = Collections.unmodifiableMap(new LinkedHashMap<>(reasons));
    }

    public boolean isEmpty() {
        return rescheduled.isEmpty();
    }

    public boolean reschedules(String id) {
        return rescheduled.contains(id);
    }
}
