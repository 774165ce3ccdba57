package org.coregstack.tree;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.SortedSet;
import java.util.TreeSet;

import org.coregstack.stack.AcquisitionDate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Partitions the dates of a stack into tiers of a coregistration tree.
 * <p>
 * Tier 1 holds the dates within the temporal threshold of the stack reference. Each further
 * tier extends the previous one outwards: the dates within the threshold before its earliest
 * date, and after its latest date, each coregistered to the extremal date that reached them.
 * Large stacks therefore align neighbouring dates to each other instead of every date to a
 * possibly distant reference.
 * <p>
 * With the closest-date fallback enabled, a side with candidates but none within the threshold
 * uses its single closest date, so every date is eventually reached. Without it, dates past a
 * gap longer than the threshold are reported as unreachable.
 */
public class CoregistrationTreeBuilder {

    private static final Logger log = LoggerFactory.getLogger(CoregistrationTreeBuilder.class);

    private final TreeSettings settings;

    public CoregistrationTreeBuilder(TreeSettings settings) {
        this.settings = settings;
    }

    /**
     * Default stack reference: the middle date of the stack, taking the later of the two middle
     * dates when the count is even.
     *
     * @param dates the stack dates, must not be empty
     * @return the reference date
     */
    public static AcquisitionDate referenceFor(Collection<AcquisitionDate> dates) {
        if (dates.isEmpty()) {
            throw new IllegalArgumentException("Cannot choose a reference date for an empty stack");
        }
        List<AcquisitionDate> descending = new ArrayList<>(new TreeSet<>(dates));
        Collections.reverse(descending);
        return descending.get(descending.size() / 2);
    }

    /**
     * Finds the dates within the threshold of {@code pivot} on each side.
     *
     * @param pivot the date searched around, never part of the result
     * @param dates the candidate dates
     * @return earlier and later dates, each ascending
     */
    public SceneRange findScenesInRange(AcquisitionDate pivot, Collection<AcquisitionDate> dates) {
        SortedSet<AcquisitionDate> earlier = new TreeSet<>();
        SortedSet<AcquisitionDate> later = new TreeSet<>();
        AcquisitionDate closestEarlier = null;
        AcquisitionDate closestLater = null;

        for (AcquisitionDate date : dates) {
            long days = pivot.daysUntil(date);
            if (days == 0) {
                continue;
            }
            if (days < 0) {
                if (closestEarlier == null || date.isAfter(closestEarlier)) {
                    closestEarlier = date;
                }
            } else if (closestLater == null || date.isBefore(closestLater)) {
                closestLater = date;
            }
            if (Math.abs(days) > settings.thresholdDays()) {
                continue;
            }
            if (days < 0) {
                earlier.add(date);
            } else {
                later.add(date);
            }
        }

        if (settings.includeClosest()) {
            if (earlier.isEmpty() && closestEarlier != null) {
                log.info("No date within {} days before {}, using closest date {}",
                        settings.thresholdDays(), pivot, closestEarlier);
                earlier.add(closestEarlier);
            }
            if (later.isEmpty() && closestLater != null) {
                log.info("No date within {} days after {}, using closest date {}",
                        settings.thresholdDays(), pivot, closestLater);
                later.add(closestLater);
            }
        }
        return new SceneRange(new ArrayList<>(earlier), new ArrayList<>(later));
    }

    /**
     * Builds the coregistration forest rooted at {@code reference}.
     *
     * @param reference the stack reference date
     * @param dates     all stack dates; duplicates and the reference itself are ignored
     * @return the forest, with any dates no tier reached recorded as unreachable
     */
    public CoregistrationForest build(AcquisitionDate reference, Collection<AcquisitionDate> dates) {
        SortedSet<AcquisitionDate> stack = new TreeSet<>(dates);
        CoregistrationForest.Builder forest = new CoregistrationForest.Builder(reference);

        SceneRange first = findScenesInRange(reference, stack);
        List<AcquisitionDate> tier = new ArrayList<>(first.earlier());
        tier.addAll(first.later());
        Map<AcquisitionDate, AcquisitionDate> sources = new HashMap<>();
        for (AcquisitionDate date : tier) {
            sources.put(date, reference);
        }

        while (!tier.isEmpty()) {
            forest.addTier(tier, sources);
            log.debug("Tier {}: {} dates from {} to {}", forest.tierCount(), tier.size(),
                    tier.get(0), tier.get(tier.size() - 1));

            AcquisitionDate earliest = tier.get(0);
            AcquisitionDate latest = tier.get(tier.size() - 1);
            List<AcquisitionDate> next = new ArrayList<>();
            sources = new HashMap<>();

            if (earliest.isBefore(reference)) {
                for (AcquisitionDate date : findScenesInRange(earliest, stack).earlier()) {
                    next.add(date);
                    sources.put(date, earliest);
                }
            }
            if (latest.isAfter(reference)) {
                for (AcquisitionDate date : findScenesInRange(latest, stack).later()) {
                    next.add(date);
                    sources.put(date, latest);
                }
            }
            tier = next;
        }

        SortedSet<AcquisitionDate> unreachable = new TreeSet<>();
        for (AcquisitionDate date : stack) {
            if (!forest.contains(date)) {
                unreachable.add(date);
            }
        }
        if (!unreachable.isEmpty()) {
            log.warn("{} dates are not reachable from reference {} within {} days: {}",
                    unreachable.size(), reference, settings.thresholdDays(), unreachable);
        }

        CoregistrationForest result = forest.build(unreachable);
        log.info("Coregistration tree for reference {}: {} dates in {} tiers",
                reference, result.dates().size() - 1, result.tierCount());
        return result;
    }
}
