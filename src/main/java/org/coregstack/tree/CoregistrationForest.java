package org.coregstack.tree;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.SortedSet;
import java.util.TreeSet;

import org.coregstack.stack.AcquisitionDate;

/**
 * Coregistration tree of a stack: every reachable date with its local reference and tier.
 * <p>
 * Nodes are held in an arena indexed by insertion order. Node 0 is the stack reference
 * (tier 0, no parent); every other node has exactly one parent in a strictly lower tier.
 * Instances are immutable once built and are shared by list-file writing, task planning
 * and reporting.
 */
public final class CoregistrationForest {

    private static final int NO_PARENT = -1;

    private final List<AcquisitionDate> nodes;
    private final int[] parents;
    private final int[] tierIndices;
    private final Map<AcquisitionDate, Integer> indexByDate;
    private final List<CoregistrationTier> tiers;
    private final SortedSet<AcquisitionDate> unreachable;

    private CoregistrationForest(List<AcquisitionDate> nodes, int[] parents, int[] tierIndices,
                                 List<CoregistrationTier> tiers, SortedSet<AcquisitionDate> unreachable) {
        this.nodes = List.copyOf(nodes);
        this.parents = parents;
        this.tierIndices = tierIndices;
        this.tiers = List.copyOf(tiers);
        this.unreachable = Collections.unmodifiableSortedSet(new TreeSet<>(unreachable));
        Map<AcquisitionDate, Integer> index = new HashMap<>();
        for (int i = 0; i < nodes.size(); i++) {
            index.put(nodes.get(i), i);
        }
        this.indexByDate = Collections.unmodifiableMap(index);
    }

    public AcquisitionDate reference() {
        return nodes.get(0);
    }

    public List<CoregistrationTier> tiers() {
        return tiers;
    }

    public int tierCount() {
        return tiers.size();
    }

    /**
     * Dates that no tier reached. Only possible when the closest-date fallback is disabled.
     */
    public SortedSet<AcquisitionDate> unreachable() {
        return unreachable;
    }

    public boolean contains(AcquisitionDate date) {
        return indexByDate.containsKey(date);
    }

    /** All dates of the forest, reference included, ascending. */
    public SortedSet<AcquisitionDate> dates() {
        return Collections.unmodifiableSortedSet(new TreeSet<>(nodes));
    }

    /** Local reference of {@code date}; empty for the stack reference. */
    public Optional<AcquisitionDate> parentOf(AcquisitionDate date) {
        int parent = parents[indexOf(date)];
        return parent == NO_PARENT ? Optional.empty() : Optional.of(nodes.get(parent));
    }

    /** Tier of {@code date}; 0 for the stack reference. */
    public int tierOf(AcquisitionDate date) {
        return tierIndices[indexOf(date)];
    }

    /**
     * Edges in tier order, ascending target date within a tier.
     */
    public List<CoregistrationEdge> edges() {
        List<CoregistrationEdge> edges = new ArrayList<>(nodes.size() - 1);
        for (CoregistrationTier tier : tiers) {
            for (AcquisitionDate target : tier.dates()) {
                edges.add(new CoregistrationEdge(parentOf(target).orElseThrow(), target, tier.index()));
            }
        }
        return edges;
    }

    /** Dates whose local reference is {@code date}, ascending. */
    public List<AcquisitionDate> childrenOf(AcquisitionDate date) {
        int index = indexOf(date);
        List<AcquisitionDate> children = new ArrayList<>();
        for (int i = 1; i < nodes.size(); i++) {
            if (parents[i] == index) {
                children.add(nodes.get(i));
            }
        }
        Collections.sort(children);
        return children;
    }

    /**
     * Chain of local references from {@code date} back to the stack reference, both inclusive.
     */
    public List<AcquisitionDate> pathToReference(AcquisitionDate date) {
        List<AcquisitionDate> path = new ArrayList<>();
        int current = indexOf(date);
        while (current != NO_PARENT) {
            path.add(nodes.get(current));
            current = parents[current];
        }
        return path;
    }

    private int indexOf(AcquisitionDate date) {
        Integer index = indexByDate.get(date);
        if (index == null) {
            throw new IllegalArgumentException("Date " + date + " is not part of the coregistration forest");
        }
        return index;
    }

    /**
     * Assembles a forest tier by tier. Parents must be added before their children.
     */
    static final class Builder {

        private final List<AcquisitionDate> nodes = new ArrayList<>();
        private final List<Integer> parents = new ArrayList<>();
        private final List<Integer> tierIndices = new ArrayList<>();
        private final Map<AcquisitionDate, Integer> indexByDate = new HashMap<>();
        private final List<CoregistrationTier> tiers = new ArrayList<>();

        Builder(AcquisitionDate reference) {
            append(reference, NO_PARENT, 0);
        }

        boolean contains(AcquisitionDate date) {
            return indexByDate.containsKey(date);
        }

        int tierCount() {
            return tiers.size();
        }

        /**
         * Adds a complete tier.
         *
         * @param sources local reference of each date of the tier
         */
        void addTier(List<AcquisitionDate> dates, Map<AcquisitionDate, AcquisitionDate> sources) {
            int tierIndex = tiers.size() + 1;
            for (AcquisitionDate date : dates) {
                Integer parent = indexByDate.get(sources.get(date));
                if (parent == null || tierIndices.get(parent) >= tierIndex) {
                    throw new IllegalStateException("Local reference of " + date + " is not in a lower tier");
                }
                if (contains(date)) {
                    throw new IllegalStateException("Date " + date + " already placed in tier "
                            + tierIndices.get(indexByDate.get(date)));
                }
                append(date, parent, tierIndex);
            }
            tiers.add(new CoregistrationTier(tierIndex, dates));
        }

        private void append(AcquisitionDate date, int parent, int tier) {
            indexByDate.put(date, nodes.size());
            nodes.add(date);
            parents.add(parent);
            tierIndices.add(tier);
        }

        CoregistrationForest build(SortedSet<AcquisitionDate> unreachable) {
            int[] parentArray = parents.stream().mapToInt(Integer::intValue).toArray();
            int[] tierArray = tierIndices.stream().mapToInt(Integer::intValue).toArray();
            return new CoregistrationForest(nodes, parentArray, tierArray, tiers, unreachable);
        }
    }
}
