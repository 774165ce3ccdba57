package org.coregstack.scheduler;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.TreeSet;

/**
 * A validated, acyclic set of task nodes.
 * <p>
 * Construction rejects duplicate ids, dependencies on unknown ids and cycles with a
 * {@link StructuralException} before anything runs.
 */
public final class TaskGraph {

    private final Map<String, TaskNode> nodes;
    private final Map<String, Set<String>> dependents;
    private final List<String> order;

    private TaskGraph(Map<String, TaskNode> nodes, Map<String, Set<String>> dependents, List<String> order) {
        this.nodes = nodes;
        this.dependents = dependents;
        this.order = order;
    }

    public static TaskGraph of(Collection<TaskNode> taskNodes) {
        Map<String, TaskNode> nodes = new LinkedHashMap<>();
        for (TaskNode node : taskNodes) {
            if (nodes.putIfAbsent(node.id(), node) != null) {
                throw new StructuralException("Duplicate task id: " + node.id());
            }
        }

        Map<String, Set<String>> dependents = new LinkedHashMap<>();
        for (String id : nodes.keySet()) {
            dependents.put(id, new LinkedHashSet<>());
        }
        for (TaskNode node : nodes.values()) {
            for (String dependency : node.dependencies()) {
                if (!nodes.containsKey(dependency)) {
                    throw new StructuralException("Task " + node.id() + " depends on unknown task " + dependency);
                }
                dependents.get(dependency).add(node.id());
            }
        }

        List<String> order = topologicalOrder(nodes, dependents);
        Map<String, Set<String>> frozen = new LinkedHashMap<>();
        dependents.forEach((id, set) -> frozen.put(id, Collections.unmodifiableSet(set)));
        return new TaskGraph(Collections.unmodifiableMap(nodes), Collections.unmodifiableMap(frozen),
                Collections.unmodifiableList(order));
    }

    /**
     * Kahn's algorithm; nodes left with unresolved dependencies form at least one cycle.
     */
    private static List<String> topologicalOrder(Map<String, TaskNode> nodes, Map<String, Set<String>> dependents) {
        Map<String, Integer> remaining = new LinkedHashMap<>();
        Queue<String> ready = new ArrayDeque<>();
        for (TaskNode node : nodes.values()) {
            remaining.put(node.id(), node.dependencies().size());
            if (node.dependencies().isEmpty()) {
                ready.add(node.id());
            }
        }

        List<String> sorted = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            String current = ready.poll();
            sorted.add(current);
            for (String dependent : dependents.get(current)) {
                if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (sorted.size() != nodes.size()) {
            Set<String> cyclic = new TreeSet<>(nodes.keySet());
            sorted.forEach(cyclic::remove);
            throw new StructuralException("Circular dependency detected among tasks: " + cyclic);
        }
        return sorted;
    }

    public int size() {
        return nodes.size();
    }

    public boolean contains(String id) {
        return nodes.containsKey(id);
    }

    public TaskNode node(String id) {
        TaskNode node = nodes.get(id);
        if (node == null) {
            throw new IllegalArgumentException("Unknown task " + id);
        }
        return node;
    }

    /** Nodes in dependency order. */
    public List<TaskNode> nodes() {
        List<TaskNode> sorted = new ArrayList<>(order.size());
        for (String id : order) {
            sorted.add(nodes.get(id));
        }
        return sorted;
    }

    public List<String> order() {
        return order;
    }

    public Set<String> dependentsOf(String id) {
        return dependents.getOrDefault(id, Set.of());
    }

    /**
     * All nodes {@code id} depends on, directly or indirectly, nearest first.
     */
    public List<String> ancestorsOf(String id) {
        List<String> ancestors = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        Queue<String> queue = new ArrayDeque<>(node(id).dependencies());
        while (!queue.isEmpty()) {
            String current = queue.poll();
            if (seen.add(current)) {
                ancestors.add(current);
                queue.addAll(nodes.get(current).dependencies());
            }
        }
        return ancestors;
    }
}
