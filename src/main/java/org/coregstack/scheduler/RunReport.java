package org.coregstack.scheduler;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of every node of one scheduler run.
 */
public final class RunReport {

    public static final String SUMMARY_SUFFIX = "_run_summary.out";

    /**
     * Outcome of a node in this run.
     */
    public enum NodeState {
        /** Already complete, not run. */
        SKIPPED,
        SUCCEEDED,
        /** Succeeded with accuracy warnings. */
        DEGRADED,
        FAILED,
        /** Not run because a dependency failed. */
        BLOCKED,
        /** Interrupted while running; no marker written, so the next run repeats it. */
        ABORTED
    }

    /**
     * @param id       node id
     * @param kind     node kind
     * @param state    outcome
     * @param warnings accuracy warnings of a degraded node
     * @param error    failure message of a failed node, the failed dependency of a blocked one,
     *                 or {@code interrupted} for an aborted one
     */
    public record Entry(String id, String kind, NodeState state, List<String> warnings, String error) {

        public Entry {
            warnings = List.copyOf(warnings);
        }
    }

    private final String stackId;
    private final Map<String, Entry> entries;
    private final boolean interrupted;

    private RunReport(String stackId, Map<String, Entry> entries, boolean interrupted) {
        this.stackId = stackId;
        this.entries = Collections.unmodifiableMap(entries);
        this.interrupted = interrupted;
    }

    public String stackId() {
        return stackId;
    }

    public List<Entry> entries() {
        return new ArrayList<>(entries.values());
    }

    public NodeState state(String id) {
        Entry entry = entries.get(id);
        if (entry == null) {
            throw new IllegalArgumentException("No report entry for task " + id);
        }
        return entry.state();
    }

    public Entry entry(String id) {
        return entries.get(id);
    }

    /** True when the run was aborted before all nodes were processed. */
    public boolean interrupted() {
        return interrupted;
    }

    public Map<NodeState, Integer> counts() {
        Map<NodeState, Integer> counts = new EnumMap<>(NodeState.class);
        for (NodeState state : NodeState.values()) {
            counts.put(state, 0);
        }
        entries.values().forEach(entry -> counts.merge(entry.state(), 1, Integer::sum));
        return counts;
    }

    public int count(NodeState state) {
        return counts().get(state);
    }

    /** Ids of the nodes with the given outcome, in execution order. */
    public List<String> idsWith(NodeState state) {
        List<String> ids = new ArrayList<>();
        entries.values().stream().filter(entry -> entry.state() == state).forEach(entry -> ids.add(entry.id()));
        return ids;
    }

    public boolean hasFailures() {
        return interrupted || count(NodeState.FAILED) > 0 || count(NodeState.BLOCKED) > 0
                || count(NodeState.ABORTED) > 0;
    }

    public String summaryLine() {
        Map<NodeState, Integer> counts = counts();
        return "Stack " + stackId + (interrupted ? " (interrupted)" : "") + ": "
                + counts.get(NodeState.SUCCEEDED) + " succeeded, "
                + counts.get(NodeState.DEGRADED) + " degraded, "
                + counts.get(NodeState.FAILED) + " failed, "
                + counts.get(NodeState.BLOCKED) + " blocked, "
                + counts.get(NodeState.SKIPPED) + " skipped"
                + (counts.get(NodeState.ABORTED) > 0 ? ", " + counts.get(NodeState.ABORTED) + " aborted" : "");
    }

    /**
     * Writes {@code {stackId}_run_summary.out} into {@code workDirectory}.
     *
     * @return the written file
     */
    public Path write(Path workDirectory) throws IOException {
        StringBuilder text = new StringBuilder(summaryLine()).append('\n');
        for (Entry entry : entries.values()) {
            text.append(entry.state()).append('\t').append(entry.kind()).append('\t').append(entry.id());
            if (entry.error() != null) {
                text.append('\t').append(entry.error().replace('\n', ' '));
            } else if (!entry.warnings().isEmpty()) {
                text.append('\t').append(entry.warnings().size()).append(" accuracy warnings");
            }
            text.append('\n');
        }
        Files.createDirectories(workDirectory);
        Path summary = workDirectory.resolve(stackId + SUMMARY_SUFFIX);
        Files.writeString(summary, text.toString(), StandardCharsets.UTF_8);
        return summary;
    }

    static Builder builder(String stackId) {
        return new Builder(stackId);
    }

    static final class Builder {

        private final String stackId;
        private final Map<String, Entry> entries = new LinkedHashMap<>();
        private boolean interrupted;

        private Builder(String stackId) {
            this.stackId = stackId;
        }

        Builder add(TaskNode node, NodeState state, List<String> warnings, String error) {
            entries.put(node.id(), new Entry(node.id(), node.kind(), state, warnings, error));
            return this;
        }

        boolean has(String id) {
            return entries.containsKey(id);
        }

        Builder interrupted() {
            this.interrupted = true;
            return this;
        }

        RunReport build() {
            return new RunReport(stackId, new LinkedHashMap<>(entries), interrupted);
        }
    }
}
