package org.coregstack.scheduler;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A unit of schedulable work.
 * <p>
 * Nodes are rebuilt from the stack definition on every run; only their completion markers
 * persist. Declared inputs and outputs drive resume: a node whose outputs are gone is run again,
 * and a missing input is traced back to the dependency that declares it as an output.
 *
 * @param id               unique id, also the completion marker name
 * @param kind             kind of work, for reporting
 * @param dependencies     ids of the nodes that must succeed first
 * @param inputs           files read by the node
 * @param outputs          files written by the node
 * @param workingDirectory directory the node writes into
 * @param context          logging context of the node
 * @param action           the work
 */
public record TaskNode(
        String id,
        String kind,
        Set<String> dependencies,
        List<Path> inputs,
        List<Path> outputs,
        Path workingDirectory,
        TaskContext context,
        TaskAction action
) {

    public TaskNode {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(action, "action");
        dependencies = Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        context = context == null ? TaskContext.empty() : context;
    }

    public static Builder builder(String id, String kind) {
        return new Builder(id, kind);
    }

    @Override
    public String toString() {
        return kind + "[" + id + "]";
    }

    /**
     * Fluent builder of task nodes.
     */
    public static final class Builder {

        private final String id;
        private final String kind;
        private final Set<String> dependencies = new LinkedHashSet<>();
        private final List<Path> inputs = new ArrayList<>();
        private final List<Path> outputs = new ArrayList<>();
        private Path workingDirectory;
        private TaskContext context = TaskContext.empty();
        private TaskAction action;

        private Builder(String id, String kind) {
            this.id = id;
            this.kind = kind;
        }

        public Builder dependsOn(String dependency) {
            dependencies.add(dependency);
            return this;
        }

        public Builder input(Path input) {
            inputs.add(input);
            return this;
        }

        public Builder output(Path output) {
            outputs.add(output);
            return this;
        }

        public Builder workingDirectory(Path directory) {
            this.workingDirectory = directory;
            return this;
        }

        public Builder context(TaskContext taskContext) {
            this.context = taskContext;
            return this;
        }

        public Builder action(TaskAction taskAction) {
            this.action = taskAction;
            return this;
        }

        public TaskNode build() {
            return new TaskNode(id, kind, dependencies, inputs, outputs, workingDirectory,
                    context.with("task", id), action);
        }
    }
}
