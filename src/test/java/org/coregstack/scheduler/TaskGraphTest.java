package org.coregstack.scheduler;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

@Tag("unit")
class TaskGraphTest {

    static TaskNode node(String id, String... dependencies) {
        TaskNode.Builder builder = TaskNode.builder(id, "test").action(context -> TaskOutcome.success());
        for (String dependency : dependencies) {
            builder.dependsOn(dependency);
        }
        return builder.build();
    }

    @Test
    void of_ordersDependenciesBeforeDependents() {
        TaskGraph graph = TaskGraph.of(List.of(
                node("ifg", "coreg_b", "multilook_a"),
                node("coreg_b", "multilook_b"),
                node("multilook_a"),
                node("multilook_b")));

        List<String> order = graph.order();
        assertThat(order).hasSize(4);
        assertThat(order.indexOf("multilook_b")).isLessThan(order.indexOf("coreg_b"));
        assertThat(order.indexOf("coreg_b")).isLessThan(order.indexOf("ifg"));
        assertThat(order.indexOf("multilook_a")).isLessThan(order.indexOf("ifg"));
        assertThat(graph.dependentsOf("multilook_b")).containsExactly("coreg_b");
    }

    @Test
    void of_rejectsCycles() {
        assertThatThrownBy(() -> TaskGraph.of(List.of(node("a", "c"), node("b", "a"), node("c", "b"), node("d"))))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("Circular dependency")
                .hasMessageContaining("[a, b, c]");
    }

    @Test
    void of_rejectsSelfDependency() {
        assertThatThrownBy(() -> TaskGraph.of(List.of(node("a", "a"))))
                .isInstanceOf(StructuralException.class);
    }

    @Test
    void of_rejectsDuplicateIds() {
        assertThatThrownBy(() -> TaskGraph.of(List.of(node("a"), node("a"))))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("Duplicate task id: a");
    }

    @Test
    void of_rejectsUnknownDependencies() {
        assertThatThrownBy(() -> TaskGraph.of(List.of(node("a", "missing"))))
                .isInstanceOf(StructuralException.class)
                .hasMessageContaining("unknown task missing");
    }

    @Test
    void ancestorsOf_returnsTransitiveDependenciesNearestFirst() {
        TaskGraph graph = TaskGraph.of(List.of(
                node("root"), node("mid", "root"), node("leaf", "mid"), node("other")));

        assertThat(graph.ancestorsOf("leaf")).containsExactly("mid", "root");
        assertThat(graph.ancestorsOf("root")).isEmpty();
    }

    @Test
    void builder_addsTaskIdToContext() {
        TaskNode node = TaskNode.builder("coreg_20200113", "coregistration")
                .context(TaskContext.empty().with("stack", "s1"))
                .action(context -> TaskOutcome.success())
                .build();

        assertThat(node.context().fields()).containsEntry("stack", "s1").containsEntry("task", "coreg_20200113");
    }
}
