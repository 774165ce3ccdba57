package org.coregstack.scheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Derives the minimal set of nodes an interrupted or partially failed run has to repeat.
 * <p>
 * Per node: a success marker with every declared output present is satisfied; a success marker
 * with missing outputs is deleted and the node rescheduled; a failure marker (when failures are
 * reprocessed) or no marker reschedules the node. Then, for every rescheduled node, each missing
 * declared input is traced back to the upstream node declaring it as output, which is rescheduled
 * as well, whatever its marker says. The cascade repeats for the nodes it adds.
 * <p>
 * Planning deletes the markers of rescheduled nodes, so a second plan without filesystem changes
 * in between only reschedules what the first plan did and the run did not complete.
 */
public class ResumePlanner {

    private static final Logger log = LoggerFactory.getLogger(ResumePlanner.class);

    private final CompletionMarkers markers;
    private final boolean reprocessFailed;

    public ResumePlanner(CompletionMarkers markers, boolean reprocessFailed) {
        this.markers = markers;
        this.reprocessFailed = reprocessFailed;
    }

    public ResumePlan plan(TaskGraph graph) throws IOException {
        Set<String> rescheduled = new LinkedHashSet<>();
        Map<String, String> reasons = new LinkedHashMap<>();

        for (TaskNode node : graph.nodes()) {
            TaskStatus status = markers.read(node.id());
            switch (status) {
                case SUCCEEDED -> {
                    List<Path> missing = missing(node.outputs());
                    if (!missing.isEmpty()) {
                        markers.clear(node.id());
                        reschedule(node.id(), "outputs missing: " + names(missing), rescheduled, reasons);
                    }
                }
                case FAILED -> {
                    if (reprocessFailed) {
                        reschedule(node.id(), "previous run failed", rescheduled, reasons);
                    }
                }
                default -> reschedule(node.id(), "never completed", rescheduled, reasons);
            }
        }

        Deque<String> worklist = new ArrayDeque<>(rescheduled);
        while (!worklist.isEmpty()) {
            TaskNode node = graph.node(worklist.poll());
            for (Path input : missing(node.inputs())) {
                Optional<String> producer = producerOf(graph, node.id(), input);
                if (producer.isEmpty()) {
                    log.warn("No upstream task of {} declares missing input {}", node.id(), input);
                    continue;
                }
                String upstream = producer.get();
                if (!rescheduled.contains(upstream)) {
                    markers.clear(upstream);
                    reschedule(upstream, "input " + input.getFileName() + " of " + node.id() + " missing",
                            rescheduled, reasons);
                    worklist.add(upstream);
                }
            }
        }

        Set<String> ordered = new LinkedHashSet<>();
        for (String id : graph.order()) {
            if (rescheduled.contains(id)) {
                ordered.add(id);
            }
        }
        log.info("Resume plan: {} of {} tasks rescheduled", ordered.size(), graph.size());
        return new ResumePlan(ordered, reasons);
    }

    private static Optional<String> producerOf(TaskGraph graph, String id, Path input) {
        for (String ancestor : graph.ancestorsOf(id)) {
            if (graph.node(ancestor).outputs().contains(input)) {
                return Optional.of(ancestor);
            }
        }
        return Optional.empty();
    }

    private static void reschedule(String id, String reason, Set<String> rescheduled, Map<String, String> reasons) {
        if (rescheduled.add(id)) {
            reasons.put(id, reason);
            log.info("Rescheduling {}: {}", id, reason);
        }
    }

    private static List<Path> missing(List<Path> files) {
        return files.stream().filter(file -> !Files.exists(file)).collect(Collectors.toList());
    }

    private static String names(List<Path> files) {
        return files.stream().map(file -> file.getFileName().toString()).collect(Collectors.joining(", "));
    }
}
