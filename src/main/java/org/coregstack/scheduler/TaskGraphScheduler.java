package org.coregstack.scheduler;

import java.io.IOException;
import java.nio.file.Files;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.coregstack.scheduler.RunReport.NodeState;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs a task graph on a fixed worker pool with per-node failure isolation.
 * <p>
 * A node is submitted once every dependency has succeeded, in this run or according to its
 * completion marker. Exceptions thrown by a node's action are caught at the node boundary,
 * logged with the node's context and recorded as a failure marker; sibling nodes keep running.
 * Dependents of a failed node are never submitted and are reported as blocked, as are
 * dependents of a node left outside the run whose marker is not a success.
 * <p>
 * On interruption the pool is shut down; markers already written stay valid for a later resume.
 * Nodes aborted by the interruption write no marker and are reported as aborted.
 */
public class TaskGraphScheduler {

    private static final Logger log = LoggerFactory.getLogger(TaskGraphScheduler.class);

    private final CompletionMarkers markers;
    private final SchedulerSettings settings;
    private final Map<String, TaskStatus> statuses = new ConcurrentHashMap<>();

    public TaskGraphScheduler(CompletionMarkers markers, SchedulerSettings settings) {
        this.markers = markers;
        this.settings = settings;
    }

    /**
     * Runs every node without a completion marker. Nodes with a marker are not run again; a
     * failure marker blocks the node's dependents.
     */
    public RunReport run(String stackId, TaskGraph graph) throws IOException {
        Set<String> pending = new LinkedHashSet<>();
        for (String id : graph.order()) {
            if (markers.read(id) == TaskStatus.PENDING) {
                pending.add(id);
            }
        }
        return execute(stackId, graph, pending, unsatisfied(graph, pending));
    }

    /**
     * Runs the nodes of a resume plan; every other node counts as complete.
     */
    public RunReport resume(String stackId, TaskGraph graph, ResumePlan plan) throws IOException {
        Set<String> pending = plan.rescheduled();
        return execute(stackId, graph, pending, unsatisfied(graph, pending));
    }

    /** Status of a node in the current or last run. */
    public TaskStatus status(String id) {
        return statuses.getOrDefault(id, TaskStatus.PENDING);
    }

    /**
     * Dependencies of pending nodes that are not part of the run and whose marker is not a success.
     */
    private Set<String> unsatisfied(TaskGraph graph, Set<String> pending) throws IOException {
        Set<String> unsatisfied = new LinkedHashSet<>();
        for (String id : pending) {
            for (String dependency : graph.node(id).dependencies()) {
                if (!pending.contains(dependency) && !unsatisfied.contains(dependency)
                        && markers.read(dependency) != TaskStatus.SUCCEEDED) {
                    unsatisfied.add(dependency);
                }
            }
        }
        return unsatisfied;
    }

    private RunReport execute(String stackId, TaskGraph graph, Set<String> pending, Set<String> unsatisfied) {
        RunReport.Builder report = RunReport.builder(stackId);
        statuses.clear();
        for (TaskNode node : graph.nodes()) {
            if (!pending.contains(node.id())) {
                report.add(node, NodeState.SKIPPED, List.of(), null);
            } else {
                statuses.put(node.id(), TaskStatus.PENDING);
            }
        }
        for (String dependency : unsatisfied) {
            log.warn("Task {} has a failure marker, its pending dependents are blocked", dependency);
            block(graph, dependency, pending, report);
        }
        log.info("Running {} of {} tasks of stack {} on {} workers",
                pending.stream().filter(id -> !report.has(id)).count(), graph.size(), stackId, settings.workers());

        Map<String, Integer> waitingOn = new HashMap<>();
        Queue<String> ready = new ArrayDeque<>();
        for (String id : pending) {
            if (report.has(id)) {
                continue;
            }
            int count = (int) graph.node(id).dependencies().stream().filter(pending::contains).count();
            waitingOn.put(id, count);
            if (count == 0) {
                ready.add(id);
            }
        }

        ExecutorService pool = Executors.newFixedThreadPool(settings.workers(), new WorkerThreadFactory(stackId));
        CompletionService<NodeCompletion> completions = new ExecutorCompletionService<>(pool);
        int inFlight = 0;
        boolean interrupted = false;
        try {
            while (!ready.isEmpty() || inFlight > 0) {
                while (!ready.isEmpty()) {
                    TaskNode node = graph.node(ready.poll());
                    completions.submit(() -> runNode(node));
                    inFlight++;
                }

                NodeCompletion completion = completions.take().get();
                inFlight--;
                for (String dependent : record(completion, graph, pending, report)) {
                    if (waitingOn.merge(dependent, -1, Integer::sum) == 0) {
                        ready.add(dependent);
                    }
                }
            }
        } catch (InterruptedException e) {
            interrupted = true;
            log.warn("Run of stack {} interrupted, aborting {} tasks in flight", stackId, inFlight);
            report.interrupted();
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task boundary let an exception escape", e.getCause());
        } finally {
            shutdown(pool);
        }
        if (interrupted) {
            // workers that finished or aborted while the pool shut down
            Future<NodeCompletion> done;
            while ((done = completions.poll()) != null) {
                record(completed(done), graph, pending, report);
            }
            Thread.currentThread().interrupt();
        }

        for (String id : pending) {
            if (!report.has(id)) {
                report.add(graph.node(id), NodeState.BLOCKED, List.of(), "not run");
            }
        }
        RunReport result = report.build();
        log.info(result.summaryLine());
        return result;
    }

    /**
     * Adds a finished node to the report.
     *
     * @return pending dependents no longer blocked by the node
     */
    private List<String> record(NodeCompletion completion, TaskGraph graph, Set<String> pending,
                                RunReport.Builder report) {
        TaskNode node = completion.node();
        if (completion.aborted()) {
            statuses.put(node.id(), TaskStatus.PENDING);
            report.add(node, NodeState.ABORTED, List.of(), "interrupted");
            return List.of();
        }
        if (completion.error() != null) {
            statuses.put(node.id(), TaskStatus.FAILED);
            report.add(node, NodeState.FAILED, List.of(), describe(completion.error()));
            block(graph, node.id(), pending, report);
            return List.of();
        }
        statuses.put(node.id(), TaskStatus.SUCCEEDED);
        List<String> warnings = completion.outcome().warnings();
        report.add(node, warnings.isEmpty() ? NodeState.SUCCEEDED : NodeState.DEGRADED, warnings, null);
        List<String> released = new ArrayList<>();
        for (String dependent : graph.dependentsOf(node.id())) {
            if (pending.contains(dependent) && !report.has(dependent)) {
                released.add(dependent);
            }
        }
        return released;
    }

    private static NodeCompletion completed(Future<NodeCompletion> done) {
        try {
            return done.get();
        } catch (InterruptedException e) {
            // polled futures are done, get() does not wait
            throw new IllegalStateException("Completed task reported an interruption", e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Task boundary let an exception escape", e.getCause());
        }
    }

    private NodeCompletion runNode(TaskNode node) {
        TaskContext context = node.context();
        statuses.put(node.id(), TaskStatus.RUNNING);
        context.info(log, "Starting {}", node);
        long start = System.nanoTime();
        try {
            if (node.workingDirectory() != null) {
                Files.createDirectories(node.workingDirectory());
            }
            TaskOutcome outcome = node.action().execute(context);
            markers.markSucceeded(node.id());
            long seconds = TimeUnit.NANOSECONDS.toSeconds(System.nanoTime() - start);
            if (outcome.isDegraded()) {
                context.warn(log, "Finished {} in {}s with {} accuracy warnings", node, seconds,
                        outcome.warnings().size());
            } else {
                context.info(log, "Finished {} in {}s", node, seconds);
            }
            return new NodeCompletion(node, outcome, null, false);
        } catch (Exception e) {
            if (isAbort(e)) {
                // aborted, not failed: no marker, so the node runs again on the next run
                Thread.currentThread().interrupt();
                context.warn(log, "Task {} interrupted", node);
                return new NodeCompletion(node, null, e, true);
            }
            context.error(log, e, "Task {} failed: {}", node, e.getMessage());
            try {
                markers.markFailed(node.id());
            } catch (IOException markerError) {
                context.error(log, markerError, "Could not write failure marker of {}", node);
                e.addSuppressed(markerError);
            }
            return new NodeCompletion(node, null, e, false);
        }
    }

    /**
     * True when {@code e} stems from an interruption of the worker, directly or wrapped by a
     * toolkit or sampler exception.
     */
    private static boolean isAbort(Exception e) {
        if (Thread.currentThread().isInterrupted()) {
            return true;
        }
        for (Throwable cause = e; cause != null; cause = cause.getCause()) {
            if (cause instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    /**
     * Reports every pending node downstream of {@code failedId} as blocked.
     */
    private void block(TaskGraph graph, String failedId, Set<String> pending, RunReport.Builder report) {
        Queue<String> queue = new ArrayDeque<>(graph.dependentsOf(failedId));
        while (!queue.isEmpty()) {
            String id = queue.poll();
            if (pending.contains(id) && !report.has(id)) {
                report.add(graph.node(id), NodeState.BLOCKED, List.of(), "dependency " + failedId + " failed");
                log.warn("Task {} blocked by failed dependency {}", id, failedId);
                queue.addAll(graph.dependentsOf(id));
            }
        }
    }

    private static String describe(Exception e) {
        return e.getClass().getSimpleName() + ": " + e.getMessage();
    }

    /**
     * Interrupts the workers and waits for them, so aborted nodes have settled their markers
     * before the report is built. A pending interrupt of the caller is restored afterwards.
     */
    private static void shutdown(ExecutorService pool) {
        pool.shutdownNow();
        boolean interrupted = Thread.interrupted();
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                log.warn("Task workers did not stop within 30 seconds");
            }
        } catch (InterruptedException e) {
            interrupted = true;
        } finally {
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }
    }

    private record NodeCompletion(TaskNode node, TaskOutcome outcome, Exception error, boolean aborted) {
    }

    private static final class WorkerThreadFactory implements java.util.concurrent.ThreadFactory {

        private final String prefix;
        private final AtomicInteger counter = new AtomicInteger();

        WorkerThreadFactory(String stackId) {
            this.prefix = "task-" + stackId + "-";
        }

        @Override
        public Thread newThread(Runnable runnable) {
            return new Thread(runnable, prefix + counter.incrementAndGet());
        }
    }
}
