package org.coregstack.pipeline;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.TreeSet;
import java.util.function.Function;

import org.coregstack.coreg.CoregistrationSettings;
import org.coregstack.scheduler.CompletionMarkers;
import org.coregstack.scheduler.ResumePlan;
import org.coregstack.scheduler.ResumePlanner;
import org.coregstack.scheduler.RunReport;
import org.coregstack.scheduler.SchedulerSettings;
import org.coregstack.scheduler.StructuralException;
import org.coregstack.scheduler.TaskGraph;
import org.coregstack.scheduler.TaskGraphScheduler;
import org.coregstack.stack.AcquisitionDate;
import org.coregstack.stack.DatePair;
import org.coregstack.stack.ListFiles;
import org.coregstack.stack.StackPaths;
import org.coregstack.stack.StackSettings;
import org.coregstack.toolkit.GeophysicalToolkit;
import org.coregstack.toolkit.ProcessToolkit;
import org.coregstack.toolkit.ToolkitSettings;
import org.coregstack.tree.CoregistrationForest;
import org.coregstack.tree.CoregistrationTier;
import org.coregstack.tree.CoregistrationTreeBuilder;
import org.coregstack.tree.InterferogramNetwork;
import org.coregstack.tree.TreeSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;

/**
 * Runs a whole stack: scenes list to coregistration forest, list files, task graph and run report.
 */
public class StackRunner {

    private static final Logger log = LoggerFactory.getLogger(StackRunner.class);

    private final StackSettings stackSettings;
    private final TreeSettings treeSettings;
    private final SchedulerSettings schedulerSettings;
    private final StackPaths paths;
    private final StackPlanner planner;
    private final CompletionMarkers markers;

    public StackRunner(StackSettings stackSettings, TreeSettings treeSettings,
                       CoregistrationSettings coregistrationSettings, SchedulerSettings schedulerSettings,
                       Function<Path, GeophysicalToolkit> toolkits) {
        this.stackSettings = stackSettings;
        this.treeSettings = treeSettings;
        this.schedulerSettings = schedulerSettings;
        this.paths = StackPaths.of(stackSettings);
        this.planner = new StackPlanner(paths, coregistrationSettings, stackSettings.rangeLooks(),
                stackSettings.azimuthLooks(), toolkits);
        this.markers = new CompletionMarkers(stackSettings.workDirectory());
    }

    /**
     * Builds a runner from the {@code coregstack} configuration block, running toolkit operations
     * as external processes.
     */
    public static StackRunner fromConfig(Config coregstack) {
        ProcessToolkit toolkit = new ProcessToolkit(ToolkitSettings.fromConfig(coregstack.getConfig("toolkit")));
        return new StackRunner(
                StackSettings.fromConfig(coregstack.getConfig("stack")),
                TreeSettings.fromConfig(coregstack.getConfig("tree")),
                CoregistrationSettings.fromConfig(coregstack.getConfig("coregistration")),
                SchedulerSettings.fromConfig(coregstack.getConfig("scheduler")),
                toolkit::inDirectory);
    }

    public StackPaths paths() {
        return paths;
    }

    public CompletionMarkers markers() {
        return markers;
    }

    /**
     * Reads the scenes list, builds the coregistration forest and writes the tier and
     * interferogram list files.
     *
     * @throws StructuralException when the reference is not a scene of the stack, or dates are
     *                             unreachable and unreachable dates are configured to fail the run
     */
    public StackDefinition define() throws IOException {
        Path scenesList = stackSettings.scenesList();
        if (!Files.exists(scenesList)) {
            throw new StructuralException("Scenes list not found: " + scenesList);
        }
        TreeSet<AcquisitionDate> dates = new TreeSet<>(ListFiles.readDates(scenesList));
        if (dates.isEmpty()) {
            throw new StructuralException("Scenes list " + scenesList + " holds no dates");
        }
        AcquisitionDate reference = stackSettings.referenceDate()
                .orElseGet(() -> CoregistrationTreeBuilder.referenceFor(dates));
        if (!dates.contains(reference)) {
            throw new StructuralException("Reference date " + reference + " is not in " + scenesList);
        }

        CoregistrationForest forest = new CoregistrationTreeBuilder(treeSettings).build(reference, dates);
        if (!forest.unreachable().isEmpty() && treeSettings.failOnUnreachable()) {
            throw new StructuralException(forest.unreachable().size() + " dates are unreachable from reference "
                    + reference + ": " + forest.unreachable());
        }

        for (CoregistrationTier tier : forest.tiers()) {
            ListFiles.writeDates(paths.tierList(tier.index()), tier.dates());
        }
        List<DatePair> interferograms = InterferogramNetwork.sequential(forest.dates(),
                stackSettings.ifgConnections(), stackSettings.ifgMaxBaselineDays());
        ListFiles.writePairs(paths.interferogramList(), interferograms);

        log.info("Stack {}: reference {}, {} dates in {} tiers, {} interferograms", stackSettings.stackId(),
                reference, forest.dates().size(), forest.tierCount(), interferograms.size());
        return new StackDefinition(stackSettings.stackId(), forest, interferograms);
    }

    /**
     * Runs every task without a completion marker.
     */
    public RunReport run() throws IOException {
        TaskGraph graph = planner.plan(define());
        RunReport report = scheduler().run(stackSettings.stackId(), graph);
        return finish(report);
    }

    /**
     * Plans and runs the minimal set of tasks an earlier run left incomplete.
     */
    public RunReport resume() throws IOException {
        TaskGraph graph = planner.plan(define());
        ResumePlan plan = new ResumePlanner(markers, schedulerSettings.reprocessFailed()).plan(graph);
        RunReport report = scheduler().resume(stackSettings.stackId(), graph, plan);
        return finish(report);
    }

    private TaskGraphScheduler scheduler() {
        return new TaskGraphScheduler(markers, schedulerSettings);
    }

    private RunReport finish(RunReport report) throws IOException {
        Path summary = report.write(stackSettings.workDirectory());
        log.info("Run summary written to {}", summary);
        return report;
    }
}
