package org.coregstack.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Function;

import org.coregstack.coreg.CoregisteredSlcPaths;
import org.coregstack.coreg.CoregistrationResult;
import org.coregstack.coreg.CoregistrationSettings;
import org.coregstack.coreg.SlcCoregistration;
import org.coregstack.scheduler.TaskContext;
import org.coregstack.scheduler.TaskGraph;
import org.coregstack.scheduler.TaskNode;
import org.coregstack.scheduler.TaskOutcome;
import org.coregstack.stack.AcquisitionDate;
import org.coregstack.stack.DatePair;
import org.coregstack.stack.StackPaths;
import org.coregstack.toolkit.GeophysicalToolkit;
import org.coregstack.tree.CoregistrationEdge;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns a stack definition into the task graph of one run.
 * <p>
 * Per date a multi-look task; per forest edge a coregistration task that waits for the target's
 * multi-look and, for tertiary targets, for the coregistration of its local reference; per
 * interferogram pair a task that waits for both dates to be in reference geometry. Each task is
 * handed a toolkit bound to its own working directory.
 */
public class StackPlanner {

    private static final Logger log = LoggerFactory.getLogger(StackPlanner.class);

    static final String MULTILOOK = "multilook";
    static final String COREGISTRATION = "coregistration";
    static final String INTERFEROGRAM = "interferogram";

    private final StackPaths paths;
    private final CoregistrationSettings coregistrationSettings;
    private final int rangeLooks;
    private final int azimuthLooks;
    private final Function<Path, GeophysicalToolkit> toolkits;

    /**
     * @param toolkits toolkit bound to a working directory
     */
    public StackPlanner(StackPaths paths, CoregistrationSettings coregistrationSettings, int rangeLooks,
                        int azimuthLooks, Function<Path, GeophysicalToolkit> toolkits) {
        this.paths = paths;
        this.coregistrationSettings = coregistrationSettings;
        this.rangeLooks = rangeLooks;
        this.azimuthLooks = azimuthLooks;
        this.toolkits = toolkits;
    }

    public static String multilookId(AcquisitionDate date) {
        return MULTILOOK + "_" + date;
    }

    public static String coregistrationId(AcquisitionDate target) {
        return "coreg_" + target;
    }

    public static String interferogramId(DatePair pair) {
        return "ifg_" + pair.id();
    }

    public TaskGraph plan(StackDefinition stack) {
        TaskContext base = TaskContext.empty()
                .with("stack", stack.stackId())
                .with("pol", paths.polarisation());
        List<TaskNode> nodes = new ArrayList<>();
        for (AcquisitionDate date : stack.forest().dates()) {
            nodes.add(multilook(date, base));
        }
        for (CoregistrationEdge edge : stack.forest().edges()) {
            nodes.add(coregistration(stack.reference(), edge, base));
        }
        for (DatePair pair : stack.interferograms()) {
            nodes.add(interferogram(stack.reference(), pair, base));
        }
        TaskGraph graph = TaskGraph.of(nodes);
        log.info("Planned {} tasks for stack {}: {} dates, {} coregistrations, {} interferograms", graph.size(),
                stack.stackId(), stack.forest().dates().size(), stack.forest().edges().size(),
                stack.interferograms().size());
        return graph;
    }

    private TaskNode multilook(AcquisitionDate date, TaskContext base) {
        Path directory = paths.sceneDirectory(date);
        return TaskNode.builder(multilookId(date), MULTILOOK)
                .input(paths.slc(date))
                .input(paths.slcPar(date))
                .output(paths.mli(date))
                .output(paths.mliPar(date))
                .workingDirectory(directory)
                .context(base.with("date", date))
                .action(context -> {
                    toolkits.apply(directory).multiLook(paths.slc(date), paths.slcPar(date), paths.mli(date),
                            paths.mliPar(date), rangeLooks, azimuthLooks);
                    return TaskOutcome.success();
                })
                .build();
    }

    private TaskNode coregistration(AcquisitionDate reference, CoregistrationEdge edge, TaskContext base) {
        AcquisitionDate target = edge.target();
        AcquisitionDate source = edge.source();
        CoregisteredSlcPaths pair = CoregisteredSlcPaths.of(paths, reference, target, source);
        TaskNode.Builder builder = TaskNode.builder(coregistrationId(target), COREGISTRATION)
                .dependsOn(multilookId(target))
                .input(paths.slcPar(target))
                .input(paths.mliPar(target))
                .input(paths.demReferenceSlcPar(reference))
                .input(paths.demReferenceMliPar(reference))
                .input(paths.rdcDem(reference))
                .output(paths.resampledSlc(target))
                .output(paths.resampledSlcPar(target))
                .output(paths.resampledMli(target))
                .output(paths.resampledMliPar(target))
                .output(pair.offPar())
                .workingDirectory(pair.targetDirectory())
                .context(base.with("reference", reference).with("secondary", target).with("tier", edge.tier()));
        if (!source.equals(reference)) {
            builder.dependsOn(coregistrationId(source))
                    .input(paths.resampledSlc(source))
                    .input(paths.resampledSlcTab(source));
        }
        return builder
                .action(context -> {
                    SlcCoregistration coregistration = new SlcCoregistration(
                            toolkits.apply(pair.targetDirectory()), coregistrationSettings);
                    CoregistrationResult result = coregistration.coregister(pair, rangeLooks, azimuthLooks, context);
                    if (!result.degraded()) {
                        return TaskOutcome.success();
                    }
                    List<String> warnings = result.warnings().isEmpty()
                            ? List.of("fine coregistration ended " + result.outcome())
                            : result.warnings();
                    return TaskOutcome.degraded(warnings);
                })
                .build();
    }

    private TaskNode interferogram(AcquisitionDate reference, DatePair pair, TaskContext base) {
        Path directory = paths.interferogramDirectory(pair);
        Path primarySlc = coregisteredSlc(reference, pair.primary());
        Path primaryPar = coregisteredSlcPar(reference, pair.primary());
        Path secondarySlc = coregisteredSlc(reference, pair.secondary());
        Path secondaryPar = coregisteredSlcPar(reference, pair.secondary());
        Path offset = paths.interferogramOffset(pair);
        Path interferogram = paths.interferogram(pair);

        TaskNode.Builder builder = TaskNode.builder(interferogramId(pair), INTERFEROGRAM)
                .input(primarySlc)
                .input(primaryPar)
                .input(secondarySlc)
                .input(secondaryPar)
                .output(interferogram)
                .output(offset)
                .workingDirectory(directory)
                .context(base.with("primary", pair.primary()).with("secondary", pair.secondary()));
        for (AcquisitionDate date : List.of(pair.primary(), pair.secondary())) {
            builder.dependsOn(date.equals(reference) ? multilookId(date) : coregistrationId(date));
        }
        return builder
                .action(context -> {
                    GeophysicalToolkit toolkit = toolkits.apply(directory);
                    toolkit.createOffset(primaryPar, secondaryPar, offset, 1, rangeLooks, azimuthLooks, 0);
                    toolkit.slcIntf(primarySlc, secondarySlc, primaryPar, secondaryPar, offset, interferogram,
                            rangeLooks, azimuthLooks);
                    return TaskOutcome.success();
                })
                .build();
    }

    /** The reference SLC is already in reference geometry; every other date uses its resampled SLC. */
    private Path coregisteredSlc(AcquisitionDate reference, AcquisitionDate date) {
        return date.equals(reference) ? paths.slc(date) : paths.resampledSlc(date);
    }

    private Path coregisteredSlcPar(AcquisitionDate reference, AcquisitionDate date) {
        return date.equals(reference) ? paths.slcPar(date) : paths.resampledSlcPar(date);
    }
}
