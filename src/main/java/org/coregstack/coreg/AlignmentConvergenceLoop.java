package org.coregstack.coreg;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import org.coregstack.scheduler.TaskContext;
import org.coregstack.toolkit.GeophysicalToolkit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coarse-to-fine refinement of a pair's offset model.
 * <p>
 * After the coarse stage, each fine iteration resamples the target with the current model and
 * folds the burst overlap azimuth correction into it, until the correction is within the fine
 * target or the iteration budget is spent. An iteration without accepted samples ends the loop:
 * the best model so far is kept, or the coarse model when no fine iteration succeeded. Every
 * outcome other than convergence leaves an accuracy warning.
 */
public class AlignmentConvergenceLoop {

    private static final Logger log = LoggerFactory.getLogger(AlignmentConvergenceLoop.class);

    private final GeophysicalToolkit toolkit;
    private final CoregistrationSettings settings;
    private final CoarseRegistration coarseRegistration;

    public AlignmentConvergenceLoop(GeophysicalToolkit toolkit, CoregistrationSettings settings) {
        this.toolkit = toolkit;
        this.settings = settings;
        this.coarseRegistration = new CoarseRegistration(toolkit, settings);
    }

    /**
     * Runs the coarse and fine stages.
     *
     * @param sampler  burst overlap sampler of the pair
     * @param warnings accuracy warnings of the target scene
     * @return the frozen result
     */
    public CoregistrationResult run(CoregisteredSlcPaths paths, int rangeLooks, int azimuthLooks,
                                    BurstOverlapSampler sampler, AccuracyWarnings warnings, TaskContext context)
            throws IOException {
        CoarseResult coarse = coarseRegistration.run(paths, rangeLooks, azimuthLooks, context);

        context.info(log, "Beginning fine coregistration");
        OffsetModel model = coarse.model();
        List<Double> corrections = new ArrayList<>();
        ConvergenceOutcome outcome = ConvergenceOutcome.BUDGET_EXHAUSTED;
        int maxIterations = settings.maxIterations();
        int iteration = 0;

        Path offStart = Files.createDirectories(paths.scratchDirectory())
                .resolve(paths.offPar().getFileName() + ".start");
        try (OverlapReport report = OverlapReport.create(paths.overlapReport(), settings.thresholds());
             BurstOverlapRefinement refinement = new BurstOverlapRefinement(sampler, settings)) {
            while (iteration < maxIterations) {
                iteration++;
                TaskContext iterationContext = context.with("iteration", iteration);
                Files.copy(paths.offPar(), offStart, StandardCopyOption.REPLACE_EXISTING);
                toolkit.slcInterpLtScanSar(paths.targetSlcTab(), paths.targetSlcPar(), paths.referenceSlcTab(),
                        paths.demReferenceSlcPar(), paths.lookupTable(), paths.demReferenceMliPar(),
                        paths.targetMliPar(), offStart, paths.resampledSlcTab(), paths.resampledSlc(),
                        paths.resampledSlcPar());

                FineEstimate estimate;
                try {
                    estimate = refinement.estimate(iteration, paths.referenceTab(), paths.overlapSourceTab(),
                            paths.resampledTab(), report, warnings, iterationContext);
                } catch (SampleExhaustionException e) {
                    iterationContext.warn(log, "Fine coregistration iteration failed, continuing with best estimate: {}",
                            e.getMessage());
                    if (corrections.isEmpty()) {
                        iterationContext.warn(log,
                                "CAUTION: No fine coregistration iterations succeeded, proceeding with coarse coregistration");
                        model = coarse.model();
                        model.persist(paths.offPar());
                        outcome = ConvergenceOutcome.NO_FINE_REFINEMENT;
                    } else {
                        outcome = ConvergenceOutcome.SAMPLES_EXHAUSTED;
                    }
                    break;
                }

                double correction = estimate.correction();
                model = model.plusAzimuthConstant(correction);
                model.persist(paths.offPar());
                Files.copy(paths.offPar(), paths.fineIterationCopy(iteration), StandardCopyOption.REPLACE_EXISTING);
                corrections.add(correction);
                iterationContext.info(log, "Fine iteration update: daz {} azimuth polynomial constant {}",
                        correction, model.azimuthConstant());

                if (Math.abs(correction) <= settings.fineAzimuthTarget()) {
                    outcome = ConvergenceOutcome.CONVERGED;
                    break;
                }
            }
        }

        if (outcome != ConvergenceOutcome.CONVERGED) {
            warnings.append("Error on fine coreg iteration " + iteration + "/" + maxIterations);
            if (corrections.isEmpty()) {
                warnings.append("Completely failed fine coregistration, proceeded with coarse coregistration");
            } else {
                warnings.append("daz: " + corrections.get(corrections.size() - 1) + " (failed to reach "
                        + settings.fineAzimuthTarget() + ")");
            }
        }
        context.info(log, "Fine coregistration finished: {} after {} iterations", outcome, corrections.size());
        return new CoregistrationResult(model, outcome, coarse, corrections, warnings.lines());
    }
}
