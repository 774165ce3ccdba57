package org.coregstack.coreg;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

import org.coregstack.scheduler.TaskContext;
import org.coregstack.toolkit.GeophysicalToolkit;
import org.coregstack.toolkit.ParameterFile;
import org.coregstack.toolkit.ToolOutput;
import org.coregstack.toolkit.ToolResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coarse stage: refines the offset model by intensity cross-correlation.
 * <p>
 * Each iteration resamples the target with the current model, tracks the residual offsets
 * between the reference and the resampled target on a grid of about 64 x 64 windows, fits a
 * first order polynomial and folds its constant terms into the model. The model is persisted
 * to the pair's offset parameter file after every iteration.
 */
public class CoarseRegistration {

    private static final Logger log = LoggerFactory.getLogger(CoarseRegistration.class);

    static final String FIT_STDEV_LABEL = "final model fit std. dev. (samples) range:";

    private static final int RANGE_WINDOW = 128;
    private static final int AZIMUTH_WINDOW = 64;
    private static final double SNR_THRESHOLD = 0.2;

    private final GeophysicalToolkit toolkit;
    private final CoregistrationSettings settings;

    public CoarseRegistration(GeophysicalToolkit toolkit, CoregistrationSettings settings) {
        this.toolkit = toolkit;
        this.settings = settings;
    }

    public CoarseResult run(CoregisteredSlcPaths paths, int rangeLooks, int azimuthLooks, TaskContext context)
            throws IOException {
        context.info(log, "Beginning coarse coregistration");

        ParameterFile referencePar = ParameterFile.read(paths.demReferenceSlcPar());
        int width = referencePar.getInt("range_samples", 0);
        int height = referencePar.getInt("azimuth_lines", 0);
        int rangeStep = Math.max(width / 64, settings.rangeStepMin());
        int azimuthStep = Math.max(height / 64, settings.azimuthStepMin());

        Files.deleteIfExists(paths.offPar());
        toolkit.createOffset(paths.demReferenceSlcPar(), paths.targetSlcPar(), paths.offPar(), 1, rangeLooks,
                azimuthLooks, 0);
        OffsetModel model = OffsetModel.read(paths.offPar());

        Path scratch = Files.createDirectories(paths.scratchDirectory());
        Path offStart = scratch.resolve(paths.offPar().getFileName() + ".start");
        Path offs = scratch.resolve(paths.pairName() + ".offs");
        Path snr = scratch.resolve(paths.pairName() + ".snr");

        List<Double> residuals = new ArrayList<>();
        double azimuthResidual = Double.POSITIVE_INFINITY;
        while (Math.abs(azimuthResidual) > settings.coarseAzimuthThreshold()
                && residuals.size() < settings.maxIterations()) {
            Files.copy(paths.offPar(), offStart, StandardCopyOption.REPLACE_EXISTING);
            toolkit.slcInterpLtScanSar(paths.targetSlcTab(), paths.targetSlcPar(), paths.referenceSlcTab(),
                    paths.demReferenceSlcPar(), paths.lookupTable(), paths.demReferenceMliPar(),
                    paths.targetMliPar(), offStart, paths.resampledSlcTab(), paths.resampledSlc(),
                    paths.resampledSlcPar());

            Files.deleteIfExists(paths.doffPar());
            toolkit.createOffset(paths.demReferenceSlcPar(), paths.targetSlcPar(), paths.doffPar(), 1, rangeLooks,
                    azimuthLooks, 0);
            toolkit.offsetPwrTracking(paths.referenceSlc(), paths.resampledSlc(), paths.demReferenceSlcPar(),
                    paths.resampledSlcPar(), paths.doffPar(), offs, snr, RANGE_WINDOW, AZIMUTH_WINDOW, 1,
                    SNR_THRESHOLD, rangeStep, azimuthStep, 0, width, 0, height);
            ToolResult fit = toolkit.offsetFit(offs, snr, paths.doffPar(), SNR_THRESHOLD, 1);
            double[] fitStdev = ToolOutput.numbersAfter(fit.stdout(), FIT_STDEV_LABEL, 2);

            OffsetModel residual = OffsetModel.read(paths.doffPar());
            azimuthResidual = residual.azimuthConstant();
            double rangeResidual = residual.rangeConstant();
            model = model.plusConstants(rangeResidual, azimuthResidual);
            model.persist(paths.offPar());
            residuals.add(azimuthResidual);

            context.info(log, "Coarse iteration {}/{}: daz {} dr {} (daz_mli {} dr_mli {}), fit stdev range {} azimuth {}",
                    residuals.size(), settings.maxIterations(), azimuthResidual, rangeResidual,
                    azimuthResidual / azimuthLooks, rangeResidual / rangeLooks, fitStdev[0], fitStdev[1]);
        }

        boolean converged = Math.abs(azimuthResidual) <= settings.coarseAzimuthThreshold();
        if (!converged) {
            context.warn(log, "Coarse coregistration stopped after {} iterations with daz {} above {}",
                    residuals.size(), azimuthResidual, settings.coarseAzimuthThreshold());
        }
        return new CoarseResult(model, residuals, converged);
    }
}
