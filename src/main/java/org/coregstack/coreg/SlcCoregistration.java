package org.coregstack.coreg;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Stream;

import org.coregstack.scheduler.TaskContext;
import org.coregstack.toolkit.GeophysicalToolkit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coregisters one date to the stack reference geometry and produces its resampled SLC and MLI.
 * <p>
 * Writes the tab files of the pair, derives the initial lookup table from the DEM in reference
 * radar coordinates, runs the {@link AlignmentConvergenceLoop} and applies the final model with a
 * full resample followed by multi-looking.
 */
public class SlcCoregistration {

    private static final Logger log = LoggerFactory.getLogger(SlcCoregistration.class);

    private final GeophysicalToolkit toolkit;
    private final CoregistrationSettings settings;
    private final AlignmentConvergenceLoop loop;

    public SlcCoregistration(GeophysicalToolkit toolkit, CoregistrationSettings settings) {
        this.toolkit = toolkit;
        this.settings = settings;
        this.loop = new AlignmentConvergenceLoop(toolkit, settings);
    }

    public CoregistrationResult coregister(CoregisteredSlcPaths paths, int rangeLooks, int azimuthLooks,
                                           TaskContext context) throws IOException {
        AccuracyWarnings warnings = new AccuracyWarnings(paths.accuracyWarning());
        BurstOverlapSampler sampler = new ToolkitBurstOverlapSampler(toolkit, paths.scratchDirectory(),
                paths.pairName(), settings.thresholds().coherence(), warnings, context);
        return coregister(paths, rangeLooks, azimuthLooks, sampler, warnings, context);
    }

    CoregistrationResult coregister(CoregisteredSlcPaths paths, int rangeLooks, int azimuthLooks,
                                    BurstOverlapSampler sampler, AccuracyWarnings warnings, TaskContext context)
            throws IOException {
        String referencePolarisation = polarisationOf(paths.referenceSlc());
        String targetPolarisation = polarisationOf(paths.targetSlc());
        if (!referencePolarisation.equals(targetPolarisation)) {
            throw new CoregistrationException("Can not coregister two scenes of different polarisation: "
                    + referencePolarisation + " and " + targetPolarisation);
        }
        requireInputs(paths);

        Files.createDirectories(paths.scratchDirectory());
        paths.targetTab().write(paths.targetSlcTab());
        paths.resampledTab().write(paths.resampledSlcTab());
        paths.referenceTab().write(paths.referenceSlcTab());

        toolkit.rdcTrans(paths.demReferenceMliPar(), paths.rdcDem(), paths.targetMliPar(), paths.lookupTable());

        CoregistrationResult result = loop.run(paths, rangeLooks, azimuthLooks, sampler, warnings, context);

        context.info(log, "Applying final offset model {}", result.model());
        toolkit.slcInterpLtScanSar(paths.targetSlcTab(), paths.targetSlcPar(), paths.referenceSlcTab(),
                paths.demReferenceSlcPar(), paths.lookupTable(), paths.demReferenceMliPar(), paths.targetMliPar(),
                paths.offPar(), paths.resampledSlcTab(), paths.resampledSlc(), paths.resampledSlcPar());
        toolkit.multiLook(paths.resampledSlc(), paths.resampledSlcPar(), paths.resampledMli(),
                paths.resampledMliPar(), rangeLooks, azimuthLooks);

        if (!settings.keepScratch()) {
            deleteRecursively(paths.scratchDirectory());
        }
        return result;
    }

    /** Polarisation of a {@code {date}_{pol}.slc} file. */
    static String polarisationOf(Path slc) {
        String name = slc.getFileName().toString();
        int dot = name.indexOf('.');
        String stem = dot < 0 ? name : name.substring(0, dot);
        String[] parts = stem.split("_");
        if (parts.length < 2) {
            throw new CoregistrationException("Cannot determine polarisation of " + slc);
        }
        return parts[1];
    }

    private static void requireInputs(CoregisteredSlcPaths paths) {
        for (Path input : List.of(paths.demReferenceSlcPar(), paths.demReferenceMliPar(), paths.rdcDem(),
                paths.targetSlcPar(), paths.targetMliPar())) {
            if (!Files.exists(input)) {
                throw new CoregistrationException("Required input not found: " + input);
            }
        }
    }

    private static void deleteRecursively(Path directory) throws IOException {
        if (!Files.exists(directory)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(directory)) {
            for (Path path : (Iterable<Path>) walk.sorted(Comparator.reverseOrder())::iterator) {
                Files.delete(path);
            }
        }
    }
}
