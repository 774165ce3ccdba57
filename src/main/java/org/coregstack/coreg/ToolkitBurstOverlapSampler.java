package org.coregstack.coreg;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import org.coregstack.scheduler.TaskContext;
import org.coregstack.toolkit.GeophysicalToolkit;
import org.coregstack.toolkit.ParameterFile;
import org.coregstack.toolkit.ToolInvocationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Samples a burst overlap with the toolkit.
 * <p>
 * Cuts the overlap out of both bursts of the local reference and of the resampled target, forms
 * one interferogram per burst, subtracts the earlier from the later one and multi-looks the
 * double difference 200 x 4. Coherence is estimated and masked on the unfiltered double
 * difference, the filtered phase is unwrapped and its statistics are read back. An unwrapping
 * failure is recorded as an accuracy warning and yields no sample.
 * <p>
 * Every overlap writes to its own files in the scratch directory.
 */
public class ToolkitBurstOverlapSampler implements BurstOverlapSampler {

    private static final Logger log = LoggerFactory.getLogger(ToolkitBurstOverlapSampler.class);

    private static final int DIFF_RANGE_LOOKS = 200;
    private static final int DIFF_AZIMUTH_LOOKS = 4;
    private static final int MCF_PATCH = 512;

    private final GeophysicalToolkit toolkit;
    private final Path scratch;
    private final String pairName;
    private final double coherenceThreshold;
    private final AccuracyWarnings warnings;
    private final TaskContext context;

    public ToolkitBurstOverlapSampler(GeophysicalToolkit toolkit, Path scratch, String pairName,
                                      double coherenceThreshold, AccuracyWarnings warnings, TaskContext context) {
        this.toolkit = toolkit;
        this.scratch = scratch;
        this.pairName = pairName;
        this.coherenceThreshold = coherenceThreshold;
        this.warnings = warnings;
        this.context = context;
    }

    @Override
    public Optional<BurstOverlapSample> sample(BurstOverlap overlap) {
        try {
            return measure(overlap);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read statistics of burst overlap " + overlap.label(), e);
        }
    }

    private Optional<BurstOverlapSample> measure(BurstOverlap overlap) throws IOException {
        int burst = overlap.burst();
        String iw = "IW" + overlap.subswath();
        String stem = pairName + "." + iw + "." + burst;
        context.debug(log, "Sampling overlap {} lines {} and {}", overlap.label(), overlap.startingLine1(),
                overlap.startingLine2());

        Path referenceSlc1 = scratch.resolve(pairName + "_" + iw + "_slc." + burst + ".1");
        Path referencePar1 = scratch.resolve(pairName + "_" + iw + "_par." + burst + ".1");
        Path referenceSlc2 = scratch.resolve(pairName + "_" + iw + "_slc." + burst + ".2");
        Path referencePar2 = scratch.resolve(pairName + "_" + iw + "_par." + burst + ".2");
        String resampledName = overlap.resampledSlc().getFileName().toString();
        Path resampledSlc1 = scratch.resolve(pairName + "_" + resampledName + "." + burst + ".1");
        Path resampledPar1 = scratch.resolve(pairName + "_" + resampledName + ".par." + burst + ".1");
        Path resampledSlc2 = scratch.resolve(pairName + "_" + resampledName + "." + burst + ".2");
        Path resampledPar2 = scratch.resolve(pairName + "_" + resampledName + ".par." + burst + ".2");

        copyOverlap(overlap.sourceSlc(), overlap, referenceSlc1, referencePar1, overlap.startingLine1());
        copyOverlap(overlap.sourceSlc(), overlap, referenceSlc2, referencePar2, overlap.startingLine2());
        copyOverlap(overlap.resampledSlc(), overlap, resampledSlc1, resampledPar1, overlap.startingLine1());
        copyOverlap(overlap.resampledSlc(), overlap, resampledSlc2, resampledPar2, overlap.startingLine2());

        // single look interferograms of the earlier (1) and later (2) burst
        Path off1 = fresh(scratch.resolve(stem + ".off1"));
        Path int1 = fresh(scratch.resolve(stem + ".int1"));
        toolkit.createOffset(referencePar1, referencePar1, off1, 1, 1, 1, 0);
        toolkit.slcIntf(referenceSlc1, resampledSlc1, referencePar1, referencePar1, off1, int1, 1, 1);

        Path off2 = fresh(scratch.resolve(stem + ".off2"));
        Path int2 = fresh(scratch.resolve(stem + ".int2"));
        toolkit.createOffset(referencePar2, referencePar2, off2, 1, 1, 1, 0);
        toolkit.slcIntf(referenceSlc2, resampledSlc2, referencePar2, referencePar2, off2, int2, 1, 1);

        // double difference: phase of the earlier burst subtracted from the later one
        Path diffPar = fresh(scratch.resolve(stem + ".diff_par"));
        Path phase1 = scratch.resolve(stem + ".int1.phase");
        Path diff = scratch.resolve(stem + ".diff");
        toolkit.createDiffPar(off1, off2, diffPar, 0, 0);
        toolkit.cpxToReal(int1, phase1, overlap.rangeSamples(), 4);
        toolkit.subPhase(int2, phase1, diffPar, diff, 1, 0);

        Path diff20 = scratch.resolve(stem + ".diff20");
        Path off20 = scratch.resolve(stem + ".off20");
        toolkit.multiCpx(diff, off1, diff20, off20, DIFF_RANGE_LOOKS, DIFF_AZIMUTH_LOOKS);
        ParameterFile off20Par = ParameterFile.read(off20);
        int width = off20Par.getInt("interferogram_width", 0);
        int lines = off20Par.getInt("interferogram_azimuth_lines", 0);

        Path coherence = scratch.resolve(stem + ".diff20.coh");
        Path mask = scratch.resolve(stem + ".diff20.cc.ras");
        toolkit.ccWave(diff20, coherence, width, 5, 5, 0);
        toolkit.rasccMask(coherence, width, coherenceThreshold, mask);

        Path filtered = scratch.resolve(stem + ".diff20.adf");
        Path filteredCoherence = scratch.resolve(stem + ".diff20.adf.coh");
        toolkit.adf(diff20, filtered, filteredCoherence, width, 0.4, 16, 7, 2);
        Files.deleteIfExists(filteredCoherence);

        Path unwrapped = scratch.resolve(stem + ".diff20.phase");
        try {
            toolkit.mcf(filtered, coherence, mask, unwrapped, width, MCF_PATCH, width / 2, lines / 2);
        } catch (ToolInvocationException e) {
            warnings.append("MCF failure on iter " + overlap.iteration() + ", subswath " + overlap.subswath()
                    + ", burst " + burst);
            context.info(log, "{} {} MCF FAILURE (status {})", iw, burst, e.getStatus());
            return Optional.empty();
        }

        double[] coherenceStats = {0.0, 0.0, 0.0};
        if (Files.exists(coherence)) {
            coherenceStats = statistics(coherence, width, scratch.resolve(stem + ".diff20.cc.stat"));
        }
        double[] phaseStats = {0.0, 0.0, 0.0};
        if (Files.exists(unwrapped) && Files.size(unwrapped) > 0) {
            phaseStats = statistics(unwrapped, width, scratch.resolve(stem + ".diff20.phase.stat"));
        }

        return Optional.of(new BurstOverlapSample(overlap.subswath(), burst,
                phaseStats[0], phaseStats[1], phaseStats[2],
                coherenceStats[0], coherenceStats[1], coherenceStats[2]));
    }

    private void copyOverlap(Path slc, BurstOverlap overlap, Path slcOut, Path parOut, int startingLine) {
        toolkit.slcCopy(slc, overlap.referencePar(), slcOut, parOut, 1.0, 0, overlap.rangeSamples(),
                startingLine, overlap.linesOverlap());
    }

    /** Mean, standard deviation and valid fraction of an image. */
    private double[] statistics(Path image, int width, Path statsFile) throws IOException {
        toolkit.imageStat(image, width, statsFile);
        ParameterFile stats = ParameterFile.read(statsFile);
        return new double[]{
                stats.getDouble("mean", 0),
                stats.getDouble("stdev", 0),
                stats.getDouble("fraction_valid", 0)
        };
    }

    private static Path fresh(Path file) throws IOException {
        Files.deleteIfExists(file);
        return file;
    }
}
