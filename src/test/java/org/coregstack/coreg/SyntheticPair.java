package org.coregstack.coreg;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import org.coregstack.stack.AcquisitionDate;
import org.coregstack.stack.StackPaths;
import org.coregstack.toolkit.GeophysicalToolkit;
import org.coregstack.toolkit.ParameterFile;
import org.coregstack.toolkit.TabFile;
import org.coregstack.toolkit.ToolResult;

/**
 * A reference/target pair on disk with a toolkit double whose residual offsets are derived from a
 * known true offset.
 * <p>
 * {@link #toolkit()} records the model used by the last resampling; its offset fit reports
 * {@code gain * (truth - current)} as residual constants. {@link #sampler(double)} measures burst
 * overlap phases that, converted back, recover {@code gain} times the remaining azimuth error.
 */
final class SyntheticPair {

    static final AcquisitionDate REFERENCE = AcquisitionDate.of(2020, 1, 1);
    static final AcquisitionDate TARGET = AcquisitionDate.of(2020, 1, 13);

    static final double LINE_TIME = 0.002055556;
    static final double BURST_START_1 = 1000.0;
    static final double BURST_START_2 = 1002.758277;
    static final int BURSTS = 4;

    private final StackPaths stack;
    private final CoregisteredSlcPaths paths;
    private final FakeToolkit toolkit;

    SyntheticPair(Path root, double rangeTruth, double azimuthTruth, double coarseGain) throws IOException {
        this.stack = new StackPaths(root.resolve("out"), root.resolve("work"), "VV", 4);
        this.paths = CoregisteredSlcPaths.of(stack, REFERENCE, TARGET, REFERENCE);
        this.toolkit = new FakeToolkit(rangeTruth, azimuthTruth, coarseGain);
        writeInputs(stack, REFERENCE, TARGET);
    }

    /** Writes the DEM products of {@code reference} and the scene files of both dates. */
    static void writeInputs(StackPaths stack, AcquisitionDate reference, AcquisitionDate... targets)
            throws IOException {
        write(stack.demReferenceSlcPar(reference), "range_samples:   8192\nazimuth_lines:   4096\n");
        write(stack.demReferenceMliPar(reference), "range_samples:   2048\nazimuth_lines:   4096\n");
        write(stack.rdcDem(reference), "");
        writeScene(stack, reference);
        for (AcquisitionDate target : targets) {
            writeScene(stack, target);
        }
    }

    static void writeScene(StackPaths stack, AcquisitionDate date) throws IOException {
        write(stack.slc(date), "");
        write(stack.slcPar(date), "range_samples:   8192\nazimuth_lines:   4096\nazimuth_line_time:  "
                + LINE_TIME + "  s\n");
        write(stack.mliPar(date), "range_samples:   2048\n");
        TabFile tab = TabFile.forScene(stack.sceneDirectory(date), stack.subswathStem(date));
        for (TabFile.Subswath subswath : tab.subswaths()) {
            write(subswath.slc(), "");
            write(subswath.par(), "azimuth_line_time:    " + LINE_TIME + "   s\nrange_samples:    2000\n");
            write(subswath.topsPar(), "number_of_bursts:   " + BURSTS + "\nlines_per_burst:   1500\n"
                    + "burst_start_time_1:   " + BURST_START_1 + "   s\n"
                    + "burst_start_time_2:   " + BURST_START_2 + "   s\n");
        }
    }

    private static void write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        Files.writeString(file, content);
    }

    StackPaths stack() {
        return stack;
    }

    CoregisteredSlcPaths paths() {
        return paths;
    }

    FakeToolkit toolkit() {
        return toolkit;
    }

    static double factor(boolean historicalRounding) {
        return AzimuthCorrectionFactor.of(
                new AzimuthCorrectionFactor.BurstTiming(LINE_TIME, BURST_START_1, BURST_START_2),
                historicalRounding).factor();
    }

    /**
     * Sampler measuring the phase that corresponds to {@code gain} times the azimuth error of the
     * model of the last resampling.
     */
    BurstOverlapSampler sampler(double gain) {
        double factor = factor(true);
        return overlap -> {
            double error = toolkit.azimuthTruth - toolkit.current().azimuthConstant();
            return java.util.Optional.of(BurstOverlapSample.ofPhase(overlap.subswath(), overlap.burst(),
                    -gain * error / factor, 0.05, 0.9));
        };
    }

    /**
     * Toolkit double: creates zero offset models, tracks the model of each resampling and
     * reports damped residuals from its offset fit.
     */
    static final class FakeToolkit implements GeophysicalToolkit {

        private static final String ZERO_MODEL = "range_offset_polynomial:   0.0 0.0 0.0 0.0 0.0 0.0\n"
                + "azimuth_offset_polynomial:   0.0 0.0 0.0 0.0 0.0 0.0\n";

        final double rangeTruth;
        final double azimuthTruth;
        final double gain;
        private volatile OffsetModel current = OffsetModel.zero();
        private int resamplings;

        FakeToolkit(double rangeTruth, double azimuthTruth, double gain) {
            this.rangeTruth = rangeTruth;
            this.azimuthTruth = azimuthTruth;
            this.gain = gain;
        }

        OffsetModel current() {
            return current;
        }

        synchronized int resamplings() {
            return resamplings;
        }

        private static ToolResult ok(String program, String stdout) {
            return new ToolResult(List.of(program), 0, stdout, "");
        }

        private static void touch(Path... files) {
            try {
                for (Path file : files) {
                    Files.createDirectories(file.getParent());
                    if (!Files.exists(file)) {
                        Files.writeString(file, "");
                    }
                }
            } catch (IOException e) {
                throw new java.io.UncheckedIOException(e);
            }
        }

        @Override
        public ToolResult createOffset(Path par1, Path par2, Path offPar, int algorithm, int rangeLooks,
                                       int azimuthLooks, int interactive) {
            try {
                Files.createDirectories(offPar.getParent());
                Files.writeString(offPar, "title:   synthetic\n" + ZERO_MODEL);
            } catch (IOException e) {
                throw new java.io.UncheckedIOException(e);
            }
            return ok("create_offset", "");
        }

        @Override
        public synchronized ToolResult slcInterpLtScanSar(Path slc2Tab, Path slc2Par, Path slc1Tab, Path slc1Par,
                                                          Path lookupTable, Path mli1Par, Path mli2Par, Path offPar,
                                                          Path rslc2Tab, Path rslc2, Path rslc2Par) {
            try {
                current = OffsetModel.read(offPar);
            } catch (IOException e) {
                throw new java.io.UncheckedIOException(e);
            }
            resamplings++;
            touch(rslc2, rslc2Par);
            return ok("SLC_interp_lt_ScanSAR", "");
        }

        @Override
        public ToolResult offsetPwrTracking(Path slc1, Path slc2, Path slc1Par, Path slc2Par, Path offPar,
                                            Path offs, Path snr, int rangeWindow, int azimuthWindow,
                                            int oversampling, double snrThreshold, int rangeStep, int azimuthStep,
                                            int rangeStart, int rangeEnd, int azimuthStart, int azimuthEnd) {
            return ok("offset_pwr_tracking", "");
        }

        @Override
        public ToolResult offsetFit(Path offs, Path snr, Path offPar, double snrThreshold, int polynomialTerms) {
            double dr = gain * (rangeTruth - current.rangeConstant());
            double daz = gain * (azimuthTruth - current.azimuthConstant());
            try {
                ParameterFile.read(offPar)
                        .setDoubles(OffsetModel.RANGE_KEY, dr, 0, 0, 0, 0, 0)
                        .setDoubles(OffsetModel.AZIMUTH_KEY, daz, 0, 0, 0, 0, 0)
                        .write(offPar);
            } catch (IOException e) {
                throw new java.io.UncheckedIOException(e);
            }
            return ok("offset_fit", "final solution: 1960 offset estimates accepted out of 2048 samples\n"
                    + CoarseRegistration.FIT_STDEV_LABEL + "   0.0412  azimuth:   0.0377\n");
        }

        @Override
        public ToolResult createDiffPar(Path par1, Path par2, Path diffPar, int parType, int interactive) {
            return ok("create_diff_par", "");
        }

        @Override
        public ToolResult slcCopy(Path slcIn, Path parIn, Path slcOut, Path parOut, double scale, int rangeOffset,
                                  int rangeSamples, int lineOffset, int lines) {
            return ok("SLC_copy", "");
        }

        @Override
        public ToolResult slcIntf(Path slc1, Path slc2, Path par1, Path par2, Path offPar, Path interferogram,
                                  int rangeLooks, int azimuthLooks) {
            touch(interferogram);
            return ok("SLC_intf", "");
        }

        @Override
        public ToolResult cpxToReal(Path input, Path output, int width, int type) {
            return ok("cpx_to_real", "");
        }

        @Override
        public ToolResult subPhase(Path interferogram, Path phase, Path diffPar, Path output, int dataType,
                                   int mode) {
            return ok("sub_phase", "");
        }

        @Override
        public ToolResult multiCpx(Path input, Path offIn, Path output, Path offOut, int rangeLooks,
                                   int azimuthLooks) {
            return ok("multi_cpx", "");
        }

        @Override
        public ToolResult ccWave(Path interferogram, Path coherence, int width, int rangeWindow, int azimuthWindow,
                                 int weighting) {
            return ok("cc_wave", "");
        }

        @Override
        public ToolResult rasccMask(Path coherence, int width, double coherenceThreshold, Path mask) {
            return ok("rascc_mask", "");
        }

        @Override
        public ToolResult adf(Path interferogram, Path filtered, Path coherence, int width, double alpha,
                              int fftWindow, int coherenceWindow, int step) {
            return ok("adf", "");
        }

        @Override
        public ToolResult mcf(Path interferogram, Path coherence, Path mask, Path unwrapped, int width,
                              int patchSize, int rangeReference, int azimuthReference) {
            return ok("mcf", "");
        }

        @Override
        public ToolResult imageStat(Path image, int width, Path statistics) {
            return ok("image_stat", "");
        }

        @Override
        public ToolResult rdcTrans(Path mli1Par, Path dem, Path mli2Par, Path lookupTable) {
            touch(lookupTable);
            return ok("rdc_trans", "");
        }

        @Override
        public ToolResult multiLook(Path slc, Path slcPar, Path mli, Path mliPar, int rangeLooks, int azimuthLooks) {
            touch(mli, mliPar);
            return ok("multi_look", "");
        }
    }
}
