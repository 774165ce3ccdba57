package org.coregstack.coreg;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import org.coregstack.scheduler.TaskContext;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

/**
 * Drives the coarse and fine stages against a synthetic pair with a known true offset.
 */
@Tag("integration")
class AlignmentConvergenceLoopTest {

    private static final double RANGE_TRUTH = 1.5;
    private static final double AZIMUTH_TRUTH = 0.3;

    @TempDir
    Path tempDir;

    private static CoregistrationSettings settings(int maxIterations) {
        return new CoregistrationSettings(maxIterations, 0.01, 0.0001, 64, 32, SampleThresholds.defaults(),
                2, true, false);
    }

    private CoregistrationResult run(SyntheticPair pair, CoregistrationSettings settings,
                                     BurstOverlapSampler sampler) throws IOException {
        AccuracyWarnings warnings = new AccuracyWarnings(pair.paths().accuracyWarning());
        AlignmentConvergenceLoop loop = new AlignmentConvergenceLoop(pair.toolkit(), settings);
        return loop.run(pair.paths(), 4, 1, sampler, warnings, TaskContext.empty().with("test", "loop"));
    }

    @Test
    void nominalPair_convergesMonotonicallyToTruth() throws IOException {
        SyntheticPair pair = new SyntheticPair(tempDir, RANGE_TRUTH, AZIMUTH_TRUTH, 0.8);

        CoregistrationResult result = run(pair, settings(5), pair.sampler(0.9));

        CoarseResult coarse = result.coarse();
        assertThat(coarse.converged()).isTrue();
        assertThat(coarse.iterations()).isEqualTo(3);
        assertNonIncreasingMagnitudes(coarse.azimuthResiduals());

        assertThat(result.outcome()).isEqualTo(ConvergenceOutcome.CONVERGED);
        assertThat(result.fineIterations()).isLessThan(5);
        assertNonIncreasingMagnitudes(result.corrections());
        assertThat(result.model().azimuthConstant()).isCloseTo(AZIMUTH_TRUTH, within(1e-4));
        assertThat(result.model().rangeConstant()).isCloseTo(RANGE_TRUTH, within(0.05));
        assertThat(result.degraded()).isFalse();
        assertThat(result.warnings()).isEmpty();

        CoregisteredSlcPaths paths = pair.paths();
        assertThat(OffsetModel.read(paths.offPar())).isEqualTo(result.model());
        for (int iteration = 1; iteration <= result.fineIterations(); iteration++) {
            assertThat(paths.fineIterationCopy(iteration)).exists();
        }
        assertThat(Files.readString(paths.overlapReport())).contains("Burst Overlap Results", "IW3 average");
        assertThat(paths.accuracyWarning()).doesNotExist();
    }

    @Test
    void everySampleRejectedOnFirstIteration_fallsBackToCoarseModel() throws IOException {
        SyntheticPair pair = new SyntheticPair(tempDir, RANGE_TRUTH, AZIMUTH_TRUTH, 0.8);
        BurstOverlapSampler noisy = overlap -> Optional.of(
                BurstOverlapSample.ofPhase(overlap.subswath(), overlap.burst(), 0.4, 1.2, 0.5));

        CoregistrationResult result = run(pair, settings(5), noisy);

        assertThat(result.outcome()).isEqualTo(ConvergenceOutcome.NO_FINE_REFINEMENT);
        assertThat(result.model()).isEqualTo(result.coarse().model());
        assertThat(OffsetModel.read(pair.paths().offPar())).isEqualTo(result.coarse().model());
        assertThat(result.corrections()).isEmpty();
        assertThat(result.warnings())
                .contains("CRITICAL failure on iter 1, no bursts from any subswath processed!")
                .contains("Completely failed fine coregistration, proceeded with coarse coregistration")
                .anyMatch(line -> line.startsWith("Poor data in 1, subswath 1, burst 1: stdev (1.2)"));
        assertThat(Files.readAllLines(pair.paths().accuracyWarning())).containsAll(result.warnings());
    }

    @Test
    void samplesLostAfterFirstIteration_keepBestModel() throws IOException {
        SyntheticPair pair = new SyntheticPair(tempDir, RANGE_TRUTH, AZIMUTH_TRUTH, 0.8);
        BurstOverlapSampler good = pair.sampler(0.5);
        BurstOverlapSampler failing = overlap -> overlap.iteration() == 1 ? good.sample(overlap) : Optional.empty();

        CoregistrationResult result = run(pair, settings(5), failing);

        assertThat(result.outcome()).isEqualTo(ConvergenceOutcome.SAMPLES_EXHAUSTED);
        assertThat(result.corrections()).hasSize(1);
        assertThat(result.model().azimuthConstant())
                .isEqualTo(result.coarse().model().azimuthConstant() + result.corrections().get(0));
        assertThat(result.warnings())
                .contains("Error on fine coreg iteration 2/5")
                .contains("daz: " + result.corrections().get(0) + " (failed to reach 1.0E-4)");
        assertThat(Files.readString(pair.paths().overlapReport())).contains("IW1 1 MCF FAILURE");
    }

    @Test
    void iterationBudget_isNeverExceeded() throws IOException {
        SyntheticPair pair = new SyntheticPair(tempDir, RANGE_TRUTH, AZIMUTH_TRUTH, 0.8);

        CoregistrationResult result = run(pair, settings(2), pair.sampler(0.5));

        assertThat(result.coarse().iterations()).isEqualTo(2);
        assertThat(result.coarse().converged()).isFalse();
        assertThat(result.outcome()).isEqualTo(ConvergenceOutcome.BUDGET_EXHAUSTED);
        assertThat(result.fineIterations()).isEqualTo(2);
        assertThat(result.degraded()).isTrue();
        assertThat(result.warnings()).first().isEqualTo("Error on fine coreg iteration 2/2");
        // one resampling per coarse and per fine iteration
        assertThat(pair.toolkit().resamplings()).isEqualTo(4);
    }

    private static void assertNonIncreasingMagnitudes(List<Double> values) {
        for (int i = 1; i < values.size(); i++) {
            assertThat(Math.abs(values.get(i))).as("step %d of %s", i, values)
                    .isLessThanOrEqualTo(Math.abs(values.get(i - 1)));
        }
    }
}
