package org.coregstack.coreg;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import org.coregstack.scheduler.TaskContext;
import org.coregstack.toolkit.ParameterFile;
import org.coregstack.toolkit.TabFile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Estimates the residual azimuth offset of a resampled target from the phase of burst overlaps.
 * <p>
 * Consecutive bursts see an overlap region with different Doppler centroids, so an azimuth
 * misregistration shows up as a phase difference between the two burst interferograms of the
 * region. One estimate samples every adjacent burst pair of every subswath, gates the samples
 * on valid fraction and phase noise, averages the accepted phases weighted by valid fraction
 * and converts the scene average into an azimuth pixel correction.
 * <p>
 * Samples of one estimate are independent and are taken on a bounded pool; their results are
 * consumed in subswath and burst order so the report does not depend on scheduling.
 */
public class BurstOverlapRefinement implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(BurstOverlapRefinement.class);

    private final BurstOverlapSampler sampler;
    private final SampleThresholds thresholds;
    private final boolean historicalRounding;
    private final ExecutorService pool;

    public BurstOverlapRefinement(BurstOverlapSampler sampler, CoregistrationSettings settings) {
        this.sampler = sampler;
        this.thresholds = settings.thresholds();
        this.historicalRounding = settings.historicalRounding();
        this.pool = Executors.newFixedThreadPool(settings.samplingThreads(), runnable -> {
            Thread thread = new Thread(runnable, "burst-overlap-sampler");
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Runs one fine iteration.
     *
     * @param iteration    the fine iteration, 1-based
     * @param reference    tab file of the stack reference (burst geometry and timing)
     * @param source       tab file whose bursts form the reference side of the overlap interferograms
     * @param resampled    tab file of the target resampled with the current model
     * @param report       overlap report receiving the sample lines
     * @param warnings     accuracy warnings of the target scene
     * @param context      logging context of the task
     * @return the estimate
     * @throws SampleExhaustionException if no sample of any subswath was accepted
     * @throws IOException if a parameter file cannot be read
     */
    public FineEstimate estimate(int iteration, TabFile reference, TabFile source, TabFile resampled,
                                 OverlapReport report, AccuracyWarnings warnings, TaskContext context)
            throws IOException {
        int subswaths = reference.subswaths().size();
        List<SubswathGeometry> geometries = new ArrayList<>(subswaths);
        for (int swath = 1; swath <= subswaths; swath++) {
            SubswathGeometry geometry = SubswathGeometry.read(reference.subswath(swath));
            context.debug(log, "lines_offset_IW{}: {}", swath, geometry.linesOffset());
            geometries.add(geometry);
        }

        AzimuthCorrectionFactor factor = AzimuthCorrectionFactor.of(
                AzimuthCorrectionFactor.BurstTiming.read(reference.subswath(1)), historicalRounding);
        context.debug(log, "dDC {} Hz, dt {} s, dpix_factor {} azimuth pixel", factor.dopplerDifference(),
                factor.timeDifference(), factor.factor());

        List<BurstOverlap> overlaps = new ArrayList<>();
        for (int swath = 1; swath <= subswaths; swath++) {
            SubswathGeometry geometry = geometries.get(swath - 1);
            for (int burst = 1; burst < geometry.bursts(); burst++) {
                overlaps.add(new BurstOverlap(iteration, swath, burst,
                        source.subswath(swath).slc(), reference.subswath(swath).par(),
                        resampled.subswath(swath).slc(), geometry.rangeSamples(), geometry.linesOffset(),
                        geometry.linesPerBurst()));
            }
        }

        List<Optional<BurstOverlapSample>> samples = sampleAll(overlaps);

        OverlapAggregator aggregator = new OverlapAggregator(subswaths, thresholds);
        int next = 0;
        for (int swath = 1; swath <= subswaths; swath++) {
            int expected = geometries.get(swath - 1).bursts() - 1;
            for (int i = 0; i < expected; i++, next++) {
                BurstOverlap overlap = overlaps.get(next);
                Optional<BurstOverlapSample> sample = samples.get(next);
                if (sample.isEmpty()) {
                    report.unwrapFailure(swath, overlap.burst());
                    continue;
                }
                BurstOverlapSample value = sample.get();
                boolean accepted = aggregator.add(value);
                if (!accepted) {
                    warnPoorData(iteration, value, warnings);
                }
                report.sample(value, accepted ? value.weight() : 0.0);
            }

            if (aggregator.acceptedSamples(swath) != expected) {
                warnings.append("Partial data warning on iter " + iteration + ", subswath " + swath + ": only "
                        + aggregator.acceptedSamples(swath) + "/" + expected + " bursts processed");
            }
            double average = aggregator.subswathAverage(swath);
            context.info(log, "IW{} average {}", swath, average);
            report.subswathAverage(swath, average);
        }

        Optional<OverlapAverage> average = aggregator.average();
        if (average.isEmpty()) {
            SampleExhaustionException exhausted = new SampleExhaustionException(iteration);
            warnings.append("");
            warnings.append(exhausted.getMessage());
            warnings.append("");
            throw exhausted;
        }

        OverlapAverage result = average.get();
        double correction = factor.correctionFor(result.sceneAverage());
        context.info(log, "Scene mean {} from {} samples, subswath mean {} stddev {}, azimuth pixel offset {}",
                result.sceneAverage(), result.acceptedSamples(), result.subswathMean(), result.subswathDeviation(),
                correction);
        report.sceneSummary(result);
        report.correction(correction);
        return new FineEstimate(iteration, result, factor, correction);
    }

    private List<Optional<BurstOverlapSample>> sampleAll(List<BurstOverlap> overlaps) {
        List<Future<Optional<BurstOverlapSample>>> futures = new ArrayList<>(overlaps.size());
        for (BurstOverlap overlap : overlaps) {
            futures.add(pool.submit(() -> sampler.sample(overlap)));
        }
        List<Optional<BurstOverlapSample>> samples = new ArrayList<>(overlaps.size());
        try {
            for (Future<Optional<BurstOverlapSample>> future : futures) {
                samples.add(future.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(future -> future.cancel(true));
            Thread.currentThread().interrupt();
            throw new CoregistrationException("Interrupted while sampling burst overlaps", e);
        } catch (ExecutionException e) {
            futures.forEach(future -> future.cancel(true));
            if (e.getCause() instanceof RuntimeException) {
                throw (RuntimeException) e.getCause();
            }
            throw new CoregistrationException("Burst overlap sampling failed", e.getCause());
        }
        return samples;
    }

    private void warnPoorData(int iteration, BurstOverlapSample sample, AccuracyWarnings warnings) {
        String prefix = "Poor data in " + iteration + ", subswath " + sample.subswath() + ", burst " + sample.burst();
        if (sample.phaseFraction() <= thresholds.fraction()) {
            warnings.append(prefix + ": fraction (" + sample.phaseFraction() + ") <= fraction threshold ("
                    + thresholds.fraction() + ")");
        }
        if (sample.phaseStdev() >= thresholds.stdev()) {
            warnings.append(prefix + ": stdev (" + sample.phaseStdev() + ") >= stdev threshold ("
                    + thresholds.stdev() + ")");
        }
    }

    @Override
    public void close() {
        pool.shutdownNow();
        try {
            if (!pool.awaitTermination(10, TimeUnit.SECONDS)) {
                log.warn("Burst overlap sampler threads did not stop within 10 seconds");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Burst layout of one subswath of the stack reference.
     */
    record SubswathGeometry(int bursts, int linesPerBurst, int linesOffset, int rangeSamples) {

        static SubswathGeometry read(TabFile.Subswath subswath) throws IOException {
            ParameterFile par = ParameterFile.read(subswath.par());
            ParameterFile tops = ParameterFile.read(subswath.topsPar());
            return new SubswathGeometry(
                    tops.getInt("number_of_bursts", 0),
                    tops.getInt("lines_per_burst", 0),
                    AzimuthCorrectionFactor.BurstTiming.read(subswath).linesOffset(),
                    par.getInt("range_samples", 0));
        }
    }
}
