package org.coregstack.coreg;

import com.typesafe.config.Config;

/**
 * Settings of the alignment convergence loop, read from {@code coregstack.coregistration}.
 *
 * @param maxIterations          iteration budget of the coarse and of the fine stage
 * @param coarseAzimuthThreshold coarse stage stops once the azimuth residual is within this many pixels
 * @param fineAzimuthTarget      fine stage converges once the azimuth correction is within this many pixels
 * @param rangeStepMin           minimum range step of the intensity tracking grid
 * @param azimuthStepMin         minimum azimuth step of the intensity tracking grid
 * @param thresholds             burst overlap quality gate
 * @param samplingThreads        burst pairs sampled concurrently within one fine iteration
 * @param historicalRounding     round the azimuth correction terms to 6 decimals
 * @param keepScratch            keep the per-pair scratch directory after a successful run
 */
public record CoregistrationSettings(
        int maxIterations,
        double coarseAzimuthThreshold,
        double fineAzimuthTarget,
        int rangeStepMin,
        int azimuthStepMin,
        SampleThresholds thresholds,
        int samplingThreads,
        boolean historicalRounding,
        boolean keepScratch
) {

    public CoregistrationSettings {
        if (maxIterations < 1) {
            throw new IllegalArgumentException("max-iterations must be >= 1, got " + maxIterations);
        }
        if (samplingThreads < 1) {
            throw new IllegalArgumentException("sampling-threads must be >= 1, got " + samplingThreads);
        }
    }

    public static CoregistrationSettings defaults() {
        return new CoregistrationSettings(5, 0.01, 0.0001, 64, 32, SampleThresholds.defaults(), 1, true, false);
    }

    public static CoregistrationSettings fromConfig(Config coreg) {
        return new CoregistrationSettings(
                coreg.getInt("max-iterations"),
                coreg.getDouble("coarse-azimuth-threshold"),
                coreg.getDouble("fine-azimuth-target"),
                coreg.getInt("range-step-min"),
                coreg.getInt("azimuth-step-min"),
                new SampleThresholds(
                        coreg.getDouble("coherence-threshold"),
                        coreg.getDouble("fraction-threshold"),
                        coreg.getDouble("stdev-threshold")),
                coreg.getInt("sampling-threads"),
                coreg.getBoolean("historical-rounding"),
                coreg.getBoolean("keep-scratch"));
    }
}
