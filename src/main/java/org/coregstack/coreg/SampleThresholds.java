package org.coregstack.coreg;

/**
 * Quality gate of burst overlap samples.
 *
 * @param coherence minimum coherence of pixels kept by the unwrapping mask
 * @param fraction  a sample needs a valid phase fraction above this
 * @param stdev     a sample needs a phase standard deviation (radians) below this
 */
public record SampleThresholds(double coherence, double fraction, double stdev) {

    public static SampleThresholds defaults() {
        return new SampleThresholds(0.8, 0.01, 0.8);
    }

    public boolean accepts(BurstOverlapSample sample) {
        return sample.phaseFraction() > fraction && sample.phaseStdev() < stdev;
    }
}
