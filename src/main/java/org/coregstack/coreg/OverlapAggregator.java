package org.coregstack.coreg;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Accumulates burst overlap samples through the quality gate into fraction-weighted averages.
 * <p>
 * Only accepted samples contribute: each adds {@code mean * fraction} to the weighted sum and
 * {@code fraction} to the weight of its subswath and of the scene.
 */
public final class OverlapAggregator {

    private final SampleThresholds thresholds;
    private final double[] sums;
    private final double[] weights;
    private final int[] samples;
    private double sceneSum;
    private double sceneWeight;
    private int sceneSamples;

    public OverlapAggregator(int subswaths, SampleThresholds thresholds) {
        this.thresholds = thresholds;
        this.sums = new double[subswaths];
        this.weights = new double[subswaths];
        this.samples = new int[subswaths];
    }

    /**
     * Adds a sample if it passes the quality gate.
     *
     * @return true if the sample was accepted
     */
    public boolean add(BurstOverlapSample sample) {
        if (!thresholds.accepts(sample)) {
            return false;
        }
        int index = sample.subswath() - 1;
        double weighted = sample.phaseMean() * sample.phaseFraction();
        sums[index] += weighted;
        weights[index] += sample.phaseFraction();
        samples[index]++;
        sceneSum += weighted;
        sceneWeight += sample.phaseFraction();
        sceneSamples++;
        return true;
    }

    public int acceptedSamples() {
        return sceneSamples;
    }

    public int acceptedSamples(int subswath) {
        return samples[subswath - 1];
    }

    /** Weighted mean of the accepted samples of {@code subswath}, 0 when it has none. */
    public double subswathAverage(int subswath) {
        int index = subswath - 1;
        return samples[index] > 0 ? sums[index] / weights[index] : 0.0;
    }

    /**
     * Scene and subswath averages, empty when no sample was accepted.
     */
    public Optional<OverlapAverage> average() {
        if (sceneSamples == 0) {
            return Optional.empty();
        }
        List<Double> averages = new ArrayList<>(sums.length);
        double total = 0.0;
        for (int swath = 1; swath <= sums.length; swath++) {
            double average = subswathAverage(swath);
            averages.add(average);
            total += average;
        }
        double mean = total / sums.length;
        double squares = 0.0;
        for (double average : averages) {
            squares += (average - mean) * (average - mean);
        }
        return Optional.of(new OverlapAverage(sceneSum / sceneWeight, averages, sceneSamples, mean,
                Math.sqrt(squares)));
    }
}
