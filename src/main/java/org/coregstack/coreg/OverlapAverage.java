package org.coregstack.coreg;

import java.util.List;

/**
 * Fraction-weighted phase averages of the accepted samples of one fine iteration.
 *
 * @param sceneAverage       weighted mean over all accepted samples (radians)
 * @param subswathAverages   weighted mean per subswath, 0 for a subswath without accepted samples
 * @param acceptedSamples    number of accepted samples
 * @param subswathMean       mean of the subswath averages
 * @param subswathDeviation  root of the summed squared deviations of the subswath averages from their mean
 */
public record OverlapAverage(
        double sceneAverage,
        List<Double> subswathAverages,
        int acceptedSamples,
        double subswathMean,
        double subswathDeviation
) {

    public OverlapAverage {
        subswathAverages = List.copyOf(subswathAverages);
    }
}
