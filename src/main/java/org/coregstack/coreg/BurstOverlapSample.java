package org.coregstack.coreg;

/**
 * Phase statistics of the double difference interferogram of one burst overlap.
 *
 * @param subswath          subswath number, 1-based
 * @param burst             number of the earlier burst of the overlap, 1-based
 * @param phaseMean         mean unwrapped phase (radians)
 * @param phaseStdev        phase standard deviation (radians)
 * @param phaseFraction     fraction of valid phase pixels
 * @param coherenceMean     mean coherence
 * @param coherenceStdev    coherence standard deviation
 * @param coherenceFraction fraction of valid coherence pixels
 */
public record BurstOverlapSample(
        int subswath,
        int burst,
        double phaseMean,
        double phaseStdev,
        double phaseFraction,
        double coherenceMean,
        double coherenceStdev,
        double coherenceFraction
) {

    /**
     * Sample with phase statistics only.
     */
    public static BurstOverlapSample ofPhase(int subswath, int burst, double mean, double stdev, double fraction) {
        return new BurstOverlapSample(subswath, burst, mean, stdev, fraction, 0.0, 0.0, 0.0);
    }

    /**
     * Reported sample weight; the 0.1 offset bounds the weight of near-noiseless samples.
     */
    public double weight() {
        return phaseFraction / (phaseStdev + 0.1) / (phaseStdev + 0.1);
    }
}
