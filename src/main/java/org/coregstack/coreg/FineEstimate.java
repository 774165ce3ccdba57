package org.coregstack.coreg;

/**
 * Result of one fine iteration.
 *
 * @param iteration  the fine iteration, 1-based
 * @param average    the overlap phase averages
 * @param factor     the phase to azimuth pixel conversion
 * @param correction azimuth pixel correction to fold into the model
 */
public record FineEstimate(int iteration, OverlapAverage average, AzimuthCorrectionFactor factor, double correction) {
}
