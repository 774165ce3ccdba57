package org.coregstack.coreg;

import java.io.IOException;

import org.coregstack.toolkit.ParameterFile;
import org.coregstack.toolkit.TabFile;

/**
 * Converts an overlap phase average (radians) into an azimuth offset (SLC pixels).
 * <p>
 * The phase of a burst overlap double difference interferogram is proportional to the azimuth
 * misregistration through the Doppler centroid difference between the two bursts:
 * {@code dDC = 1739.43 * lineTime * linesOffset}, {@code dt = 0.159154 / dDC} and
 * {@code factor = dt / lineTime}. With historical rounding, the line time and every intermediate
 * are rounded to 6 decimals, and so is the final correction.
 *
 * @param azimuthLineTime seconds per azimuth line, as used (rounded when rounding is on)
 * @param linesOffset     lines between the starts of two consecutive bursts
 * @param dopplerDifference Doppler centroid difference between consecutive bursts (Hz)
 * @param timeDifference  timing error per radian of phase (s)
 * @param factor          azimuth pixels per radian of phase
 * @param rounded         whether historical rounding is applied
 */
public record AzimuthCorrectionFactor(
        double azimuthLineTime,
        int linesOffset,
        double dopplerDifference,
        double timeDifference,
        double factor,
        boolean rounded
) {

    static final double DOPPLER_RATE = 1739.43;
    static final double HALF_OVER_PI = 0.159154;

    /**
     * Burst timing of one subswath.
     */
    public record BurstTiming(double azimuthLineTime, double burstStartTime1, double burstStartTime2) {

        /** Reads {@code azimuth_line_time} from the SLC parameters and the first two burst start times. */
        public static BurstTiming read(TabFile.Subswath subswath) throws IOException {
            ParameterFile par = ParameterFile.read(subswath.par());
            ParameterFile tops = ParameterFile.read(subswath.topsPar());
            return new BurstTiming(
                    par.getDouble("azimuth_line_time", 0),
                    tops.getDouble("burst_start_time_1", 0),
                    tops.getDouble("burst_start_time_2", 0));
        }

        /** Lines between the starts of burst 1 and burst 2, rounded half up. */
        public int linesOffset() {
            return (int) (0.5 + (burstStartTime2 - burstStartTime1) / azimuthLineTime);
        }
    }

    public static AzimuthCorrectionFactor of(BurstTiming timing, boolean historicalRounding) {
        int linesOffset = timing.linesOffset();
        if (linesOffset <= 0) {
            throw new CoregistrationException("Burst timing gives a non-positive line offset " + linesOffset);
        }
        if (historicalRounding) {
            double lineTime = HistoricalRounding.round6(timing.azimuthLineTime());
            double dDC = HistoricalRounding.round6(DOPPLER_RATE * lineTime * linesOffset);
            double dt = HistoricalRounding.round6(HALF_OVER_PI / dDC);
            double factor = HistoricalRounding.round6(dt / lineTime);
            return new AzimuthCorrectionFactor(lineTime, linesOffset, dDC, dt, factor, true);
        }
        double lineTime = timing.azimuthLineTime();
        double dDC = DOPPLER_RATE * lineTime * linesOffset;
        double dt = HALF_OVER_PI / dDC;
        return new AzimuthCorrectionFactor(lineTime, linesOffset, dDC, dt, dt / lineTime, false);
    }

    /**
     * Azimuth pixel correction for a scene average phase.
     */
    public double correctionFor(double averagePhase) {
        double correction = -factor * averagePhase;
        return rounded ? HistoricalRounding.round6(correction) : correction;
    }
}
