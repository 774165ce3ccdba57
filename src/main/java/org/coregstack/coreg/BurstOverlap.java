package org.coregstack.coreg;

import java.nio.file.Path;

/**
 * The region shared by burst {@code burst} and burst {@code burst + 1} of one subswath.
 *
 * @param iteration     fine iteration the overlap is sampled in
 * @param subswath      subswath number, 1-based
 * @param burst         number of the earlier burst, 1-based
 * @param sourceSlc     subswath SLC of the local reference (the stack reference or a resampled tertiary date)
 * @param referencePar  subswath SLC parameters of the stack reference
 * @param resampledSlc  subswath SLC of the resampled target
 * @param rangeSamples  range samples of the subswath
 * @param linesOffset   lines between the starts of consecutive bursts
 * @param linesPerBurst lines of one burst
 */
public record BurstOverlap(
        int iteration,
        int subswath,
        int burst,
        Path sourceSlc,
        Path referencePar,
        Path resampledSlc,
        int rangeSamples,
        int linesOffset,
        int linesPerBurst
) {

    /** First line of the overlap within the earlier burst. */
    public int startingLine1() {
        return linesOffset + (burst - 1) * linesPerBurst;
    }

    /** First line of the overlap within the later burst. */
    public int startingLine2() {
        return burst * linesPerBurst;
    }

    public int linesOverlap() {
        return linesPerBurst - linesOffset;
    }

    public String label() {
        return "IW" + subswath + "." + burst;
    }
}
