package org.coregstack.coreg;

/**
 * No burst overlap of any subswath produced an accepted sample in a fine iteration.
 */
public class SampleExhaustionException extends CoregistrationException {

    private final int iteration;

    public SampleExhaustionException(int iteration) {
        super("CRITICAL failure on iter " + iteration + ", no bursts from any subswath processed!");
        this.iteration = iteration;
    }

    public int getIteration() {
        return iteration;
    }
}
