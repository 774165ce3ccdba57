package org.coregstack.coreg;

import java.util.Optional;

/**
 * Measures the double difference phase of one burst overlap.
 * <p>
 * Returns an empty result when the overlap yields no sample (the phase could not be unwrapped),
 * after recording why. Implementations must be safe to call concurrently for different overlaps.
 */
@FunctionalInterface
public interface BurstOverlapSampler {

    Optional<BurstOverlapSample> sample(BurstOverlap overlap);
}
