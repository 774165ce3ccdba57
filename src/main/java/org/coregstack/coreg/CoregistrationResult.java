package org.coregstack.coreg;

import java.util.List;

/**
 * Final state of one pair's convergence loop. The model is frozen; downstream resampling uses it as is.
 *
 * @param model        the final offset model
 * @param outcome      how the fine stage ended
 * @param coarse       result of the coarse stage
 * @param corrections  azimuth correction of each successful fine iteration
 * @param warnings     accuracy warnings written while coregistering the pair
 */
public record CoregistrationResult(
        OffsetModel model,
        ConvergenceOutcome outcome,
        CoarseResult coarse,
        List<Double> corrections,
        List<String> warnings
) {

    public CoregistrationResult {
        corrections = List.copyOf(corrections);
        warnings = List.copyOf(warnings);
    }

    public int fineIterations() {
        return corrections.size();
    }

    /** True when the product carries accuracy warnings. */
    public boolean degraded() {
        return outcome != ConvergenceOutcome.CONVERGED || !warnings.isEmpty();
    }
}
