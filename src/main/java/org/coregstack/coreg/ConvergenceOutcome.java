package org.coregstack.coreg;

/**
 * How the fine stage of a coregistration ended.
 */
public enum ConvergenceOutcome {
    /** The azimuth correction reached the fine target. */
    CONVERGED,
    /** The iteration budget ran out; the best model so far is used. */
    BUDGET_EXHAUSTED,
    /** A later iteration produced no accepted sample; the best model so far is used. */
    SAMPLES_EXHAUSTED,
    /** The first fine iteration produced no accepted sample; the coarse model is used. */
    NO_FINE_REFINEMENT
}
