package com.keypoints.SIFT;

/**
 * Terminal states of the sub-pixel refinement of one candidate.
 */
public enum RefinementState {
    CONVERGED,
    DISCARDED_OUT_OF_BOUNDS,
    DISCARDED_LOW_CONTRAST,
    DISCARDED_EDGE,
    DISCARDED_NO_CONVERGENCE
}
