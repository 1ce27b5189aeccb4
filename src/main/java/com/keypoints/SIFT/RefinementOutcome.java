package com.keypoints.SIFT;

import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Result of refining one candidate. {@code keypoint} is only set for {@link RefinementState#CONVERGED}.
 */
@AllArgsConstructor
@Getter
public class RefinementOutcome {
    private final RefinementState state;
    private final RefinedKeypoint keypoint;
    private final int iterations;

    public static RefinementOutcome discarded(RefinementState state, int iterations) {
        return new RefinementOutcome(state, null, iterations);
    }

    public static RefinementOutcome converged(RefinedKeypoint keypoint) {
        return new RefinementOutcome(RefinementState.CONVERGED, keypoint, keypoint.getIterations());
    }

    public boolean isConverged() {
        return state == RefinementState.CONVERGED;
    }
}
