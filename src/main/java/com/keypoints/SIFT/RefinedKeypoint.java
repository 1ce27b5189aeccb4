package com.keypoints.SIFT;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

/**
 * Keypoint after quadratic interpolation.
 * localX/localY/scaleLevel are the discrete sample the fit converged at,
 * absolute coordinates are in input image pixels.
 */
@AllArgsConstructor
@Builder
@Getter
public class RefinedKeypoint {
    private final int octave;
    private final int scaleLevel;
    private final int localX;
    private final int localY;
    private final double absoluteX;
    private final double absoluteY;
    private final double absoluteSigma;
    private final double interpolatedValue;
    // offset (s, m, n) of the accepted fit
    private final double offsetS;
    private final double offsetM;
    private final double offsetN;
    private final int iterations;

    @Override
    public String toString() {
        return String.format(
                "Refined Keypoint[Octave=%d, Scale=%d] at (%d, %d) -> Absolute (%.3f, %.3f) sigma=%.3f value=%.5f",
                octave, scaleLevel, localX, localY, absoluteX, absoluteY, absoluteSigma, interpolatedValue
        );
    }
}
