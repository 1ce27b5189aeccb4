package com.keypoints.SIFT;

import lombok.Builder;
import lombok.Getter;

/**
 * Pipeline parameters. Defaults follow Lowe / IPOL "Anatomy of the SIFT method":
 * 3 scales per octave, sigma_min = 0.8 at inter-pixel distance 0.5, input blur 0.5.
 */
@Getter
@Builder(toBuilder = true)
public class SiftParameters {
    @Builder.Default
    private final int numberOfOctaves = 5;
    @Builder.Default
    private final int scalesPerOctave = 3;
    @Builder.Default
    private final double minBlurLevel = 0.8;
    @Builder.Default
    private final double assumedBlur = 0.5;
    @Builder.Default
    private final int chunkSize = 32;
    @Builder.Default
    private final int dogChunkSize = 32;
    @Builder.Default
    private final double minInterpixelDistance = 0.5;
    // ngưỡng tương phản cho 3 scale / octave
    @Builder.Default
    private final double contrastThresholdBase = 0.015;
    @Builder.Default
    private final double edgeThreshold = 10.0;
    @Builder.Default
    private final double maxOffset = 0.6;
    @Builder.Default
    private final int maxIterations = 5;
    @Builder.Default
    private final double singularityEpsilon = 1e-12;

    public static SiftParameters defaults() {
        return SiftParameters.builder().build();
    }

    /**
     * DoG contrast threshold scaled from the 3-scales-per-octave reference value.
     */
    public static double contrastThreshold(int scalesPerOctave, double contrastThresholdBase) {
        return ((Math.pow(2.0, 1.0 / scalesPerOctave) - 1) / (Math.pow(2.0, 1.0 / 3.0) - 1)) * contrastThresholdBase;
    }

    /** Threshold applied to the interpolated value during refinement. */
    public double contrastThreshold() {
        return contrastThreshold(scalesPerOctave, contrastThresholdBase);
    }

    /** Relaxed threshold (80%) applied to raw DoG values during detection. */
    public double candidateThreshold() {
        return 0.8 * contrastThreshold();
    }

    /** (r + 1)^2 / r */
    public double edgeResponseLimit() {
        return (edgeThreshold + 1) * (edgeThreshold + 1) / edgeThreshold;
    }

    /**
     * @throws IllegalArgumentException on the first invalid value.
     */
    public SiftParameters validate() {
        require(numberOfOctaves >= 1, "numberOfOctaves must be >= 1, got " + numberOfOctaves);
        require(scalesPerOctave >= 1, "scalesPerOctave must be >= 1, got " + scalesPerOctave);
        require(minBlurLevel > 0, "minBlurLevel must be positive, got " + minBlurLevel);
        require(assumedBlur >= 0, "assumedBlur must not be negative, got " + assumedBlur);
        require(minBlurLevel > assumedBlur, "minBlurLevel (" + minBlurLevel + ") must exceed assumedBlur (" + assumedBlur + ")");
        require(chunkSize > 0, "chunkSize must be positive, got " + chunkSize);
        require(dogChunkSize > 0, "dogChunkSize must be positive, got " + dogChunkSize);
        require(minInterpixelDistance > 0, "minInterpixelDistance must be positive, got " + minInterpixelDistance);
        require(contrastThresholdBase >= 0, "contrastThresholdBase must not be negative, got " + contrastThresholdBase);
        require(edgeThreshold > 0, "edgeThreshold must be positive, got " + edgeThreshold);
        require(maxOffset > 0, "maxOffset must be positive, got " + maxOffset);
        require(maxIterations >= 1, "maxIterations must be >= 1, got " + maxIterations);
        require(singularityEpsilon >= 0, "singularityEpsilon must not be negative, got " + singularityEpsilon);
        return this;
    }

    private static void require(boolean condition, String message) {
        if (!condition) throw new IllegalArgumentException(message);
    }

    @Override
    public String toString() {
        return String.format(
                "SiftParameters[octaves=%d, scales=%d, sigmaMin=%.3f, assumedBlur=%.3f, chunk=%d, dogChunk=%d, "
                        + "deltaMin=%.3f, contrast=%.4f, edge=%.1f, maxOffset=%.2f, maxIterations=%d]",
                numberOfOctaves, scalesPerOctave, minBlurLevel, assumedBlur, chunkSize, dogChunkSize,
                minInterpixelDistance, contrastThresholdBase, edgeThreshold, maxOffset, maxIterations);
    }
}
