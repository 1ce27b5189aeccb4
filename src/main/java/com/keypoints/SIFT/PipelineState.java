package com.keypoints.SIFT;

import com.keypoints.imageOperation.FloatImage;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Output of each stage so far. Every {@code with...} call returns a new state;
 * the {@code require...} accessors fail when a stage is asked for before it has run.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class PipelineState {
    private final FloatImage inputImage;
    private final ScaleSpace scaleSpace;
    private final DifferenceOfGaussians differenceOfGaussians;
    private final List<ScaleExtrema> extrema;
    private final RefinementReport report;

    public static PipelineState start(FloatImage inputImage) {
        if (inputImage == null) {
            throw new IllegalArgumentException("Input image is required");
        }
        return new PipelineState(inputImage, null, null, null, null);
    }

    public PipelineState withScaleSpace(ScaleSpace scaleSpace) {
        return new PipelineState(inputImage, scaleSpace, null, null, null);
    }

    public PipelineState withDifferenceOfGaussians(DifferenceOfGaussians dog) {
        requireScaleSpace();
        return new PipelineState(inputImage, scaleSpace, dog, null, null);
    }

    public PipelineState withExtrema(List<ScaleExtrema> extrema) {
        requireDifferenceOfGaussians();
        return new PipelineState(inputImage, scaleSpace, differenceOfGaussians, extrema, null);
    }

    public PipelineState withReport(RefinementReport report) {
        requireExtrema();
        return new PipelineState(inputImage, scaleSpace, differenceOfGaussians, extrema, report);
    }

    public ScaleSpace requireScaleSpace() {
        return require(scaleSpace, "scale space");
    }

    public DifferenceOfGaussians requireDifferenceOfGaussians() {
        return require(differenceOfGaussians, "difference of Gaussians");
    }

    public List<ScaleExtrema> requireExtrema() {
        return require(extrema, "candidate extrema");
    }

    public RefinementReport requireReport() {
        return require(report, "refinement report");
    }

    public List<RefinedKeypoint> getKeypoints() {
        return requireReport().getKeypoints();
    }

    private static <T> T require(T value, String stage) {
        if (value == null) {
            throw new IllegalStateException("The " + stage + " stage has not run yet");
        }
        return value;
    }
}
