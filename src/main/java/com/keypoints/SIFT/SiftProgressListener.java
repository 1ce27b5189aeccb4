package com.keypoints.SIFT;

import com.keypoints.imageOperation.ChunkBoundary;
import com.keypoints.imageOperation.FloatImage;

/**
 * Progress notifications for a viewer. Purely observational: implementations must not modify the images.
 * Chunk callbacks run on worker threads; the others run on the thread driving the pipeline.
 */
public interface SiftProgressListener {

    SiftProgressListener NONE = new SiftProgressListener() {
    };

    /** One tile of a Gaussian level is written; {@code target} may still be incomplete elsewhere. */
    default void blurredChunk(int octave, int scale, ChunkBoundary chunk, FloatImage target) {
    }

    default void blurredImage(int octave, int scale, ScaleLevel level) {
    }

    default void dogChunk(int octave, int scale, ChunkBoundary chunk, FloatImage target) {
    }

    default void dogImage(int octave, int scale, ScaleLevel level) {
    }

    default void candidateMarker(int octave, int scale, Extremum extremum, boolean lowContrast) {
    }

    default void keypointRefined(RefinedKeypoint keypoint) {
    }
}
