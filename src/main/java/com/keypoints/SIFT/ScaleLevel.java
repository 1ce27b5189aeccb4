package com.keypoints.SIFT;

import com.keypoints.imageOperation.FloatImage;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One image of an octave together with the blur (sigma) it carries.
 */
@AllArgsConstructor
@Getter
public class ScaleLevel {
    public final double blurLevel;
    public final FloatImage image;

    @Override
    public String toString() {
        return String.format("ScaleLevel[sigma=%.4f, %dx%d]", blurLevel, image.rows(), image.columns());
    }
}
