package com.keypoints.SIFT;

import com.keypoints.imageOperation.FloatImage;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered stack of scale levels sharing one resolution.
 * Used for both the Gaussian octaves and the DoG octaves.
 */
public class Octave {
    private final List<ScaleLevel> levels;

    public Octave(List<ScaleLevel> levels) {
        if (levels == null || levels.isEmpty()) {
            throw new IllegalArgumentException("An octave needs at least one level");
        }
        this.levels = Collections.unmodifiableList(new ArrayList<>(levels));
    }

    public int size() {
        return levels.size();
    }

    public ScaleLevel level(int index) {
        return levels.get(index);
    }

    public FloatImage image(int index) {
        return levels.get(index).image;
    }

    public List<ScaleLevel> getLevels() {
        return levels;
    }

    public int rows() {
        return levels.get(0).image.rows();
    }

    public int columns() {
        return levels.get(0).image.columns();
    }
}
