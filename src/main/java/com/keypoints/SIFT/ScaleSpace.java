package com.keypoints.SIFT;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Gaussian pyramid: numberOfOctaves octaves of scalesPerOctave + 3 levels each.
 */
@Getter
public class ScaleSpace {
    private final List<Octave> octaves;
    private final int scalesPerOctave;

    public ScaleSpace(List<Octave> octaves, int scalesPerOctave) {
        this.octaves = Collections.unmodifiableList(new ArrayList<>(octaves));
        this.scalesPerOctave = scalesPerOctave;
    }

    public int numberOfOctaves() {
        return octaves.size();
    }

    public Octave octave(int index) {
        return octaves.get(index);
    }
}
