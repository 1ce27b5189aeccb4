package com.keypoints.SIFT;

import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * DoG pyramid: per octave, level i = gaussian[i + 1] - gaussian[i], blur level of gaussian[i].
 */
@Getter
public class DifferenceOfGaussians {
    private final List<Octave> octaves;
    private final int scalesPerOctave;

    public DifferenceOfGaussians(List<Octave> octaves, int scalesPerOctave) {
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
