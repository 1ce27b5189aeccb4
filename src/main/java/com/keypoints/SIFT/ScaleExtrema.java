package com.keypoints.SIFT;

import lombok.AllArgsConstructor;
import lombok.Getter;

import java.util.List;

/**
 * Extrema found at one (octave, DoG scale) position.
 */
@AllArgsConstructor
@Getter
public class ScaleExtrema {
    private final int octave;
    private final int scaleLevel;
    private final ExtremaResult result;

    public List<Extremum> getCandidates() {
        return result.getCandidates();
    }

    public List<Extremum> getRejected() {
        return result.getRejected();
    }
}
