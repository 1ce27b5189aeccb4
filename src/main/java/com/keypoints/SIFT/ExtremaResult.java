package com.keypoints.SIFT;

import lombok.Getter;

import java.util.Collections;
import java.util.List;

/**
 * Extrema of one DoG triplet: those passing the contrast pre-filter, and those rejected by it.
 */
@Getter
public class ExtremaResult {
    private final List<Extremum> candidates;
    private final List<Extremum> rejected;

    public ExtremaResult(List<Extremum> candidates, List<Extremum> rejected) {
        this.candidates = Collections.unmodifiableList(candidates);
        this.rejected = Collections.unmodifiableList(rejected);
    }
}
