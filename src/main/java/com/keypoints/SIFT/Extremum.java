package com.keypoints.SIFT;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Discrete DoG extremum: pixel position in its octave and the DoG value there.
 */
@AllArgsConstructor
@Getter
@EqualsAndHashCode
public class Extremum {
    public final int x, y;
    public final float value;

    @Override
    public String toString() {
        return String.format("Extremum at (%d, %d) value=%.5f", x, y, value);
    }
}
