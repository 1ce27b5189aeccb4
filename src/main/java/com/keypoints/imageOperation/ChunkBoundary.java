package com.keypoints.imageOperation;

import lombok.AllArgsConstructor;
import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * Tile rectangle, x1/y1 inclusive, x2/y2 exclusive.
 */
@AllArgsConstructor
@Getter
@EqualsAndHashCode
public class ChunkBoundary {
    public final int x1, y1, x2, y2;

    public int width() {
        return x2 - x1;
    }

    public int height() {
        return y2 - y1;
    }

    public int area() {
        return width() * height();
    }

    @Override
    public String toString() {
        return String.format("Chunk[(%d, %d) -> (%d, %d)]", x1, y1, x2, y2);
    }
}
