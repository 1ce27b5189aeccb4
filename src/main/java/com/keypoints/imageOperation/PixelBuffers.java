package com.keypoints.imageOperation;

import java.util.ArrayList;
import java.util.List;

/****
 * Resampling and tiling helpers for the pyramid stages.
 * Octave 0 is built from the input doubled in size; each next octave starts from a halved image.
 * Both use nearest-neighbour sampling so no extra blur is introduced.
 */
public final class PixelBuffers {

    private PixelBuffers() {
    }

    public static int[] dimensions(FloatImage image) {
        return new int[]{image.rows(), image.columns()};
    }

    /**
     * Nearest-neighbour resample.
     * @param samplingRate step between samples: 0.5 doubles the image, 2.0 halves it.
     */
    public static FloatImage resize(FloatImage image, double samplingRate) {
        if (!(samplingRate > 0)) {
            throw new IllegalArgumentException("Sampling rate must be positive, got " + samplingRate);
        }
        int newRows = (int) Math.ceil(image.rows() / samplingRate);
        int newColumns = (int) Math.ceil(image.columns() / samplingRate);
        float[][] out = new float[newRows][newColumns];
        for (int r = 0; r < newRows; r++) {
            int srcY = Math.min((int) Math.floor(r * samplingRate), image.rows() - 1);
            for (int c = 0; c < newColumns; c++) {
                int srcX = Math.min((int) Math.floor(c * samplingRate), image.columns() - 1);
                out[r][c] = image.data[srcY][srcX];
            }
        }
        return new FloatImage(out);
    }

    /** Doubles both dimensions, every source pixel becomes a 2x2 block. */
    public static FloatImage upsample2x(FloatImage image) {
        return resize(image, 0.5);
    }

    /**
     * Keeps every second pixel. Dimensions are floor-halved.
     * @throws IllegalArgumentException if the result would be empty.
     */
    public static FloatImage downsample2x(FloatImage image) {
        int newRows = image.rows() / 2;
        int newColumns = image.columns() / 2;
        if (newRows == 0 || newColumns == 0) {
            throw new IllegalArgumentException("Cannot downsample a " + image.rows() + "x" + image.columns() + " image");
        }
        float[][] out = new float[newRows][newColumns];
        for (int r = 0; r < newRows; r++) {
            for (int c = 0; c < newColumns; c++) {
                out[r][c] = image.data[r * 2][c * 2];
            }
        }
        return new FloatImage(out);
    }

    /**
     * Splits a width x height image into chunkSize tiles, x outer and y inner.
     * Edge tiles are trimmed so the tiles cover the image exactly once.
     */
    public static List<ChunkBoundary> chunkBoundaries(int width, int height, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive, got " + width + "x" + height);
        }
        List<ChunkBoundary> chunks = new ArrayList<>();
        for (int x = 0; x < width; x += chunkSize) {
            int xOffset = Math.min(chunkSize, width - x);
            for (int y = 0; y < height; y += chunkSize) {
                int yOffset = Math.min(chunkSize, height - y);
                chunks.add(new ChunkBoundary(x, y, x + xOffset, y + yOffset));
            }
        }
        return chunks;
    }

    public static List<ChunkBoundary> chunkBoundaries(FloatImage image, int chunkSize) {
        return chunkBoundaries(image.columns(), image.rows(), chunkSize);
    }
}
