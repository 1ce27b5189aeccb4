package com.keypoints.SIFT;

import com.keypoints.imageOperation.ChunkBoundary;
import com.keypoints.imageOperation.FloatImage;
import com.keypoints.imageOperation.PixelBuffers;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class DifferenceOfGaussiansBuilder {
    private final TileExecutor tiles;
    private final SiftProgressListener listener;
    private final int chunkSize;

    public DifferenceOfGaussiansBuilder(TileExecutor tiles, SiftProgressListener listener, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
        }
        this.tiles = tiles;
        this.listener = listener == null ? SiftProgressListener.NONE : listener;
        this.chunkSize = chunkSize;
    }

    public DifferenceOfGaussians build(ScaleSpace scaleSpace) {
        checkScaleSpace(scaleSpace);
        log.info("Building difference of Gaussians for {} octaves", scaleSpace.numberOfOctaves());

        List<Octave> dogOctaves = new ArrayList<>();
        for (int o = 0; o < scaleSpace.numberOfOctaves(); o++) {
            Octave gaussianOctave = scaleSpace.octave(o);
            List<ScaleLevel> levels = new ArrayList<>();

            for (int i = 1; i < gaussianOctave.size(); i++) {
                ScaleLevel lower = gaussianOctave.level(i - 1);
                ScaleLevel upper = gaussianOctave.level(i);
                FloatImage output = FloatImage.blank(lower.image.rows(), lower.image.columns());
                int octave = o;
                int scale = i - 1;

                List<ChunkBoundary> chunks = PixelBuffers.chunkBoundaries(output, chunkSize);
                tiles.forEachChunk(chunks, chunk -> {
                    subtractChunk(upper.image, lower.image, output, chunk);
                    listener.dogChunk(octave, scale, chunk, output);
                });

                ScaleLevel dog = new ScaleLevel(lower.blurLevel, output);
                levels.add(dog);
                listener.dogImage(octave, scale, dog);
            }
            dogOctaves.add(new Octave(levels));
        }
        return new DifferenceOfGaussians(dogOctaves, scaleSpace.getScalesPerOctave());
    }

    /** output = upper - lower over one tile. */
    public static void subtractChunk(FloatImage upper, FloatImage lower, FloatImage output, ChunkBoundary chunk) {
        for (int y = chunk.y1; y < chunk.y2; y++) {
            float[] upperRow = upper.data[y];
            float[] lowerRow = lower.data[y];
            float[] outRow = output.data[y];
            for (int x = chunk.x1; x < chunk.x2; x++) {
                outRow[x] = upperRow[x] - lowerRow[x];
            }
        }
    }

    private static void checkScaleSpace(ScaleSpace scaleSpace) {
        if (scaleSpace == null || scaleSpace.numberOfOctaves() == 0) {
            throw new IllegalStateException("Scale space is empty");
        }
        int levelCount = scaleSpace.octave(0).size();
        if (levelCount < 2) {
            throw new IllegalStateException("Octaves need at least 2 levels, got " + levelCount);
        }
        for (int o = 0; o < scaleSpace.numberOfOctaves(); o++) {
            Octave octave = scaleSpace.octave(o);
            if (octave.size() != levelCount) {
                throw new IllegalStateException("Octave " + o + " has " + octave.size() + " levels, expected " + levelCount);
            }
            for (int i = 1; i < octave.size(); i++) {
                if (!octave.image(i).sameDimensions(octave.image(0))) {
                    throw new IllegalStateException("Octave " + o + " level " + i + " is " + octave.image(i)
                            + ", level 0 is " + octave.image(0));
                }
            }
        }
    }
}
