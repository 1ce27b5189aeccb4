package com.keypoints.SIFT;

import com.keypoints.imageOperation.FloatImage;
import com.keypoints.imageOperation.PixelBuffers;
import org.junit.jupiter.api.Test;

import java.util.Random;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class ScaleSpaceBuilderTest {

    static FloatImage noise(int rows, int columns, long seed) {
        Random random = new Random(seed);
        float[][] data = new float[rows][columns];
        for (float[] row : data) {
            for (int x = 0; x < columns; x++) row[x] = random.nextFloat();
        }
        return new FloatImage(data);
    }

    private final ScaleSpaceBuilder builder = new ScaleSpaceBuilder(TileExecutor.inline(), null);

    @Test
    void octavesHaveScalesPlusThreeLevels() {
        ScaleSpace space = builder.build(noise(16, 12, 1), 3, 3, 0.8, 0.5, 8);

        assertThat(space.numberOfOctaves()).isEqualTo(3);
        assertThat(space.getScalesPerOctave()).isEqualTo(3);
        for (Octave octave : space.getOctaves()) {
            assertThat(octave.size()).isEqualTo(6);
        }
        assertThat(space.octave(0).rows()).isEqualTo(32);
        assertThat(space.octave(0).columns()).isEqualTo(24);
        assertThat(space.octave(1).rows()).isEqualTo(16);
        assertThat(space.octave(2).columns()).isEqualTo(6);
    }

    @Test
    void blurGrowsByTheScaleFactor() {
        ScaleSpace space = builder.build(noise(16, 16, 2), 2, 3, 0.8, 0.5, 8);
        double k = Math.pow(2.0, 1.0 / 3.0);

        Octave first = space.octave(0);
        assertThat(first.level(0).blurLevel).isEqualTo(0.8);
        for (int i = 1; i < first.size(); i++) {
            assertThat(first.level(i).blurLevel).isCloseTo(first.level(i - 1).blurLevel * k, within(1e-12));
        }
    }

    @Test
    void nextOctaveStartsFromDownsampledLevelS() {
        ScaleSpace space = builder.build(noise(16, 16, 3), 2, 3, 0.8, 0.5, 8);

        ScaleLevel seed = space.octave(0).level(3);
        ScaleLevel base = space.octave(1).level(0);
        assertThat(base.blurLevel).isEqualTo(seed.blurLevel);
        assertThat(base.image.data).isDeepEqualTo(PixelBuffers.downsample2x(seed.image).data);
        assertThat(space.octave(1).level(3).blurLevel).isCloseTo(2 * seed.blurLevel, within(1e-12));
    }

    @Test
    void chunkSizeAndThreadingDoNotChangeTheResult() {
        FloatImage input = noise(11, 13, 4);
        ScaleSpace reference = builder.build(input, 2, 3, 0.8, 0.5, 64);

        ExecutorService pool = Executors.newFixedThreadPool(3);
        try {
            ScaleSpaceBuilder parallel = new ScaleSpaceBuilder(new TileExecutor(pool), null);
            for (int chunkSize : new int[]{1, 5, 16}) {
                ScaleSpace tiled = parallel.build(input, 2, 3, 0.8, 0.5, chunkSize);
                for (int o = 0; o < 2; o++) {
                    for (int i = 0; i < 6; i++) {
                        assertThat(tiled.octave(o).image(i).data)
                                .as("octave %d level %d chunk %d", o, i, chunkSize)
                                .isDeepEqualTo(reference.octave(o).image(i).data);
                    }
                }
            }
        } finally {
            pool.shutdownNow();
        }
    }

    @Test
    void nonIncreasingScheduleFailsFast() {
        assertThatThrownBy(() -> builder.build(noise(8, 8, 5), 1, 3, 0.5, 0.6, 8))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Non-increasing");
    }

    @Test
    void invalidArgumentsAreRejected() {
        FloatImage input = noise(8, 8, 6);
        assertThatThrownBy(() -> builder.build(input, 0, 3, 0.8, 0.5, 8)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.build(input, 1, 0, 0.8, 0.5, 8)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> builder.build(input, 1, 3, 0.8, 0.5, 0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void maxOctavesFollowsTheSmallerSide() {
        assertThat(ScaleSpaceBuilder.maxOctaves(8, 8)).isEqualTo(5);
        assertThat(ScaleSpaceBuilder.maxOctaves(12, 10)).isEqualTo(5);
        assertThat(ScaleSpaceBuilder.maxOctaves(1, 100)).isEqualTo(2);
        assertThat(ScaleSpaceBuilder.maxOctaves(1024, 768)).isEqualTo(11);
    }

    @Test
    void deepestAllowedPyramidEndsAtOnePixel() {
        ScaleSpace space = builder.build(noise(8, 8, 8), 5, 3, 0.8, 0.5, 8);
        assertThat(space.octave(4).rows()).isEqualTo(1);
    }

    @Test
    void tooManyOctavesForTheImageFails() {
        assertThatThrownBy(() -> builder.build(noise(2, 2, 7), 4, 3, 0.8, 0.5, 8))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
