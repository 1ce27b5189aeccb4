package com.keypoints.SIFT;

import com.keypoints.filter_convolution_gauss.SeparabilityGauss;
import com.keypoints.imageOperation.ChunkBoundary;
import com.keypoints.imageOperation.FloatImage;
import com.keypoints.imageOperation.PixelBuffers;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;

@Slf4j
public class ScaleSpaceBuilder {
    private final TileExecutor tiles;
    private final SiftProgressListener listener;

    public ScaleSpaceBuilder(TileExecutor tiles, SiftProgressListener listener) {
        this.tiles = tiles;
        this.listener = listener == null ? SiftProgressListener.NONE : listener;
    }

    /**
     * Octaves that fit an input of this size. Octave 0 is doubled and every next one floor-halved,
     * so octave k has floor(2 * dim / 2^k) pixels and the last one keeps at least one.
     */
    public static int maxOctaves(int rows, int columns) {
        int smallest = 2 * Math.min(rows, columns);
        return 32 - Integer.numberOfLeadingZeros(smallest);
    }

    public ScaleSpace build(FloatImage inputImage, SiftParameters parameters) {
        return build(inputImage, parameters.getNumberOfOctaves(), parameters.getScalesPerOctave(),
                parameters.getMinBlurLevel(), parameters.getAssumedBlur(), parameters.getChunkSize());
    }

    /*****
     Octave 0 starts from the input doubled in size and is assumed to carry assumedBlur.
     Each level is blurred directly from the octave base to
         target = baseBlur * k^scale, k = 2^(1/S)
     using the semi-group relation target^2 = base^2 + offset^2, i.e.
         offset = sqrt(target^2 - base^2)
     Level 0 of octave o > 0 is level S of octave o - 1 downsampled by 2; its blur is kept as is.
     *****/
    public ScaleSpace build(FloatImage inputImage, int numberOfOctaves, int scalesPerOctave,
                            double minBlurLevel, double assumedBlur, int chunkSize) {
        if (numberOfOctaves < 1) {
            throw new IllegalArgumentException("numberOfOctaves must be >= 1, got " + numberOfOctaves);
        }
        if (scalesPerOctave < 1) {
            throw new IllegalArgumentException("scalesPerOctave must be >= 1, got " + scalesPerOctave);
        }
        if (!(minBlurLevel > 0) || assumedBlur < 0) {
            throw new IllegalArgumentException("Blur levels must be positive, got minBlurLevel=" + minBlurLevel + ", assumedBlur=" + assumedBlur);
        }
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("Chunk size must be positive, got " + chunkSize);
        }
        int maxOctaves = maxOctaves(inputImage.rows(), inputImage.columns());
        if (numberOfOctaves > maxOctaves) {
            throw new IllegalArgumentException("A " + inputImage.rows() + "x" + inputImage.columns()
                    + " image supports at most " + maxOctaves + " octaves, got " + numberOfOctaves);
        }

        log.info("Building scale space: {} octaves x {} levels from a {}x{} image",
                numberOfOctaves, scalesPerOctave + 3, inputImage.rows(), inputImage.columns());

        double k = Math.pow(2.0, 1.0 / scalesPerOctave);
        List<Octave> octaves = new ArrayList<>();
        FloatImage baseImage = PixelBuffers.upsample2x(inputImage);
        double baseBlurLevel = minBlurLevel;

        for (int o = 0; o < numberOfOctaves; o++) {
            List<ScaleLevel> levels = new ArrayList<>();

            for (int scale = 0; scale < scalesPerOctave + 3; scale++) {
                ScaleLevel level;
                if (o > 0 && scale == 0) {
                    ScaleLevel seed = octaves.get(o - 1).level(scalesPerOctave);
                    baseImage = PixelBuffers.downsample2x(seed.image);
                    baseBlurLevel = seed.blurLevel;
                    level = new ScaleLevel(baseBlurLevel, baseImage);
                } else {
                    double targetSigma = baseBlurLevel * Math.pow(k, scale);
                    double baseSigma = o == 0 ? assumedBlur : baseBlurLevel;
                    if (!(targetSigma > baseSigma)) {
                        throw new IllegalArgumentException(String.format(
                                "Non-increasing sigma schedule at octave %d, scale %d: target %.5f <= base %.5f",
                                o, scale, targetSigma, baseSigma));
                    }
                    double offsetSigma = Math.sqrt(targetSigma * targetSigma - baseSigma * baseSigma);
                    level = new ScaleLevel(targetSigma, blur(baseImage, offsetSigma, chunkSize, o, scale));
                }
                levels.add(level);
                listener.blurredImage(o, scale, level);
            }

            octaves.add(new Octave(levels));
            log.debug("Octave {} done: {}x{}, sigma {} .. {}", o, baseImage.rows(), baseImage.columns(),
                    levels.get(0).blurLevel, levels.get(levels.size() - 1).blurLevel);
        }
        return new ScaleSpace(octaves, scalesPerOctave);
    }

    private FloatImage blur(FloatImage base, double sigma, int chunkSize, int octave, int scale) {
        FloatImage output = FloatImage.blank(base.rows(), base.columns());
        List<ChunkBoundary> chunks = PixelBuffers.chunkBoundaries(base, chunkSize);
        tiles.forEachChunk(chunks, chunk -> {
            SeparabilityGauss.blurChunk(base, output, sigma, chunk);
            listener.blurredChunk(octave, scale, chunk, output);
        });
        return output;
    }
}
