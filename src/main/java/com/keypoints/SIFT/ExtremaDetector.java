package com.keypoints.SIFT;

import com.keypoints.imageOperation.FloatImage;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;

/**
 * Scans DoG triplets for pixels strictly above or strictly below all 26 neighbours.
 */
@Slf4j
public class ExtremaDetector {
    private final double contrastThresholdBase;
    private final TileExecutor tiles;
    private final SiftProgressListener listener;

    public ExtremaDetector(double contrastThresholdBase, TileExecutor tiles, SiftProgressListener listener) {
        this.contrastThresholdBase = contrastThresholdBase;
        this.tiles = tiles;
        this.listener = listener == null ? SiftProgressListener.NONE : listener;
    }

    /** 80% of the scaled contrast threshold; extrema below it are only kept as rejected. */
    public static double candidateThreshold(int scalesPerOctave, double contrastThresholdBase) {
        return 0.8 * SiftParameters.contrastThreshold(scalesPerOctave, contrastThresholdBase);
    }

    /**
     * @param dogTriplet below, center, above DoG images of one octave.
     */
    public ExtremaResult detect(FloatImage[] dogTriplet, int scalesPerOctave) {
        if (dogTriplet == null || dogTriplet.length != 3) {
            throw new IllegalArgumentException("Expected 3 DoG images (below, center, above)");
        }
        return detect(dogTriplet[0], dogTriplet[1], dogTriplet[2], scalesPerOctave);
    }

    public ExtremaResult detect(FloatImage below, FloatImage center, FloatImage above, int scalesPerOctave) {
        if (!below.sameDimensions(center) || !above.sameDimensions(center)) {
            throw new IllegalArgumentException("DoG triplet dimensions differ: " + below + ", " + center + ", " + above);
        }
        if (scalesPerOctave < 1) {
            throw new IllegalArgumentException("scalesPerOctave must be >= 1, got " + scalesPerOctave);
        }
        double threshold = candidateThreshold(scalesPerOctave, contrastThresholdBase);
        List<Extremum> candidates = new ArrayList<>();
        List<Extremum> rejected = new ArrayList<>();

        int height = center.rows();
        int width = center.columns();
        for (int y = 1; y < height - 1; y++) {
            for (int x = 1; x < width - 1; x++) {
                float value = center.data[y][x];
                if (isLocalExtremum(value, below, center, above, y, x)) {
                    Extremum extremum = new Extremum(x, y, value);
                    if (Math.abs(value) >= threshold) candidates.add(extremum);
                    else rejected.add(extremum);
                }
            }
        }
        return new ExtremaResult(candidates, rejected);
    }

    /**
     * Runs {@link #detect} for every octave and every DoG scale that has a neighbour above and below.
     * Results are ordered by (octave, scale).
     */
    public List<ScaleExtrema> detectAll(DifferenceOfGaussians dog) {
        int scalesPerOctave = dog.getScalesPerOctave();
        List<Callable<ScaleExtrema>> tasks = new ArrayList<>();
        for (int o = 0; o < dog.numberOfOctaves(); o++) {
            Octave octave = dog.octave(o);
            if (octave.size() < 3) {
                throw new IllegalStateException("DoG octave " + o + " has " + octave.size() + " images, need at least 3");
            }
            for (int scale = 1; scale < octave.size() - 1; scale++) {
                int octaveIndex = o;
                int scaleIndex = scale;
                tasks.add(() -> new ScaleExtrema(octaveIndex, scaleIndex, detect(
                        octave.image(scaleIndex - 1), octave.image(scaleIndex), octave.image(scaleIndex + 1),
                        scalesPerOctave)));
            }
        }

        List<ScaleExtrema> found = tiles.invokeAll(tasks);
        int candidateCount = 0;
        int rejectedCount = 0;
        for (ScaleExtrema scaleExtrema : found) {
            for (Extremum e : scaleExtrema.getRejected()) {
                listener.candidateMarker(scaleExtrema.getOctave(), scaleExtrema.getScaleLevel(), e, true);
            }
            for (Extremum e : scaleExtrema.getCandidates()) {
                listener.candidateMarker(scaleExtrema.getOctave(), scaleExtrema.getScaleLevel(), e, false);
            }
            candidateCount += scaleExtrema.getCandidates().size();
            rejectedCount += scaleExtrema.getRejected().size();
            log.debug("Octave {}, scale {}: {} candidates, {} low contrast", scaleExtrema.getOctave(),
                    scaleExtrema.getScaleLevel(), scaleExtrema.getCandidates().size(), scaleExtrema.getRejected().size());
        }
        log.info("Found {} candidate extrema ({} rejected as low contrast)", candidateCount, rejectedCount);
        return found;
    }

    // so sánh với 26 điểm lân cận: 8 cùng scale + 9 scale dưới + 9 scale trên
    private static boolean isLocalExtremum(float value, FloatImage below, FloatImage center, FloatImage above, int y, int x) {
        boolean isMax = true;
        boolean isMin = true;

        for (int dy = -1; dy <= 1 && (isMax || isMin); dy++) {
            for (int dx = -1; dx <= 1; dx++) {
                float b = below.data[y + dy][x + dx];
                float a = above.data[y + dy][x + dx];
                if (!(value > b) || !(value > a)) isMax = false;
                if (!(value < b) || !(value < a)) isMin = false;
                if (dy != 0 || dx != 0) {
                    float c = center.data[y + dy][x + dx];
                    if (!(value > c)) isMax = false;
                    if (!(value < c)) isMin = false;
                }
            }
        }
        return isMax || isMin;
    }
}
