package com.keypoints.SIFT;

import com.keypoints.imageOperation.FloatImage;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ExtremaDetectorTest {

    private final ExtremaDetector detector = new ExtremaDetector(0.015, TileExecutor.inline(), null);

    private static FloatImage filled(int size, float value) {
        FloatImage image = FloatImage.blank(size, size);
        for (float[] row : image.data) Arrays.fill(row, value);
        return image;
    }

    @Test
    void flatTripletHasNoExtrema() {
        ExtremaResult result = detector.detect(filled(5, 0.1f), filled(5, 0.1f), filled(5, 0.1f), 3);
        assertThat(result.getCandidates()).isEmpty();
        assertThat(result.getRejected()).isEmpty();
    }

    @Test
    void impulseIsASingleCandidate() {
        FloatImage center = FloatImage.blank(5, 5);
        center.set(2, 3, 0.5f);

        ExtremaResult result = detector.detect(new FloatImage[]{FloatImage.blank(5, 5), center, FloatImage.blank(5, 5)}, 3);

        assertThat(result.getCandidates()).containsExactly(new Extremum(3, 2, 0.5f));
        assertThat(result.getRejected()).isEmpty();
    }

    @Test
    void negativeImpulseIsAMinimum() {
        FloatImage center = FloatImage.blank(5, 5);
        center.set(1, 1, -0.2f);

        ExtremaResult result = detector.detect(FloatImage.blank(5, 5), center, FloatImage.blank(5, 5), 3);
        assertThat(result.getCandidates()).containsExactly(new Extremum(1, 1, -0.2f));
    }

    @Test
    void weakImpulseIsRejectedNotDropped() {
        FloatImage center = FloatImage.blank(5, 5);
        center.set(2, 2, 0.005f);

        ExtremaResult result = detector.detect(FloatImage.blank(5, 5), center, FloatImage.blank(5, 5), 3);
        assertThat(result.getCandidates()).isEmpty();
        assertThat(result.getRejected()).containsExactly(new Extremum(2, 2, 0.005f));
    }

    @Test
    void tieWithANeighbourIsNotAnExtremum() {
        FloatImage center = FloatImage.blank(5, 5);
        FloatImage above = FloatImage.blank(5, 5);
        center.set(2, 2, 0.5f);
        above.set(1, 2, 0.5f);

        ExtremaResult result = detector.detect(FloatImage.blank(5, 5), center, above, 3);
        assertThat(result.getCandidates()).isEmpty();
    }

    @Test
    void borderPixelsAreNeverReported() {
        FloatImage center = FloatImage.blank(5, 5);
        center.set(0, 2, 1f);
        center.set(2, 4, 1f);

        ExtremaResult result = detector.detect(FloatImage.blank(5, 5), center, FloatImage.blank(5, 5), 3);
        assertThat(result.getCandidates()).isEmpty();
        assertThat(result.getRejected()).isEmpty();
    }

    @Test
    void thresholdIsEightyPercentOfScaledContrast() {
        assertThat(ExtremaDetector.candidateThreshold(3, 0.015)).isEqualTo(0.8 * 0.015);
    }

    @Test
    void mismatchedTripletIsRejected() {
        assertThatThrownBy(() -> detector.detect(FloatImage.blank(5, 5), FloatImage.blank(5, 5), FloatImage.blank(4, 5), 3))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> detector.detect(new FloatImage[]{FloatImage.blank(5, 5)}, 3))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void detectAllCoversInnerScalesInOrderAndReportsMarkers() {
        List<ScaleLevel> levels = new ArrayList<>();
        for (int i = 0; i < 5; i++) {
            levels.add(new ScaleLevel(0.8 + i, FloatImage.blank(6, 6)));
        }
        levels.get(2).image.set(3, 3, 0.4f);
        levels.get(3).image.set(1, 1, 0.001f);
        DifferenceOfGaussians dog = new DifferenceOfGaussians(List.of(new Octave(levels)), 3);

        List<String> markers = new ArrayList<>();
        ExtremaDetector withListener = new ExtremaDetector(0.015, TileExecutor.inline(), new SiftProgressListener() {
            @Override
            public void candidateMarker(int octave, int scale, Extremum extremum, boolean lowContrast) {
                markers.add(scale + ":" + extremum.x + "," + extremum.y + (lowContrast ? ":low" : ""));
            }
        });

        List<ScaleExtrema> found = withListener.detectAll(dog);

        assertThat(found).extracting(ScaleExtrema::getScaleLevel).containsExactly(1, 2, 3);
        assertThat(found.get(1).getCandidates()).containsExactly(new Extremum(3, 3, 0.4f));
        assertThat(found.get(2).getRejected()).containsExactly(new Extremum(1, 1, 0.001f));
        assertThat(markers).containsExactly("2:3,3", "3:1,1:low");
    }
}
