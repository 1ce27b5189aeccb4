package com.keypoints.API;

import com.keypoints.SIFT.SiftParameters;
import lombok.Getter;
import lombok.Setter;
import org.springframework.boot.context.properties.ConfigurationProperties;

/**
 * Binds {@code sift.*} from application.properties.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "sift")
public class SiftProperties {
    private int numberOfOctaves = 5;
    private int scalesPerOctave = 3;
    private double minBlurLevel = 0.8;
    private double assumedBlur = 0.5;
    private int chunkSize = 32;
    private int dogChunkSize = 32;
    private double minInterpixelDistance = 0.5;
    private double contrastThresholdBase = 0.015;
    private double edgeThreshold = 10.0;
    private double maxOffset = 0.6;
    private int maxIterations = 5;
    // 0 = số nhân CPU
    private int threads = 0;

    public SiftParameters toParameters() {
        return SiftParameters.builder()
                .numberOfOctaves(numberOfOctaves)
                .scalesPerOctave(scalesPerOctave)
                .minBlurLevel(minBlurLevel)
                .assumedBlur(assumedBlur)
                .chunkSize(chunkSize)
                .dogChunkSize(dogChunkSize)
                .minInterpixelDistance(minInterpixelDistance)
                .contrastThresholdBase(contrastThresholdBase)
                .edgeThreshold(edgeThreshold)
                .maxOffset(maxOffset)
                .maxIterations(maxIterations)
                .build()
                .validate();
    }

    public int resolvedThreads() {
        return threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }
}
