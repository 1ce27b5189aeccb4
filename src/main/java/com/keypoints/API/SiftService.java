package com.keypoints.API;

import com.keypoints.SIFT.PipelineState;
import com.keypoints.SIFT.ScaleSpaceBuilder;
import com.keypoints.SIFT.SiftParameters;
import com.keypoints.SIFT.SiftPipeline;
import com.keypoints.SIFT.SiftProgressListener;
import com.keypoints.imageOperation.ColourImageToGray;
import com.keypoints.imageOperation.FloatImage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.concurrent.ExecutorService;

@Slf4j
@Service
@RequiredArgsConstructor
public class SiftService {
    // giới hạn cho tham số từ request
    public static final int MAX_OCTAVES = 12;
    public static final int MAX_SCALES_PER_OCTAVE = 10;
    public static final int MAX_CHUNK_SIZE = 1024;

    private final SiftParameters defaultParameters;
    private final ExecutorService siftExecutor;
    private final ColourImageToGray colourImageToGray;

    public SiftParameters getDefaultParameters() {
        return defaultParameters;
    }

    /**
     * Kiểm tra xem file upload có phải ảnh không
     */
    public boolean isValidImageFile(MultipartFile file) {
        if (file == null || file.isEmpty()) return false;

        String contentType = file.getContentType();
        if (contentType == null || !contentType.startsWith("image/")) {
            return false;
        }

        String originalFilename = file.getOriginalFilename();
        return originalFilename != null &&
                originalFilename.matches("(?i).+\\.(jpg|jpeg|png|gif|bmp|webp|tif|tiff)$");
    }

    /**
     * Applies the non-null overrides to the configured defaults.
     * Overrides are bounded so one request cannot allocate an unbounded pyramid;
     * the octave count is checked again against the decoded image size.
     * @throws IllegalArgumentException if an override is out of range or the result is not a valid configuration.
     */
    public SiftParameters resolveParameters(Integer octaves, Integer scales, Integer chunkSize) {
        SiftParameters.SiftParametersBuilder builder = defaultParameters.toBuilder();
        if (octaves != null) builder.numberOfOctaves(checkRange("octaves", octaves, 1, MAX_OCTAVES));
        if (scales != null) builder.scalesPerOctave(checkRange("scales", scales, 1, MAX_SCALES_PER_OCTAVE));
        if (chunkSize != null) builder.chunkSize(checkRange("chunkSize", chunkSize, 1, MAX_CHUNK_SIZE));
        return builder.build().validate();
    }

    private static int checkRange(String name, int value, int min, int max) {
        if (value < min || value > max) {
            throw new IllegalArgumentException(name + " must be between " + min + " and " + max + ", got " + value);
        }
        return value;
    }

    public PipelineState detect(MultipartFile file, SiftParameters parameters) throws IOException {
        FloatImage image = colourImageToGray.decode(file.getBytes());
        log.info("Decoded {} as {}", file.getOriginalFilename(), image);
        return detect(image, parameters);
    }

    public PipelineState detect(FloatImage image, SiftParameters parameters) {
        int maxOctaves = ScaleSpaceBuilder.maxOctaves(image.rows(), image.columns());
        if (parameters.getNumberOfOctaves() > maxOctaves) {
            throw new IllegalArgumentException("A " + image.rows() + "x" + image.columns() + " image supports at most "
                    + maxOctaves + " octaves, got " + parameters.getNumberOfOctaves());
        }
        SiftPipeline pipeline = new SiftPipeline(parameters, siftExecutor, SiftProgressListener.NONE);
        return pipeline.run(image);
    }
}
