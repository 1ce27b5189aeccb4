package com.keypoints.SIFT;

import com.keypoints.imageOperation.FloatImage;
import com.keypoints.matrix.CofactorMatrixKernel;
import com.keypoints.matrix.MatrixKernel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.util.List;
import java.util.concurrent.ExecutorService;

/**
 * Runs the four stages in order:
 * scale space -> difference of Gaussians -> candidate extrema -> refined keypoints.
 * Each stage reads the complete output of the previous one; work inside a stage runs on the shared pool.
 */
@Slf4j
public class SiftPipeline {
    @Getter
    private final SiftParameters parameters;
    private final TileExecutor tiles;
    private final ScaleSpaceBuilder scaleSpaceBuilder;
    private final DifferenceOfGaussiansBuilder dogBuilder;
    private final ExtremaDetector extremaDetector;
    private final KeypointRefiner refiner;

    public SiftPipeline(SiftParameters parameters, ExecutorService service, SiftProgressListener listener) {
        this(parameters, new TileExecutor(service), new CofactorMatrixKernel(), listener);
    }

    public SiftPipeline(SiftParameters parameters, TileExecutor tiles, MatrixKernel matrix, SiftProgressListener listener) {
        this.parameters = parameters.validate();
        this.tiles = tiles;
        this.scaleSpaceBuilder = new ScaleSpaceBuilder(tiles, listener);
        this.dogBuilder = new DifferenceOfGaussiansBuilder(tiles, listener, parameters.getDogChunkSize());
        this.extremaDetector = new ExtremaDetector(parameters.getContrastThresholdBase(), tiles, listener);
        this.refiner = new KeypointRefiner(parameters, matrix, listener);
    }

    public ScaleSpace buildScaleSpace(FloatImage inputImage) {
        return scaleSpaceBuilder.build(inputImage, parameters);
    }

    public DifferenceOfGaussians buildDifferenceOfGaussians(ScaleSpace scaleSpace) {
        return dogBuilder.build(scaleSpace);
    }

    public List<ScaleExtrema> findCandidates(DifferenceOfGaussians dog) {
        return extremaDetector.detectAll(dog);
    }

    public RefinementReport refine(DifferenceOfGaussians dog, List<ScaleExtrema> extrema) {
        return refiner.refineAll(dog, extrema, tiles);
    }

    public PipelineState run(FloatImage inputImage) {
        long start = System.currentTimeMillis();
        log.info("SIFT on {}x{} image with {}", inputImage.rows(), inputImage.columns(), parameters);

        PipelineState state = PipelineState.start(inputImage);
        state = state.withScaleSpace(buildScaleSpace(state.getInputImage()));
        state = state.withDifferenceOfGaussians(buildDifferenceOfGaussians(state.requireScaleSpace()));
        state = state.withExtrema(findCandidates(state.requireDifferenceOfGaussians()));
        state = state.withReport(refine(state.requireDifferenceOfGaussians(), state.requireExtrema()));

        log.info("SIFT finished in {} ms: {} keypoints", System.currentTimeMillis() - start, state.getKeypoints().size());
        return state;
    }

    /** Stops the running stage before its next tile; the stage then throws CancellationException. */
    public void cancel() {
        tiles.cancel();
    }
}
