package com.keypoints.SIFT;

import com.keypoints.matrix.MatrixKernel;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Sub-pixel localisation of candidate extrema by fitting a 3D quadratic to the DoG.
 *
 * <p>At sample (s, m, n) the DoG is approximated by
 * {@code omega(alpha) = D + alpha^T g + 0.5 alpha^T H alpha},
 * whose stationary point is {@code alpha = -H^-1 g}. If every component of alpha is below
 * {@code maxOffset} the fit is accepted; otherwise the sample moves to the nearest discrete
 * position of (s, m, n) + alpha and the fit is repeated.
 */
@Slf4j
public class KeypointRefiner {
    private final SiftParameters parameters;
    private final MatrixKernel matrix;
    private final SiftProgressListener listener;

    public KeypointRefiner(SiftParameters parameters, MatrixKernel matrix, SiftProgressListener listener) {
        this.parameters = parameters.validate();
        this.matrix = matrix;
        this.listener = listener == null ? SiftProgressListener.NONE : listener;
    }

    /**
     * Refines one candidate. Never throws for numerical reasons; every path ends in a {@link RefinementState}.
     *
     * @param octave     octave index, used for the absolute coordinates.
     * @param dogOctave  DoG images of that octave.
     * @param scaleLevel DoG scale the candidate was found at.
     */
    public RefinementOutcome refine(int octave, Octave dogOctave, int scaleLevel, Extremum extremum) {
        int s = scaleLevel;
        int m = extremum.y;
        int n = extremum.x;
        if (!insideInterior(dogOctave, s, m, n)) {
            return RefinementOutcome.discarded(RefinementState.DISCARDED_OUT_OF_BOUNDS, 0);
        }

        for (int iteration = 1; iteration <= parameters.getMaxIterations(); iteration++) {
            double[] gradient = FiniteDifferences.gradient(dogOctave, s, m, n);
            double[][] hessian = FiniteDifferences.hessian(dogOctave, s, m, n);

            double det = matrix.determinant3x3(hessian);
            if (Math.abs(det) <= parameters.getSingularityEpsilon()) {
                return RefinementOutcome.discarded(RefinementState.DISCARDED_NO_CONVERGENCE, iteration);
            }

            // alpha = -(H^-1) g
            double[] alpha = matrix.vectorMultiply(
                    matrix.scalarMultiply(matrix.inverse3x3(hessian), -1), gradient);

            if (maxAbs(alpha) < parameters.getMaxOffset()) {
                return accept(octave, dogOctave, s, m, n, alpha, gradient, hessian, iteration);
            }

            s = (int) Math.round(s + alpha[0]);
            m = (int) Math.round(m + alpha[1]);
            n = (int) Math.round(n + alpha[2]);
            if (!insideInterior(dogOctave, s, m, n)) {
                return RefinementOutcome.discarded(RefinementState.DISCARDED_OUT_OF_BOUNDS, iteration);
            }
        }
        return RefinementOutcome.discarded(RefinementState.DISCARDED_NO_CONVERGENCE, parameters.getMaxIterations());
    }

    /**
     * Refines every candidate in parallel. Output keeps the input order.
     */
    public RefinementReport refineAll(DifferenceOfGaussians dog, List<ScaleExtrema> extrema, TileExecutor tiles) {
        List<Callable<RefinementOutcome>> tasks = new ArrayList<>();
        List<String> labels = new ArrayList<>();
        for (ScaleExtrema scaleExtrema : extrema) {
            int octave = scaleExtrema.getOctave();
            int scale = scaleExtrema.getScaleLevel();
            if (octave < 0 || octave >= dog.numberOfOctaves()) {
                throw new IllegalStateException("Extrema reference octave " + octave + " but DoG has " + dog.numberOfOctaves());
            }
            Octave dogOctave = dog.octave(octave);
            for (Extremum extremum : scaleExtrema.getCandidates()) {
                tasks.add(() -> refine(octave, dogOctave, scale, extremum));
                labels.add("octave " + octave + ", scale " + scale + ", (" + extremum.x + ", " + extremum.y + ")");
            }
        }

        List<RefinementOutcome> outcomes = tiles.invokeAll(tasks);
        List<RefinedKeypoint> keypoints = new ArrayList<>();
        Map<RefinementState, Integer> counts = new EnumMap<>(RefinementState.class);
        for (int i = 0; i < outcomes.size(); i++) {
            RefinementOutcome outcome = outcomes.get(i);
            counts.merge(outcome.getState(), 1, Integer::sum);
            if (outcome.isConverged()) {
                keypoints.add(outcome.getKeypoint());
                listener.keypointRefined(outcome.getKeypoint());
            } else if (log.isDebugEnabled()) {
                log.debug("Candidate at {} discarded after {} iteration(s): {}", labels.get(i), outcome.getIterations(), outcome.getState());
            }
        }

        RefinementReport report = new RefinementReport(keypoints, counts);
        log.info("Refined {} of {} candidates into keypoints; discarded {}", keypoints.size(), outcomes.size(), report.getStateCounts());
        return report;
    }

    private RefinementOutcome accept(int octave, Octave dogOctave, int s, int m, int n,
                                     double[] alpha, double[] gradient, double[][] hessian, int iteration) {
        double value = dogOctave.image(s).data[m][n];
        double interpolatedValue = value + 0.5 * matrix.dot(alpha, gradient);
        if (Math.abs(interpolatedValue) < parameters.contrastThreshold()) {
            return RefinementOutcome.discarded(RefinementState.DISCARDED_LOW_CONTRAST, iteration);
        }

        // Hessian không gian (bỏ hàng/cột scale) để loại điểm nằm trên cạnh.
        // R < 0 (det âm) không bị loại.
        double[][] spatialHessian = matrix.minorMatrix(hessian, 0, 0);
        double trace = matrix.trace(spatialHessian);
        double det = matrix.determinant2x2(spatialHessian);
        if ((trace * trace) / det > parameters.edgeResponseLimit()) {
            return RefinementOutcome.discarded(RefinementState.DISCARDED_EDGE, iteration);
        }

        double interpixelDistance = Math.pow(2.0, octave - 1);
        double absoluteX = interpixelDistance * (alpha[2] + n);
        double absoluteY = interpixelDistance * (alpha[1] + m);
        double absoluteSigma = (interpixelDistance / parameters.getMinInterpixelDistance())
                * parameters.getMinBlurLevel()
                * Math.pow(2.0, (alpha[0] + s) / parameters.getScalesPerOctave());

        return RefinementOutcome.converged(RefinedKeypoint.builder()
                .octave(octave)
                .scaleLevel(s)
                .localX(n)
                .localY(m)
                .absoluteX(absoluteX)
                .absoluteY(absoluteY)
                .absoluteSigma(absoluteSigma)
                .interpolatedValue(interpolatedValue)
                .offsetS(alpha[0])
                .offsetM(alpha[1])
                .offsetN(alpha[2])
                .iterations(iteration)
                .build());
    }

    private static boolean insideInterior(Octave dogOctave, int s, int m, int n) {
        if (s < 1 || s > dogOctave.size() - 2) return false;
        if (m < 1 || m > dogOctave.rows() - 2) return false;
        return n >= 1 && n <= dogOctave.columns() - 2;
    }

    private static double maxAbs(double[] v) {
        double max = 0;
        for (double x : v) max = Math.max(max, Math.abs(x));
        return max;
    }
}
