package com.keypoints.SIFT;

import com.keypoints.imageOperation.FloatImage;

/**
 * Central finite differences of the DoG around (s, m, n): scale, row, column.
 * Index order of the gradient and Hessian is (s, m, n).
 */
public final class FiniteDifferences {

    private FiniteDifferences() {
    }

    public static double[] gradient(Octave dog, int s, int m, int n) {
        FloatImage prev = dog.image(s - 1);
        FloatImage curr = dog.image(s);
        FloatImage next = dog.image(s + 1);

        double ds = (next.data[m][n] - prev.data[m][n]) / 2.0;
        double dm = (curr.data[m + 1][n] - curr.data[m - 1][n]) / 2.0;
        double dn = (curr.data[m][n + 1] - curr.data[m][n - 1]) / 2.0;
        return new double[]{ds, dm, dn};
    }

    /**
     * +-           -+
     * | h11 h12 h13 |
     * | h12 h22 h23 |
     * | h13 h23 h33 |
     * +-           -+
     */
    public static double[][] hessian(Octave dog, int s, int m, int n) {
        FloatImage prev = dog.image(s - 1);
        FloatImage curr = dog.image(s);
        FloatImage next = dog.image(s + 1);
        double v2 = 2.0 * curr.data[m][n];

        double h11 = next.data[m][n] + prev.data[m][n] - v2;
        double h22 = curr.data[m + 1][n] + curr.data[m - 1][n] - v2;
        double h33 = curr.data[m][n + 1] + curr.data[m][n - 1] - v2;
        double h12 = (next.data[m + 1][n] - next.data[m - 1][n] - prev.data[m + 1][n] + prev.data[m - 1][n]) / 4.0;
        double h13 = (next.data[m][n + 1] - next.data[m][n - 1] - prev.data[m][n + 1] + prev.data[m][n - 1]) / 4.0;
        double h23 = (curr.data[m + 1][n + 1] - curr.data[m + 1][n - 1] - curr.data[m - 1][n + 1] + curr.data[m - 1][n - 1]) / 4.0;

        return new double[][]{
                {h11, h12, h13},
                {h12, h22, h23},
                {h13, h23, h33}
        };
    }
}
