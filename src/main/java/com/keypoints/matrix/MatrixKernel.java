package com.keypoints.matrix;

/**
 * Small dense-matrix operations needed by keypoint refinement.
 * Matrices are row-major {@code double[row][column]}, vectors are column vectors.
 */
public interface MatrixKernel {

    double determinant2x2(double[][] m);

    double determinant3x3(double[][] m);

    /**
     * Removes one row and one column.
     * @param m source matrix, at least 2x2.
     * @param row row to drop.
     * @param column column to drop.
     * @return a new (n-1)x(n-1) matrix.
     */
    double[][] minorMatrix(double[][] m, int row, int column);

    /** Matrix of 2x2 minor determinants of a 3x3 matrix. */
    double[][] minors3x3(double[][] m);

    /** Minors with the checkerboard sign applied. */
    double[][] cofactors3x3(double[][] m);

    /** Transpose of the cofactor matrix. */
    double[][] adjugate3x3(double[][] m);

    /**
     * @throws ArithmeticException when the determinant is zero.
     */
    double[][] inverse3x3(double[][] m);

    double trace(double[][] m);

    double[][] transpose(double[][] m);

    double[][] scalarMultiply(double[][] m, double scalar);

    /** m * v */
    double[] vectorMultiply(double[][] m, double[] v);

    double dot(double[] a, double[] b);
}
