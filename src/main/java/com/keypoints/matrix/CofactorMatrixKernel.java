package com.keypoints.matrix;

/**
 * Matrix kernel based on cofactor expansion.
 * Nghịch đảo 3x3 = adjugate / det, không dùng thư viện đại số tuyến tính.
 */
public class CofactorMatrixKernel implements MatrixKernel {

    @Override
    public double determinant2x2(double[][] m) {
        requireSquare(m, 2);
        return m[0][0] * m[1][1] - m[0][1] * m[1][0];
    }

    @Override
    public double determinant3x3(double[][] m) {
        requireSquare(m, 3);
        // khai triển theo hàng 0
        return m[0][0] * (m[1][1] * m[2][2] - m[1][2] * m[2][1])
                - m[0][1] * (m[1][0] * m[2][2] - m[1][2] * m[2][0])
                + m[0][2] * (m[1][0] * m[2][1] - m[1][1] * m[2][0]);
    }

    @Override
    public double[][] minorMatrix(double[][] m, int row, int column) {
        int n = m.length;
        if (n < 2 || m[0].length != n) {
            throw new IllegalArgumentException("Minor needs a square matrix of size >= 2, got " + n + "x" + m[0].length);
        }
        if (row < 0 || row >= n || column < 0 || column >= n) {
            throw new IllegalArgumentException("Row/column (" + row + ", " + column + ") outside a " + n + "x" + n + " matrix");
        }
        double[][] minor = new double[n - 1][n - 1];
        int r = 0;
        for (int i = 0; i < n; i++) {
            if (i == row) continue;
            int c = 0;
            for (int j = 0; j < n; j++) {
                if (j == column) continue;
                minor[r][c++] = m[i][j];
            }
            r++;
        }
        return minor;
    }

    @Override
    public double[][] minors3x3(double[][] m) {
        requireSquare(m, 3);
        double[][] minors = new double[3][3];
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                minors[i][j] = determinant2x2(minorMatrix(m, i, j));
            }
        }
        return minors;
    }

    @Override
    public double[][] cofactors3x3(double[][] m) {
        double[][] cofactors = minors3x3(m);
        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                if (((i + j) & 1) == 1) cofactors[i][j] = -cofactors[i][j];
            }
        }
        return cofactors;
    }

    @Override
    public double[][] adjugate3x3(double[][] m) {
        return transpose(cofactors3x3(m));
    }

    @Override
    public double[][] inverse3x3(double[][] m) {
        double det = determinant3x3(m);
        if (det == 0.0) {
            throw new ArithmeticException("Matrix is singular");
        }
        return scalarMultiply(adjugate3x3(m), 1.0 / det);
    }

    @Override
    public double trace(double[][] m) {
        requireSquare(m, m.length);
        double sum = 0;
        for (int i = 0; i < m.length; i++) sum += m[i][i];
        return sum;
    }

    @Override
    public double[][] transpose(double[][] m) {
        int rows = m.length;
        int columns = m[0].length;
        double[][] t = new double[columns][rows];
        for (int i = 0; i < rows; i++) {
            for (int j = 0; j < columns; j++) {
                t[j][i] = m[i][j];
            }
        }
        return t;
    }

    @Override
    public double[][] scalarMultiply(double[][] m, double scalar) {
        double[][] out = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            out[i] = new double[m[i].length];
            for (int j = 0; j < m[i].length; j++) {
                out[i][j] = m[i][j] * scalar;
            }
        }
        return out;
    }

    @Override
    public double[] vectorMultiply(double[][] m, double[] v) {
        if (m[0].length != v.length) {
            throw new IllegalArgumentException("Cannot multiply " + m.length + "x" + m[0].length + " matrix by vector of length " + v.length);
        }
        double[] x = new double[m.length];
        for (int i = 0; i < m.length; i++) {
            double sum = 0;
            for (int j = 0; j < v.length; j++) {
                sum += m[i][j] * v[j];
            }
            x[i] = sum;
        }
        return x;
    }

    @Override
    public double dot(double[] a, double[] b) {
        if (a.length != b.length) {
            throw new IllegalArgumentException("Vector lengths differ: " + a.length + " vs " + b.length);
        }
        double sum = 0;
        for (int i = 0; i < a.length; i++) sum += a[i] * b[i];
        return sum;
    }

    private static void requireSquare(double[][] m, int size) {
        if (m.length != size) {
            throw new IllegalArgumentException("Expected " + size + "x" + size + " matrix, got " + m.length + " rows");
        }
        for (double[] row : m) {
            if (row.length != size) {
                throw new IllegalArgumentException("Expected " + size + "x" + size + " matrix, got a row of length " + row.length);
            }
        }
    }
}
