package com.keypoints.imageOperation;

/**
 * Single channel image, row-major: {@code data[y][x]}.
 * Written once per cell by the stage that produces it, read-only afterwards.
 */
public class FloatImage {
    public final float[][] data;

    public FloatImage(float[][] data) {
        if (data == null || data.length == 0 || data[0].length == 0) {
            throw new IllegalArgumentException("Image must have at least one row and one column");
        }
        int columns = data[0].length;
        for (float[] row : data) {
            if (row.length != columns) {
                throw new IllegalArgumentException("Image rows must all have " + columns + " columns");
            }
        }
        this.data = data;
    }

    public static FloatImage blank(int rows, int columns) {
        if (rows <= 0 || columns <= 0) {
            throw new IllegalArgumentException("Image dimensions must be positive, got " + rows + "x" + columns);
        }
        return new FloatImage(new float[rows][columns]);
    }

    public static FloatImage fromDoubles(double[][] values) {
        float[][] data = new float[values.length][];
        for (int y = 0; y < values.length; y++) {
            data[y] = new float[values[y].length];
            for (int x = 0; x < values[y].length; x++) {
                data[y][x] = (float) values[y][x];
            }
        }
        return new FloatImage(data);
    }

    public int rows() {
        return data.length;
    }

    public int columns() {
        return data[0].length;
    }

    public float get(int y, int x) {
        return data[y][x];
    }

    public void set(int y, int x, float value) {
        data[y][x] = value;
    }

    public boolean sameDimensions(FloatImage other) {
        return rows() == other.rows() && columns() == other.columns();
    }

    public FloatImage copy() {
        float[][] copy = new float[rows()][];
        for (int y = 0; y < rows(); y++) {
            copy[y] = data[y].clone();
        }
        return new FloatImage(copy);
    }

    @Override
    public String toString() {
        return "FloatImage[" + rows() + "x" + columns() + "]";
    }
}
