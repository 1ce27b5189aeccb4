package com.keypoints.filter_convolution_gauss;

import com.keypoints.imageOperation.ChunkBoundary;
import com.keypoints.imageOperation.FloatImage;

public final class SeparabilityGauss {

    private SeparabilityGauss() {
    }

    /**
     * Kernel radius covering 3 standard deviations, so the kernel size is 2 * round(3 sigma) + 1.
     */
    public static int kernelRadius(double sigma) {
        return (int) Math.round(3 * sigma);
    }

    /**
     * Tạo một hạt nhân Gaussian 1D.
     * @param sigma Độ lệch chuẩn.
     * @return Hạt nhân Gaussian 1D đã được chuẩn hóa (tổng bằng 1).
     */
    public static double[] create1DGaussianKernel(double sigma) {
        if (!(sigma > 0)) {
            throw new IllegalArgumentException("Gaussian sigma must be positive, got " + sigma);
        }
        int radius = kernelRadius(sigma);
        int size = 2 * radius + 1;
        double[] kernel = new double[size];
        double sum = 0;
        for (int i = 0; i < size; i++) {
            int d = i - radius;
            double value = Math.exp(-(d * d) / (2 * sigma * sigma));
            kernel[i] = value;
            sum += value;
        }
        for (int i = 0; i < size; i++) kernel[i] /= sum;
        return kernel;
    }

    /**
     * Blurs one tile of {@code input} into the same region of {@code output}.
     * Samples outside the image are clamped to the nearest edge pixel.
     * Each output pixel depends only on the input, so any tiling gives the same image.
     */
    public static void blurChunk(FloatImage input, FloatImage output, double sigma, ChunkBoundary chunk) {
        if (!input.sameDimensions(output)) {
            throw new IllegalArgumentException("Output " + output + " does not match input " + input);
        }
        double[] kernel = create1DGaussianKernel(sigma);
        int radius = kernel.length / 2;
        int height = input.rows();
        int width = input.columns();
        int chunkWidth = chunk.width();
        int tempRows = chunk.height() + 2 * radius;
        double[][] tempImage = new double[tempRows][chunkWidth];

        // --- Lượt 1: Lọc theo chiều ngang ---
        for (int t = 0; t < tempRows; t++) {
            int pixelY = clamp(chunk.y1 - radius + t, height);
            float[] row = input.data[pixelY];
            for (int x = chunk.x1; x < chunk.x2; x++) {
                double sum = 0;
                for (int k = 0; k < kernel.length; k++) {
                    int pixelX = clamp(x + k - radius, width);
                    sum += row[pixelX] * kernel[k];
                }
                tempImage[t][x - chunk.x1] = sum;
            }
        }

        // Lượt 2: Lọc theo chiều dọc
        for (int y = chunk.y1; y < chunk.y2; y++) {
            int t0 = y - chunk.y1;
            for (int x = 0; x < chunkWidth; x++) {
                double sum = 0;
                for (int k = 0; k < kernel.length; k++) {
                    sum += tempImage[t0 + k][x] * kernel[k];
                }
                output.data[y][chunk.x1 + x] = (float) sum;
            }
        }
    }

    /** Whole-image blur, single tile. */
    public static FloatImage seperabilityGauss(FloatImage input, double sigma) {
        FloatImage output = FloatImage.blank(input.rows(), input.columns());
        blurChunk(input, output, sigma, new ChunkBoundary(0, 0, input.columns(), input.rows()));
        return output;
    }

    private static int clamp(int index, int size) {
        if (index < 0) return 0;
        if (index >= size) return size - 1;
        return index;
    }
}
