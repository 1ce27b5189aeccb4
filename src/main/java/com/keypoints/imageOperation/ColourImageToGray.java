package com.keypoints.imageOperation;

import org.bytedeco.javacpp.indexer.FloatIndexer;
import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC1;
import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_COLOR;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imdecode;
import static org.bytedeco.opencv.global.opencv_imgproc.COLOR_BGR2GRAY;
import static org.bytedeco.opencv.global.opencv_imgproc.cvtColor;

/**
 * Decodes an encoded image (PNG, JPEG, ...) into a grayscale {@link FloatImage} in [0, 1].
 * Gray = 0.299 R + 0.587 G + 0.114 B, then divided by 255.
 */
public class ColourImageToGray {

    public FloatImage decode(byte[] encoded) {
        if (encoded == null || encoded.length == 0) {
            throw new IllegalArgumentException("Image content is empty");
        }
        Mat buffer = new Mat(1, encoded.length, CV_8UC1);
        Mat colour = null;
        Mat gray = new Mat();
        Mat grayFloat = new Mat();
        try {
            buffer.data().put(encoded);
            colour = imdecode(buffer, IMREAD_COLOR);
            if (colour == null || colour.empty()) {
                throw new IllegalArgumentException("Content could not be decoded as an image");
            }
            cvtColor(colour, gray, COLOR_BGR2GRAY);
            gray.convertTo(grayFloat, CV_32F, 1.0 / 255.0, 0.0);
            return toFloatImage(grayFloat);
        } finally {
            buffer.release();
            if (colour != null) colour.release();
            gray.release();
            grayFloat.release();
        }
    }

    private static FloatImage toFloatImage(Mat grayFloat) {
        int rows = grayFloat.rows();
        int cols = grayFloat.cols();
        float[][] data = new float[rows][cols];
        FloatIndexer idx = grayFloat.createIndexer();
        try {
            for (int y = 0; y < rows; y++) {
                for (int x = 0; x < cols; x++) {
                    data[y][x] = idx.get(y, x);
                }
            }
        } finally {
            idx.release();
        }
        return new FloatImage(data);
    }
}
