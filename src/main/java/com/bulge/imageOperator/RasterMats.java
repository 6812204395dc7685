package com.bulge.imageOperator;

import org.bytedeco.opencv.opencv_core.Mat;

import static org.bytedeco.opencv.global.opencv_core.CV_8U;
import static org.bytedeco.opencv.global.opencv_core.CV_8UC;

/**
 * Copies between {@link Raster} buffers and OpenCV {@link Mat}s. Callers own the returned Mat.
 */
public class RasterMats {

    public static Mat toMat(Raster raster) {
        Mat mat = new Mat(raster.getHeight(), raster.getWidth(), CV_8UC(raster.getChannels()));
        mat.data().put(raster.getData());
        return mat;
    }

    public static Raster fromMat(Mat mat) {
        if (mat.depth() != CV_8U) {
            throw new IllegalArgumentException("Expected 8-bit Mat, got depth " + mat.depth());
        }
        Mat continuous = mat.isContinuous() ? mat : mat.clone();
        try {
            byte[] buf = new byte[continuous.cols() * continuous.rows() * continuous.channels()];
            continuous.data().get(buf);
            return new Raster(continuous.cols(), continuous.rows(), continuous.channels(), buf);
        } finally {
            if (continuous != mat) continuous.release();
        }
    }
}
