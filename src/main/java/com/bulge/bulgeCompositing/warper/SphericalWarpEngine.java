package com.bulge.bulgeCompositing.warper;

import com.bulge.bulgeCompositing.boundingBox.BoundingBox;
import com.bulge.imageOperator.Raster;
import com.bulge.imageOperator.RasterMats;
import org.bytedeco.javacpp.FloatPointer;
import org.bytedeco.opencv.opencv_core.Mat;
import org.bytedeco.opencv.opencv_core.Scalar;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

import static org.bytedeco.opencv.global.opencv_core.BORDER_REFLECT;
import static org.bytedeco.opencv.global.opencv_core.CV_32F;
import static org.bytedeco.opencv.global.opencv_imgproc.INTER_LINEAR;
import static org.bytedeco.opencv.global.opencv_imgproc.remap;

/**
 * Elliptical bulge warp. Source coordinates come from {@link WarpField}; resampling is bilinear
 * through OpenCV {@code remap} with mirrored borders.
 */
public class SphericalWarpEngine {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private final boolean backendAvailable;

    public SphericalWarpEngine() {
        this(WarpCapability.isAvailable());
    }

    public SphericalWarpEngine(boolean backendAvailable) {
        this.backendAvailable = backendAvailable;
    }

    /** False when {@link #warp} returns its input unchanged. */
    public boolean isBackendAvailable() {
        return backendAvailable;
    }

    /**
     * Warp an image with the bulge inscribed in {@code box}.
     *
     * @param image    input raster
     * @param box      region of interest
     * @param strength 0 = identity, 1 = full spherical projection
     * @return warped raster, same size and channel count
     */
    public Raster warp(Raster image, BoundingBox box, double strength) {
        WarpField.checkStrength(strength);
        if (strength == 0.0) {
            return image.copy();
        }
        if (!backendAvailable) {
            LOG.debug("Warp backend missing, returning {} unchanged", image);
            return image.copy();
        }
        return remapThrough(image, WarpField.bulge(image.getWidth(), image.getHeight(), box, strength));
    }

    static Raster remapThrough(Raster image, WarpField field) {
        int w = image.getWidth();
        int h = image.getHeight();

        Mat src = RasterMats.toMat(image);
        Mat mapX = new Mat(h, w, CV_32F);
        Mat mapY = new Mat(h, w, CV_32F);
        Mat dst = new Mat();
        try {
            FloatPointer pX = new FloatPointer(mapX.data());
            FloatPointer pY = new FloatPointer(mapY.data());
            pX.put(field.getMapX());
            pY.put(field.getMapY());

            remap(src, dst, mapX, mapY, INTER_LINEAR, BORDER_REFLECT, new Scalar(0, 0, 0, 0));
            return RasterMats.fromMat(dst);
        } finally {
            src.release();
            mapX.release();
            mapY.release();
            dst.release();
        }
    }
}
