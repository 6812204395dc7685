package com.bulge.imageOperator;

import com.bulge.bulgeCompositing.exception.MissingInputException;
import com.bulge.bulgeCompositing.exception.PipelineException;
import com.bulge.bulgeCompositing.exception.Stage;
import com.bulge.bulgeCompositing.warper.WarpCapability;
import com.bulge.osDirectoriesCreate.CreateFolderOrFile;
import org.bytedeco.opencv.opencv_core.Mat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.lang.invoke.MethodHandles;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.bytedeco.opencv.global.opencv_core.CV_16U;
import static org.bytedeco.opencv.global.opencv_core.CV_8U;
import static org.bytedeco.opencv.global.opencv_imgcodecs.IMREAD_UNCHANGED;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imread;
import static org.bytedeco.opencv.global.opencv_imgcodecs.imwrite;

/**
 * Image file codec backed by OpenCV imgcodecs.
 */
public class RasterIO {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static Raster read(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new MissingInputException(Stage.DECODE, "image not found: " + path);
        }
        requireCodec(WarpCapability.isAvailable(), Stage.DECODE);
        Mat raw = imread(path.toAbsolutePath().toString(), IMREAD_UNCHANGED);
        Mat eight = raw;
        try {
            if (raw.empty()) {
                throw new MissingInputException(Stage.DECODE, "cannot decode image: " + path);
            }
            if (raw.depth() != CV_8U) {
                // 16-bit PNG/TIFF
                double scale = raw.depth() == CV_16U ? 1.0 / 257.0 : 1.0;
                eight = new Mat();
                raw.convertTo(eight, CV_8U, scale, 0.0);
            }
            Raster raster = RasterMats.fromMat(eight);
            LOG.debug("Read {} as {}", path, raster);
            return raster;
        } finally {
            if (eight != raw) eight.release();
            raw.release();
        }
    }

    /**
     * Encodes by file extension. PNG keeps 3- and 4-channel rasters lossless.
     */
    public static void write(Path path, Raster raster) {
        requireCodec(WarpCapability.isAvailable(), Stage.ENCODE);
        Path parent = path.toAbsolutePath().getParent();
        try {
            if (parent != null) {
                CreateFolderOrFile.createFolder(parent);
            }
        } catch (IOException e) {
            throw new PipelineException(Stage.ENCODE, "cannot create directory " + parent, e);
        }
        Mat mat = RasterMats.toMat(raster);
        try {
            if (!imwrite(path.toAbsolutePath().toString(), mat)) {
                throw new PipelineException(Stage.ENCODE, "imwrite failed for " + path);
            }
            LOG.debug("Wrote {} to {}", raster, path);
        } catch (RuntimeException e) {
            if (e instanceof PipelineException) throw e;
            throw new PipelineException(Stage.ENCODE, "cannot encode " + path, e);
        } finally {
            mat.release();
        }
    }

    /**
     * imread/imwrite link against the same natives as the warp, so there is no identity fallback here.
     */
    static void requireCodec(boolean available, Stage stage) {
        if (!available) {
            throw new PipelineException(stage, "image codec unavailable: OpenCV natives failed to load");
        }
    }
}
