package com.bulge.bulgeCompositing.boundingBox;

import com.bulge.bulgeCompositing.exception.MissingInputException;
import com.bulge.bulgeCompositing.exception.NoSubjectFoundException;
import com.bulge.bulgeCompositing.exception.Stage;
import com.bulge.imageOperator.ColourImageToGray;
import com.bulge.imageOperator.Raster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.nio.file.Path;
import java.util.Optional;

/**
 * Picks the region of interest: an explicit box when one parses, otherwise the bound of every
 * reference pixel whose intensity reaches the threshold.
 */
public class BoundingBoxResolver {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final int DEFAULT_THRESHOLD = 10;

    public static BoundingBox resolve(String explicitSource, Raster reference) {
        return resolve(explicitSource, reference, DEFAULT_THRESHOLD);
    }

    public static BoundingBox resolve(String explicitSource, Raster reference, int threshold) {
        return resolve(BoxFileParser.parse(explicitSource), reference, threshold);
    }

    public static BoundingBox resolve(Path boxFile, Raster reference, int threshold) {
        return resolve(BoxFileParser.read(boxFile), reference, threshold);
    }

    public static BoundingBox resolve(Optional<BoundingBox> explicit, Raster reference, int threshold) {
        if (explicit.isPresent()) {
            LOG.info("Using explicit bounding box {}", explicit.get());
            return explicit.get();
        }
        if (reference == null) {
            throw new MissingInputException(Stage.RESOLVE, "no explicit box and no reference raster to scan");
        }
        BoundingBox box = detect(reference, threshold);
        LOG.info("Detected bounding box {} (threshold {})", box, threshold);
        return box;
    }

    /**
     * Inclusive bound of all pixels with intensity >= threshold.
     */
    public static BoundingBox detect(Raster reference, int threshold) {
        Raster gray = ColourImageToGray.toGray(reference);
        int w = gray.getWidth();
        int h = gray.getHeight();
        byte[] data = gray.getData();
        int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE;
        int maxX = -1, maxY = -1;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if ((data[y * w + x] & 0xFF) >= threshold) {
                    if (x < minX) minX = x;
                    if (x > maxX) maxX = x;
                    if (y < minY) minY = y;
                    if (y > maxY) maxY = y;
                }
            }
        }
        if (maxX < 0) {
            throw new NoSubjectFoundException(threshold);
        }
        return new BoundingBox(minX, minY, maxX, maxY);
    }
}
