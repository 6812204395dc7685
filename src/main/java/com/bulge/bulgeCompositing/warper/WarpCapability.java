package com.bulge.bulgeCompositing.warper;

import org.bytedeco.javacpp.Loader;
import org.bytedeco.opencv.global.opencv_imgproc;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

/**
 * Probes once whether the OpenCV natives used for remapping can be linked on this machine.
 */
public final class WarpCapability {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    private static final boolean AVAILABLE = probe();

    private WarpCapability() {
    }

    public static boolean isAvailable() {
        return AVAILABLE;
    }

    private static boolean probe() {
        try {
            Loader.load(opencv_imgproc.class);
            return true;
        } catch (LinkageError e) {
            LOG.warn("OpenCV natives unavailable, spherical warp degrades to identity: {}", e.toString());
            return false;
        }
    }
}
