package com.bulge.bulgeCompositing.mask;

import com.bulge.filter_convolution_gauss.SeparabilityGauss;
import com.bulge.imageOperator.ColourImageToGray;
import com.bulge.imageOperator.Raster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;

/**
 * Turns the warped reference into an opacity mask. The warp has already spread the hard
 * silhouette into a gradient, so the intensity is used as-is.
 */
public class AlphaMaskBuilder {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    public static final double SMOOTH_SIGMA = 0.5;

    public static AlphaMask buildMask(Raster warpedReference, boolean smooth) {
        Raster gray = ColourImageToGray.toGray(warpedReference);
        if (smooth) {
            gray = SeparabilityGauss.separabilityGaussianFilter(gray, SMOOTH_SIGMA);
        }
        LOG.debug("Built {}x{} mask (smooth={})", gray.getWidth(), gray.getHeight(), smooth);
        return new AlphaMask(gray);
    }
}
