package com.bulge.bulgeCompositing.blender;

import com.bulge.bulgeCompositing.mask.AlphaMask;
import com.bulge.imageOperator.Raster;
import lombok.Getter;

/**
 * One paint-over step: raster, optional mask of the same size, placement offset.
 */
@Getter
public final class Layer {
    private final Raster raster;
    private final AlphaMask mask;
    private final int offsetX;
    private final int offsetY;

    public Layer(Raster raster, AlphaMask mask, int offsetX, int offsetY) {
        if (mask != null && (mask.getWidth() != raster.getWidth() || mask.getHeight() != raster.getHeight())) {
            throw new IllegalArgumentException("Mask " + mask.getWidth() + "x" + mask.getHeight()
                    + " does not match layer " + raster);
        }
        this.raster = raster;
        this.mask = mask;
        this.offsetX = offsetX;
        this.offsetY = offsetY;
    }

    public Layer(Raster raster, AlphaMask mask) {
        this(raster, mask, 0, 0);
    }

    public Layer(Raster raster) {
        this(raster, null, 0, 0);
    }
}
