package com.bulge.bulgeCompositing;

import com.bulge.imageOperator.Raster;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * Source image to bulge, and whether it is blended through the subject mask.
 */
@Getter
@AllArgsConstructor
public class LayerSpec {
    private final Raster raster;
    private final boolean useSharedMask;

    public static LayerSpec masked(Raster raster) {
        return new LayerSpec(raster, true);
    }

    public static LayerSpec unmasked(Raster raster) {
        return new LayerSpec(raster, false);
    }
}
