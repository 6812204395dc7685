package com.bulge.bulgeCompositing.mask;

import com.bulge.imageOperator.Raster;
import lombok.Getter;

/**
 * Single-channel opacity, 0 = transparent, 255 = opaque.
 */
@Getter
public final class AlphaMask {
    private final Raster raster;

    public AlphaMask(Raster raster) {
        if (raster.getChannels() != 1) {
            throw new IllegalArgumentException("Alpha mask must be single-channel, got " + raster);
        }
        this.raster = raster;
    }

    public static AlphaMask uniform(int width, int height, int value) {
        return new AlphaMask(Raster.filled(width, height, value));
    }

    public int getWidth() {
        return raster.getWidth();
    }

    public int getHeight() {
        return raster.getHeight();
    }

    public int get(int x, int y) {
        return raster.get(x, y, 0);
    }

    /** Opacity in [0,1]. */
    public double alpha(int x, int y) {
        return get(x, y) / 255.0;
    }
}
