package com.bulge.imageOperator;

public class ColourImageToGray {

    /**
     * Intensity of one pixel: 0.299 R + 0.587 G + 0.114 B, alpha ignored.
     */
    public static int intensity(Raster raster, int x, int y) {
        if (raster.getChannels() == 1) {
            return raster.get(x, y, 0);
        }
        // BGR order
        double gray = 0.299 * raster.get(x, y, 2) + 0.587 * raster.get(x, y, 1)
                + 0.114 * raster.get(x, y, 0);
        return Math.max(0, Math.min(255, (int) Math.round(gray)));
    }

    /**
     * Converts a raster to single-channel intensity. A gray raster is copied.
     */
    public static Raster toGray(Raster raster) {
        if (raster.getChannels() == 1) {
            return raster.copy();
        }
        int w = raster.getWidth();
        int h = raster.getHeight();
        byte[] out = new byte[w * h];
        for (int y = 0; y < h; y++)
            for (int x = 0; x < w; x++) {
                out[y * w + x] = (byte) intensity(raster, x, y);
            }
        return new Raster(w, h, 1, out);
    }
}
