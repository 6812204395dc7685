package com.bulge.bulgeCompositing.warper;

import com.bulge.bulgeCompositing.boundingBox.BoundingBox;
import lombok.Getter;

/**
 * Inverse map (dst -> src) of the elliptical bulge, stored row-major as two flat float arrays.
 * Outside the ellipse inscribed in the box the map is the identity.
 */
@Getter
public final class WarpField {
    private final int width;
    private final int height;
    private final float[] mapX;
    private final float[] mapY;

    private WarpField(int width, int height, float[] mapX, float[] mapY) {
        this.width = width;
        this.height = height;
        this.mapX = mapX;
        this.mapY = mapY;
    }

    /**
     * Spherical factor asin(d) / (d * pi/2), taken as 1 at the exact center.
     */
    public static double fullSphericalFactor(double d) {
        if (d == 0.0) return 1.0;
        return Math.asin(Math.min(d, 1.0)) / (d * Math.PI / 2.0);
    }

    public static void checkStrength(double strength) {
        if (!(strength >= 0.0 && strength <= 1.0)) {
            throw new IllegalArgumentException("strength must be in [0,1], got " + strength);
        }
    }

    /**
     * @param strength 0 = identity, 1 = full spherical projection
     */
    public static WarpField bulge(int width, int height, BoundingBox box, double strength) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Invalid field size: " + width + "x" + height);
        }
        checkStrength(strength);
        double cx = box.centerX(), cy = box.centerY();
        double rx = box.radiusX(), ry = box.radiusY();

        float[] mapX = new float[width * height];
        float[] mapY = new float[width * height];

        for (int y = 0; y < height; y++) {
            double dy = (y - cy) / ry;
            for (int x = 0; x < width; x++) {
                int idx = y * width + x;
                double dx = (x - cx) / rx;
                double d2 = dx * dx + dy * dy;
                if (d2 > 1.0) {
                    mapX[idx] = x;
                    mapY[idx] = y;
                    continue;
                }
                double f = 1.0 + (fullSphericalFactor(Math.sqrt(d2)) - 1.0) * strength;
                // (x - cx) * f == dx * f * rx; exact at f == 1 and at the center
                double srcX = cx + (x - cx) * f;
                double srcY = cy + (y - cy) * f;
                mapX[idx] = (float) Math.max(0.0, Math.min(width - 1, srcX));
                mapY[idx] = (float) Math.max(0.0, Math.min(height - 1, srcY));
            }
        }
        return new WarpField(width, height, mapX, mapY);
    }

    public float srcX(int x, int y) {
        return mapX[y * width + x];
    }

    public float srcY(int x, int y) {
        return mapY[y * width + x];
    }
}
