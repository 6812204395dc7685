package com.bulge.bulgeCompositing.warper;

import com.bulge.bulgeCompositing.boundingBox.BoundingBox;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class WarpFieldTest {

    private static final BoundingBox BOX = new BoundingBox(10, 10, 90, 90);

    private static boolean insideEllipse(BoundingBox box, int x, int y) {
        double dx = (x - box.centerX()) / box.radiusX();
        double dy = (y - box.centerY()) / box.radiusY();
        return dx * dx + dy * dy <= 1.0;
    }

    @Test
    public void sphericalFactor() {
        assertEquals(1.0, WarpField.fullSphericalFactor(0.0));
        assertEquals(1.0, WarpField.fullSphericalFactor(1.0), 1e-12);
        assertEquals(2.0 / Math.PI, WarpField.fullSphericalFactor(1e-9), 1e-6);
        assertEquals(Math.asin(0.5) / (0.5 * Math.PI / 2), WarpField.fullSphericalFactor(0.5), 1e-12);
    }

    @Test
    public void zeroStrengthIsIdentity() {
        WarpField field = WarpField.bulge(100, 100, BOX, 0.0);
        for (int y = 0; y < 100; y++)
            for (int x = 0; x < 100; x++) {
                assertEquals(x, field.srcX(x, y));
                assertEquals(y, field.srcY(x, y));
            }
    }

    @Test
    public void identityOutsideEllipse() {
        for (double s : new double[]{0.3, 0.7, 1.0}) {
            WarpField field = WarpField.bulge(100, 100, BOX, s);
            for (int y = 0; y < 100; y++)
                for (int x = 0; x < 100; x++) {
                    if (!insideEllipse(BOX, x, y)) {
                        assertEquals(x, field.srcX(x, y));
                        assertEquals(y, field.srcY(x, y));
                    }
                }
        }
    }

    @Test
    public void centerMapsToItself() {
        BoundingBox[] boxes = {BOX, new BoundingBox(0, 4, 20, 60), new BoundingBox(30, 30, 32, 36),
                new BoundingBox(10, 10, 91, 91), new BoundingBox(0, 0, 5, 7), new BoundingBox(-3, 2, 8, 13)};
        for (BoundingBox box : boxes) {
            for (double s : new double[]{0.0, 0.5, 1.0}) {
                WarpField field = WarpField.bulge(100, 100, box, s);
                int cx = (int) box.centerX(), cy = (int) box.centerY();
                assertEquals(cx, field.srcX(cx, cy));
                assertEquals(cy, field.srcY(cx, cy));
            }
        }
    }

    @Test
    public void oddExtentCenterIsRoundedDownToAPixel() {
        BoundingBox box = new BoundingBox(10, 10, 91, 91);
        assertEquals(50.0, box.centerX());
        assertEquals(50.0, box.centerY());
        WarpField field = WarpField.bulge(100, 100, box, 1.0);
        assertEquals(50f, field.srcX(50, 50));
        assertEquals(50f, field.srcY(50, 50));

        BoundingBox small = new BoundingBox(0, 0, 5, 7);
        assertEquals(2.0, small.centerX());
        assertEquals(3.0, small.centerY());
        assertEquals(-1.0, new BoundingBox(-3, 2, 0, 13).centerX());
    }

    @Test
    public void fullStrengthPullsSamplesTowardsCenter() {
        WarpField field = WarpField.bulge(100, 100, BOX, 1.0);
        // d = 0.25 on the horizontal axis
        float src = field.srcX(60, 50);
        double expected = 50 + 10 * WarpField.fullSphericalFactor(0.25);
        assertEquals(expected, src, 1e-4);
        assertTrue(src < 60);
        assertEquals(50f, field.srcY(60, 50));
    }

    @Test
    public void strengthInterpolatesDistortion() {
        double full = WarpField.bulge(100, 100, BOX, 1.0).srcX(70, 50) - 50;
        double half = WarpField.bulge(100, 100, BOX, 0.5).srcX(70, 50) - 50;
        assertEquals((20 + full) / 2, half, 1e-4);
    }

    @Test
    public void sourceCoordinatesAreClampedToRaster() {
        // box larger than the raster
        WarpField field = WarpField.bulge(20, 10, new BoundingBox(-50, -50, 70, 60), 1.0);
        for (float v : field.getMapX()) assertTrue(v >= 0 && v <= 19);
        for (float v : field.getMapY()) assertTrue(v >= 0 && v <= 9);
    }

    @Test
    public void rejectsStrengthOutsideUnitInterval() {
        assertThrows(IllegalArgumentException.class, () -> WarpField.bulge(10, 10, BOX, -0.1));
        assertThrows(IllegalArgumentException.class, () -> WarpField.bulge(10, 10, BOX, 1.5));
        assertThrows(IllegalArgumentException.class, () -> WarpField.bulge(10, 10, BOX, Double.NaN));
    }
}
