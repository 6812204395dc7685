package com.bulge.bulgeCompositing.blender;

import com.bulge.bulgeCompositing.mask.AlphaMask;
import com.bulge.imageOperator.Raster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.util.List;

/**
 * Paints layers over a background in the given order using straight-alpha "over".
 */
public class LayerCompositor {
    private static final Logger LOG = LoggerFactory.getLogger(MethodHandles.lookup().lookupClass());

    /**
     * @param background any raster, promoted to opaque BGRA when it lacks alpha
     * @param layers     painted first to last, later layers on top
     * @return flattened BGRA raster with the background's size
     */
    public static Raster composite(Raster background, List<Layer> layers) {
        Raster out = background.toBgra();
        for (int i = 0; i < layers.size(); i++) {
            paint(out, layers.get(i));
            LOG.debug("Painted layer {}/{}", i + 1, layers.size());
        }
        return out;
    }

    /**
     * Blends one layer into {@code out} in place. The result is rounded to 8 bits per layer,
     * so painting layers one call at a time gives the same bytes as one call with all of them.
     */
    static void paint(Raster out, Layer layer) {
        Raster src = layer.getRaster().toBgra();
        AlphaMask mask = layer.getMask();
        byte[] dst = out.getData();
        byte[] s = src.getData();
        int outW = out.getWidth();
        int outH = out.getHeight();

        for (int y = 0; y < src.getHeight(); y++) {
            int ty = y + layer.getOffsetY();
            if (ty < 0 || ty >= outH) continue;
            for (int x = 0; x < src.getWidth(); x++) {
                int tx = x + layer.getOffsetX();
                if (tx < 0 || tx >= outW) continue;

                int si = (y * src.getWidth() + x) * 4;
                int di = (ty * outW + tx) * 4;
                double a = (s[si + 3] & 0xFF) / 255.0;
                if (mask != null) {
                    a *= mask.alpha(x, y);
                }
                if (a <= 0.0) {
                    continue;
                }
                if (a >= 1.0) {
                    dst[di] = s[si];
                    dst[di + 1] = s[si + 1];
                    dst[di + 2] = s[si + 2];
                    dst[di + 3] = (byte) 255;
                    continue;
                }
                double dstA = (dst[di + 3] & 0xFF) / 255.0;
                double outA = a + dstA * (1.0 - a);
                for (int c = 0; c < 3; c++) {
                    double v = ((s[si + c] & 0xFF) * a + (dst[di + c] & 0xFF) * dstA * (1.0 - a)) / outA;
                    dst[di + c] = (byte) clamp(v);
                }
                dst[di + 3] = (byte) clamp(outA * 255.0);
            }
        }
    }

    private static int clamp(double v) {
        return Math.max(0, Math.min(255, (int) Math.round(v)));
    }
}
