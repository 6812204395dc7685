package com.bulge.imageOperator;

import lombok.Getter;

import java.util.Arrays;

/**
 * 8-bit raster stored as a flat interleaved buffer, row stride = width * channels.
 * Channel order follows OpenCV: 1 = gray, 3 = BGR, 4 = BGRA.
 * The buffer is mutable; {@link #set} is for filling a raster before it is handed on.
 */
@Getter
public final class Raster {
    private final int width;
    private final int height;
    private final int channels;
    private final byte[] data;

    public Raster(int width, int height, int channels, byte[] data) {
        if (width < 1 || height < 1) {
            throw new IllegalArgumentException("Invalid raster size: " + width + "x" + height);
        }
        if (channels != 1 && channels != 3 && channels != 4) {
            throw new IllegalArgumentException("Unsupported channel count: " + channels);
        }
        if (data.length != width * height * channels) {
            throw new IllegalArgumentException("Buffer length " + data.length + " != "
                    + width + "x" + height + "x" + channels);
        }
        this.width = width;
        this.height = height;
        this.channels = channels;
        this.data = data;
    }

    public static Raster blank(int width, int height, int channels) {
        return new Raster(width, height, channels, new byte[width * height * channels]);
    }

    /**
     * Raster with every pixel set to the given channel values.
     */
    public static Raster filled(int width, int height, int... pixel) {
        Raster r = blank(width, height, pixel.length);
        for (int i = 0; i < width * height; i++) {
            for (int c = 0; c < pixel.length; c++) {
                r.data[i * pixel.length + c] = (byte) pixel[c];
            }
        }
        return r;
    }

    public boolean sameSize(Raster other) {
        return width == other.width && height == other.height;
    }

    /** Unsigned channel value. */
    public int get(int x, int y, int c) {
        return data[(y * width + x) * channels + c] & 0xFF;
    }

    public void set(int x, int y, int c, int value) {
        data[(y * width + x) * channels + c] = (byte) value;
    }

    public Raster copy() {
        return new Raster(width, height, channels, data.clone());
    }

    /**
     * Expands to BGRA. Missing alpha becomes 255, gray is replicated to B, G and R.
     */
    public Raster toBgra() {
        if (channels == 4) {
            return copy();
        }
        byte[] out = new byte[width * height * 4];
        for (int i = 0; i < width * height; i++) {
            if (channels == 1) {
                byte g = data[i];
                out[i * 4] = g;
                out[i * 4 + 1] = g;
                out[i * 4 + 2] = g;
            } else {
                out[i * 4] = data[i * 3];
                out[i * 4 + 1] = data[i * 3 + 1];
                out[i * 4 + 2] = data[i * 3 + 2];
            }
            out[i * 4 + 3] = (byte) 255;
        }
        return new Raster(width, height, 4, out);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Raster)) return false;
        Raster other = (Raster) o;
        return width == other.width && height == other.height
                && channels == other.channels && Arrays.equals(data, other.data);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * (31 * width + height) + channels) + Arrays.hashCode(data);
    }

    @Override
    public String toString() {
        return "Raster[" + width + "x" + height + "x" + channels + "]";
    }
}
