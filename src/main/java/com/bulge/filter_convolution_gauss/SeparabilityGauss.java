package com.bulge.filter_convolution_gauss;

import com.bulge.imageOperator.Raster;

public class SeparabilityGauss {

    /**
     * Normalized 1D Gaussian kernel.
     *
     * @param size  kernel length (odd)
     * @param sigma standard deviation
     */
    static float[] create1DGaussianKernel(int size, float sigma) {
        int radius = size / 2;
        float[] kernel = new float[size];
        float sum = 0;
        for (int i = 0; i < size; i++) {
            int d = i - radius;
            float value = (float) (Math.exp(-(d * d) / (2 * sigma * sigma)) / (Math.sqrt(2 * Math.PI) * sigma));
            kernel[i] = value;
            sum += value;
        }
        for (int i = 0; i < size; i++) kernel[i] /= sum;
        return kernel;
    }

    /**
     * Mirror an out-of-range index back into [0, n), edge pixel repeated (…cba|abc…|cba…).
     */
    static int reflect(int i, int n) {
        if (n == 1) return 0;
        while (i < 0 || i >= n) {
            if (i < 0) i = -i - 1;
            if (i >= n) i = 2 * n - i - 1;
        }
        return i;
    }

    /**
     * Separable Gaussian blur of a single-channel raster, kernel radius ceil(3 sigma).
     *
     * @param image gray raster
     * @param sigma standard deviation in pixels
     * @return blurred raster, same size
     */
    public static Raster separabilityGaussianFilter(Raster image, double sigma) {
        if (image.getChannels() != 1) {
            throw new IllegalArgumentException("Expected single-channel raster, got " + image);
        }
        int radius = (int) Math.ceil(3 * sigma);
        int size = 2 * radius + 1;
        int width = image.getWidth();
        int height = image.getHeight();
        byte[] src = image.getData();

        float[] kernel = create1DGaussianKernel(size, (float) sigma);
        float[] temp = new float[width * height];
        byte[] out = new byte[width * height];

        // horizontal pass
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                float sum = 0;
                for (int k = 0; k < kernel.length; k++) {
                    int pixelX = reflect(x + k - radius, width);
                    sum += (src[y * width + pixelX] & 0xFF) * kernel[k];
                }
                temp[y * width + x] = sum;
            }
        }

        // vertical pass
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                float sum = 0;
                for (int k = 0; k < kernel.length; k++) {
                    int pixelY = reflect(y + k - radius, height);
                    sum += temp[pixelY * width + x] * kernel[k];
                }
                out[y * width + x] = (byte) Math.min(Math.max(Math.round(sum), 0), 255);
            }
        }
        return new Raster(width, height, 1, out);
    }
}
