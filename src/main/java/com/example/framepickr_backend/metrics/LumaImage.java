package com.example.framepickr_backend.metrics;

import com.example.framepickr_backend.detection.Region;

import java.awt.image.BufferedImage;
import java.util.Arrays;

/**
 * Single-channel 8-bit luma plane, row major. Immutable.
 */
public final class LumaImage {
    private final int width;
    private final int height;
    private final byte[] pixels;

    private LumaImage(int width, int height, byte[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    /** Wraps a copy of {@code pixels}; length must equal {@code width * height}. */
    public static LumaImage of(int width, int height, byte[] pixels) {
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("dimensions must be positive");
        }
        if (pixels == null || pixels.length != width * height) {
            throw new IllegalArgumentException("pixel buffer does not match " + width + "x" + height);
        }
        return new LumaImage(width, height, Arrays.copyOf(pixels, pixels.length));
    }

    /** BT.601 luma, the same weights OpenCV uses for BGR to gray. */
    public static LumaImage fromRgb(BufferedImage img) {
        int w = img.getWidth(), h = img.getHeight();
        int[] argb = img.getRGB(0, 0, w, h, null, 0, w);
        byte[] out = new byte[w * h];
        for (int i = 0; i < argb.length; i++) {
            out[i] = (byte) luminance(argb[i]);
        }
        return new LumaImage(w, h, out);
    }

    static int luminance(int argb) {
        int r = (argb >> 16) & 0xFF, g = (argb >> 8) & 0xFF, b = argb & 0xFF;
        int y = (int) Math.round(0.299 * r + 0.587 * g + 0.114 * b);
        return Math.min(255, Math.max(0, y));
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public int at(int x, int y) {
        return pixels[y * width + x] & 0xFF;
    }

    /** Copy of the raw plane, suitable for handing to native code. */
    public byte[] pixels() {
        return Arrays.copyOf(pixels, pixels.length);
    }

    /**
     * Copies the part of {@code region} that lies inside this image.
     *
     * @return the cropped plane, or {@code null} when the region does not overlap the image.
     */
    public LumaImage crop(Region region) {
        int x0 = Math.max(0, region.x());
        int y0 = Math.max(0, region.y());
        int x1 = Math.min(width, region.x() + region.width());
        int y1 = Math.min(height, region.y() + region.height());
        if (x1 <= x0 || y1 <= y0) {
            return null;
        }
        int cw = x1 - x0, ch = y1 - y0;
        byte[] out = new byte[cw * ch];
        for (int y = 0; y < ch; y++) {
            System.arraycopy(pixels, (y0 + y) * width + x0, out, y * cw, cw);
        }
        return new LumaImage(cw, ch, out);
    }

    public double mean() {
        long sum = 0;
        for (byte p : pixels) {
            sum += p & 0xFF;
        }
        return sum / (double) pixels.length;
    }

    /**
     * Variance of the 4-neighbour Laplacian over every pixel, borders mirrored (reflect-101).
     * Zero for flat images; grows with fine detail.
     */
    public double laplacianVariance() {
        double sum = 0, sum2 = 0;
        for (int y = 0; y < height; y++) {
            int up = reflect(y - 1, height), down = reflect(y + 1, height);
            for (int x = 0; x < width; x++) {
                int left = reflect(x - 1, width), right = reflect(x + 1, width);
                double lap = at(x, up) + at(x, down) + at(left, y) + at(right, y) - 4.0 * at(x, y);
                sum += lap;
                sum2 += lap * lap;
            }
        }
        double n = (double) width * height;
        double mean = sum / n;
        return Math.max(0.0, sum2 / n - mean * mean);
    }

    private static int reflect(int i, int size) {
        if (size == 1) {
            return 0;
        }
        if (i < 0) {
            return -i;
        }
        if (i >= size) {
            return 2 * size - i - 2;
        }
        return i;
    }
}
