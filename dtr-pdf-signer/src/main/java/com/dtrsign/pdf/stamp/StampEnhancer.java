package com.dtrsign.pdf.stamp;

import java.awt.image.BufferedImage;

/**
 * Sharpness and contrast boost for scanned signature images. Only colour channels are touched; alpha is copied.
 * <p>
 * Sharpness blends the image with a 3x3 smoothed copy (kernel {@code [1 1 1; 1 5 1; 1 1 1] / 13});
 * contrast blends with a flat grey at the image's mean luminance. A factor of 1 leaves the channel unchanged.
 */
public final class StampEnhancer {

    public static final float DEFAULT_SHARPNESS = 1.5f;
    public static final float DEFAULT_CONTRAST = 1.4f;

    public static final StampEnhancer IDENTITY = new StampEnhancer(1f, 1f);

    private final float sharpness;
    private final float contrast;

    public StampEnhancer(float sharpness, float contrast) {
        if (sharpness < 0f || contrast < 0f) {
            throw new IllegalArgumentException("Enhancement factors must not be negative");
        }
        this.sharpness = sharpness;
        this.contrast = contrast;
    }

    public static StampEnhancer defaults() {
        return new StampEnhancer(DEFAULT_SHARPNESS, DEFAULT_CONTRAST);
    }

    public boolean isIdentity() {
        return sharpness == 1f && contrast == 1f;
    }

    /**
     * Returns an enhanced ARGB copy of {@code argb}.
     */
    public BufferedImage apply(BufferedImage argb) {
        int w = argb.getWidth();
        int h = argb.getHeight();
        int[] pixels = argb.getRGB(0, 0, w, h, null, 0, w);
        if (sharpness != 1f) {
            pixels = sharpen(pixels, w, h);
        }
        if (contrast != 1f) {
            pixels = adjustContrast(pixels);
        }
        BufferedImage out = new BufferedImage(w, h, BufferedImage.TYPE_INT_ARGB);
        out.setRGB(0, 0, w, h, pixels, 0, w);
        return out;
    }

    private int[] sharpen(int[] src, int w, int h) {
        int[] out = src.clone();
        if (w < 3 || h < 3) {
            return out;
        }
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                int center = src[y * w + x];
                int r = 0;
                int g = 0;
                int b = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    for (int dx = -1; dx <= 1; dx++) {
                        int p = src[(y + dy) * w + (x + dx)];
                        int weight = dx == 0 && dy == 0 ? 5 : 1;
                        r += weight * ((p >> 16) & 0xFF);
                        g += weight * ((p >> 8) & 0xFF);
                        b += weight * (p & 0xFF);
                    }
                }
                out[y * w + x] = (center & 0xFF000000)
                        | blend(r / 13f, (center >> 16) & 0xFF, sharpness) << 16
                        | blend(g / 13f, (center >> 8) & 0xFF, sharpness) << 8
                        | blend(b / 13f, center & 0xFF, sharpness);
            }
        }
        return out;
    }

    private int[] adjustContrast(int[] src) {
        if (src.length == 0) {
            return src;
        }
        double sum = 0;
        for (int p : src) {
            sum += luminance(p);
        }
        float mean = (int) (sum / src.length + 0.5);
        int[] out = new int[src.length];
        for (int i = 0; i < src.length; i++) {
            int p = src[i];
            out[i] = (p & 0xFF000000)
                    | blend(mean, (p >> 16) & 0xFF, contrast) << 16
                    | blend(mean, (p >> 8) & 0xFF, contrast) << 8
                    | blend(mean, p & 0xFF, contrast);
        }
        return out;
    }

    private static int luminance(int p) {
        return (((p >> 16) & 0xFF) * 299 + ((p >> 8) & 0xFF) * 587 + (p & 0xFF) * 114) / 1000;
    }

    private static int blend(float degenerate, int value, float factor) {
        int v = Math.round(degenerate + factor * (value - degenerate));
        return Math.max(0, Math.min(255, v));
    }
}
