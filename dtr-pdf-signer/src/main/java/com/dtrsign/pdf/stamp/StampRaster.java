package com.dtrsign.pdf.stamp;

/**
 * Encoded stamp pixels: RGB samples (raw for lossless Flate, or a JPEG stream) plus a lossless 8-bit alpha plane.
 */
public record StampRaster(int width, int height, Encoding encoding, byte[] colorData, byte[] alpha) {

    public enum Encoding {
        FLATE_RGB,
        JPEG
    }

    public boolean isLossless() {
        return encoding == Encoding.FLATE_RGB;
    }

    public boolean isOpaque() {
        for (byte a : alpha) {
            if (a != (byte) 0xFF) {
                return false;
            }
        }
        return true;
    }
}
