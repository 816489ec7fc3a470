package com.dtrsign.pdf.stamp;

import java.awt.image.BufferedImage;
import java.util.Objects;

/**
 * Where and how a signature image is stamped: 1-based page, target rectangle, scale factor in (0, 1],
 * image quality 0-100 and an optional whole-month repetition.
 */
public record StampSpec(BufferedImage image, int page, StampRect rect, double scaleFactor, int imageQuality,
                        RepetitionRule repetition) {

    public static final double DEFAULT_SCALE_FACTOR = 0.9;
    public static final int DEFAULT_IMAGE_QUALITY = 100;

    public StampSpec {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(rect, "rect");
        if (page < 1) {
            throw new IllegalArgumentException("page must be >= 1, got " + page);
        }
        if (!(scaleFactor > 0.0) || scaleFactor > 1.0) {
            throw new IllegalArgumentException("scaleFactor must be in (0, 1], got " + scaleFactor);
        }
        if (imageQuality < 0 || imageQuality > 100) {
            throw new IllegalArgumentException("imageQuality must be in [0, 100], got " + imageQuality);
        }
    }

    public static StampSpec single(BufferedImage image, int page, StampRect rect) {
        return new StampSpec(image, page, rect, DEFAULT_SCALE_FACTOR, DEFAULT_IMAGE_QUALITY, null);
    }

    public boolean isRepeated() {
        return repetition != null;
    }

    /**
     * Same stamp moved to {@code rect} on {@code newPage}; a repetition grid is re-anchored there.
     */
    public StampSpec at(int newPage, StampRect newRect) {
        return new StampSpec(image, newPage, newRect, scaleFactor, imageQuality, repetition);
    }
}
