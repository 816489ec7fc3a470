package com.dtrsign.pdf.stamp;

import java.util.Objects;

/**
 * One visible placement of the stamp: widget rectangle on a page, and the fitted image rectangle inside it.
 */
public record StampAppearance(int page, StampRect widgetRect, StampRect imageRect, StampRaster raster) {

    public StampAppearance {
        Objects.requireNonNull(widgetRect, "widgetRect");
        Objects.requireNonNull(imageRect, "imageRect");
        Objects.requireNonNull(raster, "raster");
    }
}
