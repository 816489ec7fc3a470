package com.dtrsign.pdf.stamp;

import java.util.Locale;

/**
 * Axis-aligned rectangle in PDF user space (points, origin bottom-left).
 */
public record StampRect(float llx, float lly, float urx, float ury) {

    public StampRect {
        if (!(urx > llx) || !(ury > lly)) {
            throw new IllegalArgumentException("Rectangle must have positive width and height: "
                    + format(llx, lly, urx, ury));
        }
    }

    public static StampRect of(float x, float y, float width, float height) {
        return new StampRect(x, y, x + width, y + height);
    }

    /**
     * Parses {@code "llx,lly,urx,ury"}.
     */
    public static StampRect parse(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Rectangle value must not be null");
        }
        String[] parts = value.split(",");
        if (parts.length != 4) {
            throw new IllegalArgumentException("Rectangle must be 'llx,lly,urx,ury': '" + value + "'");
        }
        float[] v = new float[4];
        for (int i = 0; i < 4; i++) {
            try {
                v[i] = Float.parseFloat(parts[i].strip());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid rectangle coordinate '" + parts[i] + "' in '" + value + "'", e);
            }
        }
        return new StampRect(v[0], v[1], v[2], v[3]);
    }

    public float width() {
        return urx - llx;
    }

    public float height() {
        return ury - lly;
    }

    public StampRect translate(float dx, float dy) {
        return new StampRect(llx + dx, lly + dy, urx + dx, ury + dy);
    }

    /**
     * True when this rectangle lies within {@code outer}; touching edges count as inside.
     */
    public boolean isWithin(StampRect outer) {
        return llx >= outer.llx && lly >= outer.lly && urx <= outer.urx && ury <= outer.ury;
    }

    @Override
    public String toString() {
        return format(llx, lly, urx, ury);
    }

    private static String format(float llx, float lly, float urx, float ury) {
        return String.format(Locale.ROOT, "[%.2f, %.2f, %.2f, %.2f]", llx, lly, urx, ury);
    }
}
