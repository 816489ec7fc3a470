package com.dtrsign.pdf.stamp;

import com.dtrsign.error.GridCapacityExceededException;
import com.dtrsign.error.PlacementOutOfBoundsException;
import net.coobird.thumbnailator.Thumbnails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns a decoded signature image and a {@link StampSpec} into encoded, fitted {@link StampAppearance}s.
 */
public final class StampCompositor {

    private static final Logger log = LoggerFactory.getLogger(StampCompositor.class);

    private final StampEnhancer enhancer;

    public StampCompositor() {
        this(StampEnhancer.defaults());
    }

    public StampCompositor(StampEnhancer enhancer) {
        this.enhancer = Objects.requireNonNull(enhancer, "enhancer");
    }

    /**
     * Composes every placement of {@code spec} on a page whose media box is {@code mediaBox}. All placements
     * share one encoded raster.
     */
    public List<StampAppearance> compose(StampSpec spec, StampRect mediaBox)
            throws PlacementOutOfBoundsException, GridCapacityExceededException {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(mediaBox, "mediaBox");

        List<StampRect> rects = placements(spec);
        for (StampRect rect : rects) {
            if (!rect.isWithin(mediaBox)) {
                throw new PlacementOutOfBoundsException("Stamp rectangle " + rect + " exceeds media box "
                        + mediaBox + " of page " + spec.page());
            }
        }

        BufferedImage source = spec.image();
        StampRaster raster = rasterize(source, spec.scaleFactor(), spec.imageQuality());
        List<StampAppearance> appearances = new ArrayList<>(rects.size());
        for (StampRect rect : rects) {
            StampRect imageRect = fit(source.getWidth(), source.getHeight(), rect, spec.scaleFactor());
            appearances.add(new StampAppearance(spec.page(), rect, imageRect, raster));
        }
        log.debug("[stamp] {} placement(s) on page {} raster={}x{} {}", appearances.size(), spec.page(),
                raster.width(), raster.height(), raster.encoding());
        return appearances;
    }

    /**
     * Largest rectangle with the image's aspect ratio that fits inside {@code rect} scaled by {@code scale},
     * centred in {@code rect}.
     */
    public static StampRect fit(int imageWidth, int imageHeight, StampRect rect, double scale) {
        if (imageWidth <= 0 || imageHeight <= 0) {
            throw new IllegalArgumentException("Image has no pixels");
        }
        double availableWidth = rect.width() * scale;
        double availableHeight = rect.height() * scale;
        double factor = Math.min(availableWidth / imageWidth, availableHeight / imageHeight);
        float w = (float) (imageWidth * factor);
        float h = (float) (imageHeight * factor);
        float x = rect.llx() + (rect.width() - w) / 2f;
        float y = rect.lly() + (rect.height() - h) / 2f;
        return new StampRect(x, y, x + w, y + h);
    }

    static List<StampRect> placements(StampSpec spec) throws GridCapacityExceededException {
        if (!spec.isRepeated()) {
            return List.of(spec.rect());
        }
        RepetitionRule rule = spec.repetition();
        GridLayout grid = rule.grid();
        if (rule.dayCount() > grid.capacity()) {
            throw new GridCapacityExceededException("Whole-month stamp needs " + rule.dayCount()
                    + " cells but the grid holds " + grid.capacity() + " (" + grid.rowsPerPage() + " rows x "
                    + grid.cellsPerRow() + " cells)");
        }
        List<StampRect> cells = new ArrayList<>(rule.dayCount());
        for (int day = 0; day < rule.dayCount(); day++) {
            cells.add(grid.cell(spec.rect(), day));
        }
        return cells;
    }

    StampRaster rasterize(BufferedImage source, double scale, int quality) {
        BufferedImage argb = toArgb(source);
        BufferedImage scaled = resample(argb, scale);
        if (!enhancer.isIdentity()) {
            scaled = enhancer.apply(scaled);
        }
        int w = scaled.getWidth();
        int h = scaled.getHeight();
        int[] pixels = scaled.getRGB(0, 0, w, h, null, 0, w);
        byte[] rgb = new byte[pixels.length * 3];
        byte[] alpha = new byte[pixels.length];
        for (int i = 0; i < pixels.length; i++) {
            int p = pixels[i];
            alpha[i] = (byte) (p >>> 24);
            rgb[i * 3] = (byte) (p >> 16);
            rgb[i * 3 + 1] = (byte) (p >> 8);
            rgb[i * 3 + 2] = (byte) p;
        }
        if (quality >= 100) {
            return new StampRaster(w, h, StampRaster.Encoding.FLATE_RGB, rgb, alpha);
        }
        return new StampRaster(w, h, StampRaster.Encoding.JPEG, encodeJpeg(scaled, quality), alpha);
    }

    /**
     * Copies {@code image} into a 4-channel ARGB buffer; images without alpha come out fully opaque.
     */
    static BufferedImage toArgb(BufferedImage image) {
        if (image.getType() == BufferedImage.TYPE_INT_ARGB) {
            return image;
        }
        BufferedImage argb = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_INT_ARGB);
        Graphics2D g = argb.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }
        return argb;
    }

    private static BufferedImage resample(BufferedImage argb, double scale) {
        if (scale == 1.0) {
            return argb;
        }
        try {
            BufferedImage scaled = Thumbnails.of(argb)
                    .scale(scale)
                    .imageType(BufferedImage.TYPE_INT_ARGB)
                    .asBufferedImage();
            return toArgb(scaled);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to resample stamp image", e);
        }
    }

    private static byte[] encodeJpeg(BufferedImage argb, int quality) {
        BufferedImage rgb = new BufferedImage(argb.getWidth(), argb.getHeight(), BufferedImage.TYPE_INT_RGB);
        Graphics2D g = rgb.createGraphics();
        try {
            g.drawImage(argb, 0, 0, Color.WHITE, null);
        } finally {
            g.dispose();
        }
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try {
            Thumbnails.of(rgb)
                    .scale(1.0)
                    .outputFormat("jpg")
                    .outputQuality(quality / 100.0)
                    .toOutputStream(out);
        } catch (IOException e) {
            throw new UncheckedIOException("Unable to encode stamp image as JPEG", e);
        }
        return out.toByteArray();
    }
}
