package com.dtrsign.config;

import com.dtrsign.crypto.DigestAlgorithm;
import com.dtrsign.crypto.RsaSignatureScheme;
import com.dtrsign.pdf.stamp.GridLayout;
import com.dtrsign.pdf.stamp.StampEnhancer;
import com.dtrsign.pdf.stamp.StampRect;
import com.dtrsign.pdf.stamp.StampSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Immutable signing defaults. Loaded from {@code dtr-signer.properties} on the classpath, optionally overlaid
 * by a user supplied properties file, and shared read-only between requests.
 */
public final class SigningConfig {

    private static final Logger log = LoggerFactory.getLogger(SigningConfig.class);

    public static final String RESOURCE = "/dtr-signer.properties";
    public static final int DEFAULT_RESERVED_SIZE = 16384;

    private static final String GRID_ANCHOR_PREFIX = "grid.anchor.";

    private final double scaleFactor;
    private final int imageQuality;
    private final boolean enhance;
    private final float sharpness;
    private final float contrast;
    private final boolean captionEnabled;
    private final int reservedSignatureSize;
    private final DigestAlgorithm digestAlgorithm;
    private final RsaSignatureScheme rsaScheme;
    private final String reason;
    private final String location;
    private final String contact;
    private final GridLayout grid;
    private final int defaultDayCount;
    private final Map<String, StampRect> gridAnchors;

    private SigningConfig(Builder b) {
        if (!(b.scaleFactor > 0.0) || b.scaleFactor > 1.0) {
            throw new IllegalArgumentException("stamp.scale-factor must be in (0, 1], got " + b.scaleFactor);
        }
        if (b.imageQuality < 0 || b.imageQuality > 100) {
            throw new IllegalArgumentException("stamp.image-quality must be in [0, 100], got " + b.imageQuality);
        }
        if (b.reservedSignatureSize < 1024) {
            throw new IllegalArgumentException("signature.reserved-size must be >= 1024, got " + b.reservedSignatureSize);
        }
        if (b.defaultDayCount <= 0) {
            throw new IllegalArgumentException("grid.day-count must be >= 1, got " + b.defaultDayCount);
        }
        this.scaleFactor = b.scaleFactor;
        this.imageQuality = b.imageQuality;
        this.enhance = b.enhance;
        this.sharpness = b.sharpness;
        this.contrast = b.contrast;
        this.captionEnabled = b.captionEnabled;
        this.reservedSignatureSize = b.reservedSignatureSize;
        this.digestAlgorithm = Objects.requireNonNull(b.digestAlgorithm, "digestAlgorithm");
        this.rsaScheme = Objects.requireNonNull(b.rsaScheme, "rsaScheme");
        this.reason = b.reason;
        this.location = b.location;
        this.contact = b.contact;
        this.grid = Objects.requireNonNull(b.grid, "grid");
        this.defaultDayCount = b.defaultDayCount;
        this.gridAnchors = Map.copyOf(b.gridAnchors);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static SigningConfig defaults() {
        return builder().build();
    }

    /**
     * Classpath defaults only.
     */
    public static SigningConfig load() {
        return load(null);
    }

    /**
     * Classpath defaults overlaid with {@code overrideFile} when it is non-null.
     */
    public static SigningConfig load(Path overrideFile) {
        Properties props = new Properties();
        try (InputStream in = SigningConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) {
                props.load(new InputStreamReader(in, StandardCharsets.UTF_8));
            } else {
                log.warn("[config] {} not found on classpath, using built-in defaults", RESOURCE);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Unable to read " + RESOURCE, e);
        }
        if (overrideFile != null) {
            try (Reader reader = Files.newBufferedReader(overrideFile, StandardCharsets.UTF_8)) {
                props.load(reader);
                log.info("[config] overrides loaded from {}", overrideFile.toAbsolutePath());
            } catch (IOException e) {
                throw new IllegalStateException("Unable to read configuration file " + overrideFile, e);
            }
        }
        return fromProperties(props);
    }

    public static SigningConfig fromProperties(Properties props) {
        Builder b = builder();
        String v;
        if ((v = value(props, "stamp.scale-factor")) != null) {
            b.scaleFactor(parseDouble("stamp.scale-factor", v));
        }
        if ((v = value(props, "stamp.image-quality")) != null) {
            b.imageQuality(parseInt("stamp.image-quality", v));
        }
        if ((v = value(props, "stamp.enhance")) != null) {
            b.enhance(Boolean.parseBoolean(v));
        }
        if ((v = value(props, "stamp.enhance.sharpness")) != null) {
            b.sharpness((float) parseDouble("stamp.enhance.sharpness", v));
        }
        if ((v = value(props, "stamp.enhance.contrast")) != null) {
            b.contrast((float) parseDouble("stamp.enhance.contrast", v));
        }
        if ((v = value(props, "stamp.caption.enabled")) != null) {
            b.captionEnabled(Boolean.parseBoolean(v));
        }
        if ((v = value(props, "signature.reserved-size")) != null) {
            b.reservedSignatureSize(parseInt("signature.reserved-size", v));
        }
        if ((v = value(props, "signature.digest-algorithm")) != null) {
            b.digestAlgorithm(DigestAlgorithm.fromName(v));
        }
        if ((v = value(props, "signature.rsa-scheme")) != null) {
            b.rsaScheme(parseScheme(v));
        }
        if ((v = value(props, "signature.reason")) != null) {
            b.reason(v);
        }
        if ((v = value(props, "signature.location")) != null) {
            b.location(v);
        }
        if ((v = value(props, "signature.contact")) != null) {
            b.contact(v);
        }
        GridLayout defaults = GridLayout.MONTH_COLUMN;
        b.grid(new GridLayout(
                intOr(props, "grid.rows-per-page", defaults.rowsPerPage()),
                intOr(props, "grid.cells-per-row", defaults.cellsPerRow()),
                (float) doubleOr(props, "grid.row-step", defaults.rowStep()),
                (float) doubleOr(props, "grid.column-step", defaults.columnStep())));
        if ((v = value(props, "grid.day-count")) != null) {
            b.defaultDayCount(parseInt("grid.day-count", v));
        }
        for (String name : props.stringPropertyNames()) {
            if (name.startsWith(GRID_ANCHOR_PREFIX)) {
                b.gridAnchor(name.substring(GRID_ANCHOR_PREFIX.length()), StampRect.parse(props.getProperty(name)));
            }
        }
        return b.build();
    }

    public double getScaleFactor() {
        return scaleFactor;
    }

    public int getImageQuality() {
        return imageQuality;
    }

    public boolean isEnhance() {
        return enhance;
    }

    public StampEnhancer getEnhancer() {
        return enhance ? new StampEnhancer(sharpness, contrast) : StampEnhancer.IDENTITY;
    }

    public boolean isCaptionEnabled() {
        return captionEnabled;
    }

    public int getReservedSignatureSize() {
        return reservedSignatureSize;
    }

    public DigestAlgorithm getDigestAlgorithm() {
        return digestAlgorithm;
    }

    public RsaSignatureScheme getRsaScheme() {
        return rsaScheme;
    }

    public String getReason() {
        return reason;
    }

    public String getLocation() {
        return location;
    }

    public String getContact() {
        return contact;
    }

    public GridLayout getGrid() {
        return grid;
    }

    public int getDefaultDayCount() {
        return defaultDayCount;
    }

    /**
     * Top-left day cell for the role stored under {@code key} (e.g. {@code owner}), or {@code null}.
     */
    public StampRect getGridAnchor(String key) {
        return gridAnchors.get(key.toLowerCase(Locale.ROOT));
    }

    private static String value(Properties props, String key) {
        String v = props.getProperty(key);
        return v == null || v.isBlank() ? null : v.strip();
    }

    private static int intOr(Properties props, String key, int fallback) {
        String v = value(props, key);
        return v == null ? fallback : parseInt(key, v);
    }

    private static double doubleOr(Properties props, String key, double fallback) {
        String v = value(props, key);
        return v == null ? fallback : parseDouble(key, v);
    }

    private static int parseInt(String key, String v) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid integer for " + key + ": '" + v + "'", e);
        }
    }

    private static double parseDouble(String key, String v) {
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + key + ": '" + v + "'", e);
        }
    }

    private static RsaSignatureScheme parseScheme(String v) {
        String normalized = v.toUpperCase(Locale.ROOT).replace('-', '_').replace('.', '_');
        if (normalized.equals("PKCS1") || normalized.equals("PKCS1_V1_5")) {
            return RsaSignatureScheme.PKCS1_V15;
        }
        try {
            return RsaSignatureScheme.valueOf(normalized);
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("signature.rsa-scheme must be PKCS1_V15 or PSS, got '" + v + "'", e);
        }
    }

    public static final class Builder {
        private double scaleFactor = StampSpec.DEFAULT_SCALE_FACTOR;
        private int imageQuality = StampSpec.DEFAULT_IMAGE_QUALITY;
        private boolean enhance = true;
        private float sharpness = StampEnhancer.DEFAULT_SHARPNESS;
        private float contrast = StampEnhancer.DEFAULT_CONTRAST;
        private boolean captionEnabled;
        private int reservedSignatureSize = DEFAULT_RESERVED_SIZE;
        private DigestAlgorithm digestAlgorithm = DigestAlgorithm.SHA256;
        private RsaSignatureScheme rsaScheme = RsaSignatureScheme.PKCS1_V15;
        private String reason = "Daily Time Record approval";
        private String location = "";
        private String contact = "";
        private GridLayout grid = GridLayout.MONTH_COLUMN;
        private int defaultDayCount = 31;
        private Map<String, StampRect> gridAnchors = new LinkedHashMap<>(Map.of(
                "owner", new StampRect(300f, 702f, 410f, 718f),
                "incharge", new StampRect(430f, 702f, 540f, 718f)));

        private Builder() {
        }

        public Builder scaleFactor(double scaleFactor) {
            this.scaleFactor = scaleFactor;
            return this;
        }

        public Builder imageQuality(int imageQuality) {
            this.imageQuality = imageQuality;
            return this;
        }

        public Builder enhance(boolean enhance) {
            this.enhance = enhance;
            return this;
        }

        public Builder sharpness(float sharpness) {
            this.sharpness = sharpness;
            return this;
        }

        public Builder contrast(float contrast) {
            this.contrast = contrast;
            return this;
        }

        public Builder captionEnabled(boolean captionEnabled) {
            this.captionEnabled = captionEnabled;
            return this;
        }

        public Builder reservedSignatureSize(int reservedSignatureSize) {
            this.reservedSignatureSize = reservedSignatureSize;
            return this;
        }

        public Builder digestAlgorithm(DigestAlgorithm digestAlgorithm) {
            this.digestAlgorithm = digestAlgorithm;
            return this;
        }

        public Builder rsaScheme(RsaSignatureScheme rsaScheme) {
            this.rsaScheme = rsaScheme;
            return this;
        }

        public Builder reason(String reason) {
            this.reason = reason;
            return this;
        }

        public Builder location(String location) {
            this.location = location;
            return this;
        }

        public Builder contact(String contact) {
            this.contact = contact;
            return this;
        }

        public Builder grid(GridLayout grid) {
            this.grid = grid;
            return this;
        }

        public Builder defaultDayCount(int defaultDayCount) {
            this.defaultDayCount = defaultDayCount;
            return this;
        }

        public Builder gridAnchor(String roleKey, StampRect anchor) {
            this.gridAnchors.put(roleKey.toLowerCase(Locale.ROOT), Objects.requireNonNull(anchor, "anchor"));
            return this;
        }

        public SigningConfig build() {
            return new SigningConfig(this);
        }
    }
}
