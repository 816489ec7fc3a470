package com.dtrsign.signing;

import com.dtrsign.pdf.stamp.StampRect;

import java.awt.image.BufferedImage;
import java.util.Arrays;
import java.util.Objects;

/**
 * Everything one signer submits: document, PKCS#12 credentials, stamp image and placement options.
 * Unset scale, quality and day count fall back to configuration.
 */
public final class SigningRequest {

    private final byte[] pdf;
    private final byte[] pkcs12;
    private final char[] password;
    private final BufferedImage image;
    private final SignerRole role;
    private final DocumentKind kind;
    private final int page;
    private final StampRect rect;
    private final Double scaleFactor;
    private final Integer imageQuality;
    private final boolean wholeMonth;
    private final Integer dayCount;

    private SigningRequest(Builder b) {
        this.pdf = Objects.requireNonNull(b.pdf, "pdf");
        this.pkcs12 = Objects.requireNonNull(b.pkcs12, "pkcs12");
        this.password = b.password == null ? new char[0] : b.password.clone();
        this.image = Objects.requireNonNull(b.image, "image");
        this.role = Objects.requireNonNull(b.role, "role");
        this.kind = Objects.requireNonNull(b.kind, "kind");
        if (b.page < 1) {
            throw new IllegalArgumentException("page must be >= 1, got " + b.page);
        }
        this.page = b.page;
        this.rect = b.rect;
        this.scaleFactor = b.scaleFactor;
        this.imageQuality = b.imageQuality;
        this.wholeMonth = b.wholeMonth;
        this.dayCount = b.dayCount;
    }

    public static Builder builder() {
        return new Builder();
    }

    public byte[] pdf() {
        return pdf;
    }

    public byte[] pkcs12() {
        return pkcs12;
    }

    public char[] password() {
        return password;
    }

    public BufferedImage image() {
        return image;
    }

    public SignerRole role() {
        return role;
    }

    public DocumentKind kind() {
        return kind;
    }

    public int page() {
        return page;
    }

    public StampRect rect() {
        return rect;
    }

    public Double scaleFactor() {
        return scaleFactor;
    }

    public Integer imageQuality() {
        return imageQuality;
    }

    public boolean wholeMonth() {
        return wholeMonth;
    }

    public Integer dayCount() {
        return dayCount;
    }

    /**
     * Same request against another document, used to chain signers.
     */
    public SigningRequest withPdf(byte[] document) {
        return toBuilder().pdf(document).build();
    }

    /**
     * Zeroes this request's password copy.
     */
    public void clearPassword() {
        Arrays.fill(password, '\0');
    }

    public Builder toBuilder() {
        return new Builder()
                .pdf(pdf)
                .pkcs12(pkcs12)
                .password(password)
                .image(image)
                .role(role)
                .kind(kind)
                .page(page)
                .rect(rect)
                .scaleFactor(scaleFactor)
                .imageQuality(imageQuality)
                .wholeMonth(wholeMonth)
                .dayCount(dayCount);
    }

    public static final class Builder {
        private byte[] pdf;
        private byte[] pkcs12;
        private char[] password;
        private BufferedImage image;
        private SignerRole role = SignerRole.OWNER;
        private DocumentKind kind = DocumentKind.DTR;
        private int page = 1;
        private StampRect rect;
        private Double scaleFactor;
        private Integer imageQuality;
        private boolean wholeMonth;
        private Integer dayCount;

        private Builder() {
        }

        public Builder pdf(byte[] pdf) {
            this.pdf = pdf;
            return this;
        }

        public Builder pkcs12(byte[] pkcs12) {
            this.pkcs12 = pkcs12;
            return this;
        }

        public Builder password(char[] password) {
            this.password = password;
            return this;
        }

        public Builder image(BufferedImage image) {
            this.image = image;
            return this;
        }

        public Builder role(SignerRole role) {
            this.role = role;
            return this;
        }

        public Builder kind(DocumentKind kind) {
            this.kind = kind;
            return this;
        }

        public Builder page(int page) {
            this.page = page;
            return this;
        }

        public Builder rect(StampRect rect) {
            this.rect = rect;
            return this;
        }

        public Builder scaleFactor(Double scaleFactor) {
            this.scaleFactor = scaleFactor;
            return this;
        }

        public Builder imageQuality(Integer imageQuality) {
            this.imageQuality = imageQuality;
            return this;
        }

        public Builder wholeMonth(boolean wholeMonth) {
            this.wholeMonth = wholeMonth;
            return this;
        }

        public Builder dayCount(Integer dayCount) {
            this.dayCount = dayCount;
            return this;
        }

        public SigningRequest build() {
            return new SigningRequest(this);
        }
    }
}
