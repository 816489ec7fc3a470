package com.dtrsign.crypto;

import java.util.Locale;

/**
 * Document digest algorithms accepted for signing. Nothing weaker than SHA-256.
 */
public enum DigestAlgorithm {
    SHA256("SHA-256", "SHA256", 32),
    SHA384("SHA-384", "SHA384", 48),
    SHA512("SHA-512", "SHA512", 64);

    private final String jcaName;
    private final String signaturePrefix;
    private final int digestLength;

    DigestAlgorithm(String jcaName, String signaturePrefix, int digestLength) {
        this.jcaName = jcaName;
        this.signaturePrefix = signaturePrefix;
        this.digestLength = digestLength;
    }

    public String getJcaName() {
        return jcaName;
    }

    /**
     * Prefix used in JCA signature names, e.g. {@code SHA256} in {@code SHA256withRSA}.
     */
    public String getSignaturePrefix() {
        return signaturePrefix;
    }

    public int getDigestLength() {
        return digestLength;
    }

    public static DigestAlgorithm fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Digest algorithm name must not be blank");
        }
        String normalized = name.strip().toUpperCase(Locale.ROOT).replace("-", "");
        for (DigestAlgorithm algorithm : values()) {
            if (algorithm.signaturePrefix.equals(normalized)) {
                return algorithm;
            }
        }
        throw new IllegalArgumentException("Unsupported digest algorithm '" + name
                + "'; expected one of SHA-256, SHA-384, SHA-512");
    }
}
