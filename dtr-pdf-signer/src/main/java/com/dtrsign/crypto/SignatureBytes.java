package com.dtrsign.crypto;

import java.time.Instant;

/**
 * DER-encoded CMS SignedData plus the metadata that went into it.
 */
public record SignatureBytes(byte[] encoded, Instant signingTime, String signerSubject,
                             DigestAlgorithm digestAlgorithm, String signatureAlgorithm) {

    public int length() {
        return encoded.length;
    }
}
