package com.dtrsign.pdf;

import com.dtrsign.crypto.DigestAlgorithm;

/**
 * Reserved document together with the digest of its byte ranges.
 */
public final class DigestedDocument {

    private final ReservedDocument reserved;
    private final byte[] digest;
    private final DigestAlgorithm digestAlgorithm;

    DigestedDocument(ReservedDocument reserved, byte[] digest, DigestAlgorithm digestAlgorithm) {
        this.reserved = reserved;
        this.digest = digest.clone();
        this.digestAlgorithm = digestAlgorithm;
    }

    public DocumentState state() {
        return DocumentState.DIGESTED;
    }

    public ReservedDocument reserved() {
        return reserved;
    }

    public byte[] digest() {
        return digest.clone();
    }

    public DigestAlgorithm digestAlgorithm() {
        return digestAlgorithm;
    }

    public String fieldName() {
        return reserved.fieldName();
    }
}
