package com.dtrsign.pdf;

import com.dtrsign.crypto.ByteRange;

import java.util.List;

/**
 * Base document plus one incremental update holding a named signature field whose contents are a zero-filled
 * placeholder. {@link #byteRanges()} cover everything except the placeholder.
 */
public final class ReservedDocument {

    private final BaseDocument base;
    private final byte[] bytes;
    private final String fieldName;
    private final List<ByteRange> byteRanges;

    ReservedDocument(BaseDocument base, byte[] bytes, String fieldName, List<ByteRange> byteRanges) {
        this.base = base;
        this.bytes = bytes;
        this.fieldName = fieldName;
        this.byteRanges = List.copyOf(byteRanges);
    }

    public DocumentState state() {
        return DocumentState.PLACEHOLDER_RESERVED;
    }

    public BaseDocument base() {
        return base;
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    byte[] rawBytes() {
        return bytes;
    }

    public int length() {
        return bytes.length;
    }

    public String fieldName() {
        return fieldName;
    }

    public List<ByteRange> byteRanges() {
        return byteRanges;
    }

    /**
     * Offset of the {@code <} that opens the hex placeholder.
     */
    public long placeholderOffset() {
        return byteRanges.get(0).end();
    }

    /**
     * Length of the placeholder span including its angle brackets.
     */
    public long placeholderLength() {
        return byteRanges.get(1).offset() - byteRanges.get(0).end();
    }

    /**
     * Number of signature bytes the placeholder can hold once hex encoded.
     */
    public int signatureCapacity() {
        return (int) ((placeholderLength() - 2) / 2);
    }
}
