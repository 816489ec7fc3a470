package com.dtrsign.pdf;

import com.dtrsign.crypto.ByteRange;

import java.util.List;

/**
 * Signed revision: the placeholder now holds the CMS signature. Same length as the reserved document.
 */
public final class FinalizedDocument {

    private final BaseDocument next;
    private final String fieldName;
    private final List<ByteRange> byteRanges;

    FinalizedDocument(BaseDocument next, String fieldName, List<ByteRange> byteRanges) {
        this.next = next;
        this.fieldName = fieldName;
        this.byteRanges = List.copyOf(byteRanges);
    }

    public DocumentState state() {
        return DocumentState.FINALIZED;
    }

    public byte[] bytes() {
        return next.bytes();
    }

    public int length() {
        return next.length();
    }

    public String fieldName() {
        return fieldName;
    }

    public List<ByteRange> byteRanges() {
        return byteRanges;
    }

    /**
     * This revision as the starting point of the next signature.
     */
    public BaseDocument asBase() {
        return next;
    }
}
