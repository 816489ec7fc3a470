package com.dtrsign.crypto;

/**
 * A contiguous span of document bytes covered by a signature digest.
 */
public record ByteRange(long offset, long length) {

    public ByteRange {
        if (offset < 0 || length < 0) {
            throw new IllegalArgumentException("Byte range must be non-negative: [" + offset + ", " + length + "]");
        }
    }

    public long end() {
        return offset + length;
    }

    @Override
    public String toString() {
        return "[" + offset + ", " + length + "]";
    }
}
