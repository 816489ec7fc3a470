package com.dtrsign.pdf;

import com.dtrsign.crypto.ByteRange;

import java.time.Instant;
import java.util.List;

/**
 * What {@link SignatureInspector} found for one signature field.
 *
 * @param error parse or verification failure, {@code null} when the CMS verified
 */
public record SignatureReport(String fieldName, int page, String subFilter, String signerSubject,
                              Instant signingTime, List<ByteRange> byteRanges, boolean coversWholeDocument,
                              boolean cmsValid, String error) {

    public long coveredLength() {
        return byteRanges.isEmpty() ? 0 : byteRanges.get(byteRanges.size() - 1).end();
    }
}
