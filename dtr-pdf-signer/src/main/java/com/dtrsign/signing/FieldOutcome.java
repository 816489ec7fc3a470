package com.dtrsign.signing;

import com.dtrsign.error.ErrorKind;

/**
 * Per-field result. {@code fieldName} may be {@code null} when the pipeline failed before a name was chosen.
 */
public record FieldOutcome(String fieldName, SignerRole role, boolean success, ErrorKind errorKind, String message) {

    public static FieldOutcome signed(String fieldName, SignerRole role) {
        return new FieldOutcome(fieldName, role, true, null, null);
    }

    public static FieldOutcome failed(String fieldName, SignerRole role, ErrorKind kind, String message) {
        return new FieldOutcome(fieldName, role, false, kind, message);
    }
}
