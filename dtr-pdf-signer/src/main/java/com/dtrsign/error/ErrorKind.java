package com.dtrsign.error;

/**
 * Stable identifiers for every failure the signing pipeline can report.
 * <p>
 * Callers map on {@link #code()} (or the enum constant) and never on message text.
 */
public enum ErrorKind {
    INVALID_CREDENTIALS("invalid-credentials"),
    MALFORMED_CERTIFICATE("malformed-certificate"),
    UNSUPPORTED_KEY_TYPE("unsupported-key-type"),
    EXPIRED_CERTIFICATE("expired-certificate"),
    PLACEMENT_OUT_OF_BOUNDS("placement-out-of-bounds"),
    GRID_CAPACITY_EXCEEDED("grid-capacity-exceeded"),
    SIGNING_FAILED("signing-failed"),
    RESERVED_SPACE_EXHAUSTED("reserved-space-exhausted"),
    DOCUMENT_STRUCTURE("document-structure");

    private final String code;

    ErrorKind(String code) {
        this.code = code;
    }

    public String code() {
        return code;
    }
}
