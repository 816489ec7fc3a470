package com.dtrsign.error;

import java.util.Objects;

/**
 * Base type of all errors raised by the signing pipeline stages.
 */
public abstract class SignaturePipelineException extends Exception {

    private final ErrorKind kind;

    protected SignaturePipelineException(ErrorKind kind, String message) {
        super(message);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    protected SignaturePipelineException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = Objects.requireNonNull(kind, "kind");
    }

    public ErrorKind getKind() {
        return kind;
    }
}
