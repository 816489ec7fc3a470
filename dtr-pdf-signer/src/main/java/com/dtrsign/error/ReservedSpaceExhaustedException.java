package com.dtrsign.error;

/**
 * The encoded signature is larger than the span reserved in the document.
 */
public class ReservedSpaceExhaustedException extends SignaturePipelineException {

    public ReservedSpaceExhaustedException(String message) {
        super(ErrorKind.RESERVED_SPACE_EXHAUSTED, message);
    }

    public ReservedSpaceExhaustedException(String message, Throwable cause) {
        super(ErrorKind.RESERVED_SPACE_EXHAUSTED, message, cause);
    }
}
