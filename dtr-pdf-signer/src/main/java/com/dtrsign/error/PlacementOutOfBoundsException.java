package com.dtrsign.error;

/**
 * A stamp rectangle does not fit the page media box, or the page does not exist.
 */
public class PlacementOutOfBoundsException extends SignaturePipelineException {

    public PlacementOutOfBoundsException(String message) {
        super(ErrorKind.PLACEMENT_OUT_OF_BOUNDS, message);
    }

    public PlacementOutOfBoundsException(String message, Throwable cause) {
        super(ErrorKind.PLACEMENT_OUT_OF_BOUNDS, message, cause);
    }
}
