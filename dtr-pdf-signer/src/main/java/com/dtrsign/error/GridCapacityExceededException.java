package com.dtrsign.error;

/**
 * Whole-month mode requested more day cells than the grid provides.
 */
public class GridCapacityExceededException extends SignaturePipelineException {

    public GridCapacityExceededException(String message) {
        super(ErrorKind.GRID_CAPACITY_EXCEEDED, message);
    }

    public GridCapacityExceededException(String message, Throwable cause) {
        super(ErrorKind.GRID_CAPACITY_EXCEEDED, message, cause);
    }
}
