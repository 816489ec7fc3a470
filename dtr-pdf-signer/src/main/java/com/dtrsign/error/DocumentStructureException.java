package com.dtrsign.error;

/**
 * The input is not a well-formed PDF, or an incremental update would damage it.
 */
public class DocumentStructureException extends SignaturePipelineException {

    public DocumentStructureException(String message) {
        super(ErrorKind.DOCUMENT_STRUCTURE, message);
    }

    public DocumentStructureException(String message, Throwable cause) {
        super(ErrorKind.DOCUMENT_STRUCTURE, message, cause);
    }
}
