package com.dtrsign.error;

/**
 * CMS signature generation failed (key/hash pairing, operator or provider failure).
 */
public class SigningException extends SignaturePipelineException {

    public SigningException(String message) {
        super(ErrorKind.SIGNING_FAILED, message);
    }

    public SigningException(String message, Throwable cause) {
        super(ErrorKind.SIGNING_FAILED, message, cause);
    }
}
