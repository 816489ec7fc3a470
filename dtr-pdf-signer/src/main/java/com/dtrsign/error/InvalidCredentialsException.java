package com.dtrsign.error;

/**
 * The PKCS#12 password (or the key entry password) is wrong.
 */
public class InvalidCredentialsException extends SignaturePipelineException {

    public InvalidCredentialsException(String message) {
        super(ErrorKind.INVALID_CREDENTIALS, message);
    }

    public InvalidCredentialsException(String message, Throwable cause) {
        super(ErrorKind.INVALID_CREDENTIALS, message, cause);
    }
}
