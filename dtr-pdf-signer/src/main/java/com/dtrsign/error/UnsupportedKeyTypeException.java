package com.dtrsign.error;

/**
 * The private key is neither RSA nor EC, or the certificate may not be used for digital signatures.
 */
public class UnsupportedKeyTypeException extends SignaturePipelineException {

    public UnsupportedKeyTypeException(String message) {
        super(ErrorKind.UNSUPPORTED_KEY_TYPE, message);
    }

    public UnsupportedKeyTypeException(String message, Throwable cause) {
        super(ErrorKind.UNSUPPORTED_KEY_TYPE, message, cause);
    }
}
