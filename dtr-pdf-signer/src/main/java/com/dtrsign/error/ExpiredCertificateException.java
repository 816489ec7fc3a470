package com.dtrsign.error;

/**
 * The signing certificate is outside its validity window.
 */
public class ExpiredCertificateException extends SignaturePipelineException {

    public ExpiredCertificateException(String message) {
        super(ErrorKind.EXPIRED_CERTIFICATE, message);
    }

    public ExpiredCertificateException(String message, Throwable cause) {
        super(ErrorKind.EXPIRED_CERTIFICATE, message, cause);
    }
}
