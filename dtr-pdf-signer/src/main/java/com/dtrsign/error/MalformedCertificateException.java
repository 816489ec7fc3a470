package com.dtrsign.error;

/**
 * The PKCS#12 container cannot be parsed or holds no usable key/certificate pair.
 */
public class MalformedCertificateException extends SignaturePipelineException {

    public MalformedCertificateException(String message) {
        super(ErrorKind.MALFORMED_CERTIFICATE, message);
    }

    public MalformedCertificateException(String message, Throwable cause) {
        super(ErrorKind.MALFORMED_CERTIFICATE, message, cause);
    }
}
