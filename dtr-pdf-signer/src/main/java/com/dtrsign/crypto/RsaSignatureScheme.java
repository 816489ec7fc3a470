package com.dtrsign.crypto;

public enum RsaSignatureScheme {
    PKCS1_V15,
    PSS
}
