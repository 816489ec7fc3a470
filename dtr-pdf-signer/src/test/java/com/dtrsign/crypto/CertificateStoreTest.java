package com.dtrsign.crypto;

import com.dtrsign.TestFixtures;
import com.dtrsign.error.ErrorKind;
import com.dtrsign.error.ExpiredCertificateException;
import com.dtrsign.error.InvalidCredentialsException;
import com.dtrsign.error.MalformedCertificateException;
import com.dtrsign.error.UnsupportedKeyTypeException;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * PKCS#12 parsing and certificate validity checks.
 */
class CertificateStoreTest {

    private final CertificateStore store = new CertificateStore();

    @Test
    void loadsRsaBundleWithLeafFirst() throws Exception {
        try (CertificateBundle bundle = store.load(TestFixtures.inchargeP12(), TestFixtures.PASSWORD)) {
            assertEquals(2, bundle.getChain().size());
            assertEquals("Ivan Incharge", bundle.getSignerName());
            assertEquals("RSA", bundle.getKeyAlgorithm());
            assertEquals(bundle.getChain().get(1).getSubjectX500Principal(),
                    bundle.getSigningCertificate().getIssuerX500Principal());
        }
    }

    @Test
    void loadsEcBundle() throws Exception {
        Instant now = TestFixtures.now();
        byte[] p12 = TestFixtures.p12("EC", now.minus(Duration.ofDays(1)), now.plus(Duration.ofDays(30)), null);
        try (CertificateBundle bundle = store.load(p12, TestFixtures.PASSWORD)) {
            assertTrue(bundle.isEc());
            assertEquals(1, bundle.getChain().size());
        }
    }

    @Test
    void wrongPasswordIsInvalidCredentials() throws Exception {
        InvalidCredentialsException e = assertThrows(InvalidCredentialsException.class,
                () -> store.load(TestFixtures.ownerP12(), "wrong".toCharArray()));
        assertEquals(ErrorKind.INVALID_CREDENTIALS, e.getKind());
    }

    @Test
    void garbageIsMalformed() {
        byte[] garbage = "this is certainly not a PKCS#12 container".getBytes(StandardCharsets.US_ASCII);
        MalformedCertificateException e = assertThrows(MalformedCertificateException.class,
                () -> store.load(garbage, TestFixtures.PASSWORD));
        assertEquals(ErrorKind.MALFORMED_CERTIFICATE, e.getKind());
        assertThrows(MalformedCertificateException.class, () -> store.load(new byte[0], TestFixtures.PASSWORD));
    }

    @Test
    void dsaKeyIsUnsupported() throws Exception {
        Instant now = TestFixtures.now();
        byte[] p12 = TestFixtures.p12("DSA", now.minus(Duration.ofDays(1)), now.plus(Duration.ofDays(30)), null);
        assertThrows(UnsupportedKeyTypeException.class, () -> store.load(p12, TestFixtures.PASSWORD));
    }

    @Test
    @DisplayName("validate accepts notBefore..notAfter inclusive and rejects one second either side")
    void validityWindowBoundaries() throws Exception {
        Instant now = TestFixtures.now();
        Instant notBefore = now.minus(Duration.ofDays(1));
        Instant notAfter = now.plus(Duration.ofDays(1));
        byte[] p12 = TestFixtures.p12("RSA", notBefore, notAfter, null);
        try (CertificateBundle bundle = store.load(p12, TestFixtures.PASSWORD)) {
            store.validate(bundle, notBefore);
            store.validate(bundle, notAfter);
            ExpiredCertificateException expired = assertThrows(ExpiredCertificateException.class,
                    () -> store.validate(bundle, notAfter.plusSeconds(1)));
            assertTrue(expired.getMessage().contains("expired"));
            ExpiredCertificateException early = assertThrows(ExpiredCertificateException.class,
                    () -> store.validate(bundle, notBefore.minusSeconds(1)));
            assertTrue(early.getMessage().contains("not valid before"));
        }
    }

    @Test
    void expiredCertificateStillLoads() throws Exception {
        byte[] p12 = TestFixtures.p12ValidBetween(Duration.ofDays(-10), Duration.ofDays(-1));
        try (CertificateBundle bundle = store.load(p12, TestFixtures.PASSWORD)) {
            assertThrows(ExpiredCertificateException.class, () -> store.validate(bundle));
        }
    }

    @Test
    void keyUsageWithoutDigitalSignatureIsRejected() throws Exception {
        Instant now = TestFixtures.now();
        byte[] p12 = TestFixtures.p12("RSA", now.minus(Duration.ofDays(1)), now.plus(Duration.ofDays(1)),
                KeyUsage.keyEncipherment);
        try (CertificateBundle bundle = store.load(p12, TestFixtures.PASSWORD)) {
            assertThrows(UnsupportedKeyTypeException.class, () -> store.validate(bundle));
        }

        byte[] signing = TestFixtures.p12("RSA", now.minus(Duration.ofDays(1)), now.plus(Duration.ofDays(1)),
                KeyUsage.digitalSignature | KeyUsage.nonRepudiation);
        try (CertificateBundle bundle = store.load(signing, TestFixtures.PASSWORD)) {
            store.validate(bundle);
        }
    }

    @Test
    void closedBundleRefusesKeyAccess() throws Exception {
        CertificateBundle bundle = store.load(TestFixtures.ownerP12(), TestFixtures.PASSWORD);
        assertFalse(bundle.isClosed());
        bundle.close();
        assertTrue(bundle.isClosed());
        assertThrows(IllegalStateException.class, bundle::getPrivateKey);
        bundle.close();
    }

    @Test
    void callerPasswordIsNotModified() throws Exception {
        char[] password = TestFixtures.PASSWORD.clone();
        store.load(TestFixtures.ownerP12(), password).close();
        assertEquals("123456", new String(password));
    }
}
