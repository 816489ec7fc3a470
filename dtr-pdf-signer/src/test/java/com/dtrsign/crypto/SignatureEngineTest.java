package com.dtrsign.crypto;

import com.dtrsign.TestFixtures;
import com.dtrsign.error.DocumentStructureException;
import com.dtrsign.error.SigningException;
import org.bouncycastle.asn1.cms.AttributeTable;
import org.bouncycastle.asn1.cms.CMSAttributes;
import org.bouncycastle.asn1.cms.Time;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cms.CMSProcessableByteArray;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.SignerInformation;
import org.bouncycastle.cms.jcajce.JcaSimpleSignerInfoVerifierBuilder;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SignatureEngineTest {

    private static final byte[] DOCUMENT = "%PDF-1.7 head-part<000000>tail-part%%EOF".getBytes(StandardCharsets.US_ASCII);

    private final SignatureEngine engine = new SignatureEngine();
    private final CertificateStore store = new CertificateStore();

    private static List<ByteRange> aroundPlaceholder() {
        int open = indexOf('<');
        int close = indexOf('>') + 1;
        return List.of(new ByteRange(0, open), new ByteRange(close, DOCUMENT.length - close));
    }

    private static int indexOf(char c) {
        return new String(DOCUMENT, StandardCharsets.US_ASCII).indexOf(c);
    }

    @Test
    void digestIsDeterministicAndSkipsPlaceholder() throws Exception {
        byte[] first = engine.digest(DOCUMENT, aroundPlaceholder());
        byte[] second = engine.digest(DOCUMENT.clone(), aroundPlaceholder());
        assertArrayEquals(first, second);

        String text = new String(DOCUMENT, StandardCharsets.US_ASCII);
        byte[] covered = (text.substring(0, indexOf('<')) + text.substring(indexOf('>') + 1))
                .getBytes(StandardCharsets.US_ASCII);
        assertArrayEquals(MessageDigest.getInstance("SHA-256").digest(covered), first);
    }

    @Test
    void digestRejectsRangesThatCoverThePlaceholder() {
        int len = DOCUMENT.length;
        assertThrows(DocumentStructureException.class,
                () -> engine.digest(DOCUMENT, List.of(new ByteRange(0, 20), new ByteRange(10, len - 10))));
        assertThrows(DocumentStructureException.class,
                () -> engine.digest(DOCUMENT, List.of(new ByteRange(0, 10), new ByteRange(20, len - 21))));
        assertThrows(DocumentStructureException.class,
                () -> engine.digest(DOCUMENT, List.of(new ByteRange(0, len))));
        assertThrows(DocumentStructureException.class,
                () -> engine.digest(DOCUMENT, List.of(new ByteRange(1, 9), new ByteRange(20, len - 20))));
    }

    @Test
    void cmsVerifiesAgainstTheSignedBytes() throws Exception {
        byte[] content = "content covered by the byte ranges".getBytes(StandardCharsets.US_ASCII);
        byte[] hash = MessageDigest.getInstance("SHA-256").digest(content);
        Instant signingTime = TestFixtures.now();

        try (CertificateBundle bundle = store.load(TestFixtures.inchargeP12(), TestFixtures.PASSWORD)) {
            SignatureBytes signature = engine.sign(hash, bundle, signingTime);
            assertEquals("SHA256withRSA", signature.signatureAlgorithm());

            CMSSignedData cms = new CMSSignedData(new CMSProcessableByteArray(content), signature.encoded());
            assertEquals(2, cms.getCertificates().getMatches(null).size());
            SignerInformation signer = cms.getSignerInfos().getSigners().iterator().next();
            X509CertificateHolder holder = (X509CertificateHolder) cms.getCertificates().getMatches(signer.getSID()).iterator().next();
            assertTrue(signer.verify(new JcaSimpleSignerInfoVerifierBuilder().setProvider("BC").build(holder)));

            AttributeTable attributes = signer.getSignedAttributes();
            Time time = Time.getInstance(attributes.get(CMSAttributes.signingTime).getAttrValues().getObjectAt(0));
            assertEquals(signingTime, time.getDate().toInstant());
        }
    }

    @Test
    void ecKeysSignWithEcdsa() throws Exception {
        Instant now = TestFixtures.now();
        byte[] p12 = TestFixtures.p12("EC", now.minus(Duration.ofDays(1)), now.plus(Duration.ofDays(1)), null);
        byte[] content = "ec content".getBytes(StandardCharsets.US_ASCII);
        byte[] hash = MessageDigest.getInstance("SHA-256").digest(content);
        try (CertificateBundle bundle = store.load(p12, TestFixtures.PASSWORD)) {
            SignatureBytes signature = engine.sign(hash, bundle, now);
            assertEquals("SHA256withECDSA", signature.signatureAlgorithm());
            CMSSignedData cms = new CMSSignedData(new CMSProcessableByteArray(content), signature.encoded());
            SignerInformation signer = cms.getSignerInfos().getSigners().iterator().next();
            X509CertificateHolder holder = (X509CertificateHolder) cms.getCertificates().getMatches(signer.getSID()).iterator().next();
            assertTrue(signer.verify(new JcaSimpleSignerInfoVerifierBuilder().setProvider("BC").build(holder)));
        }
    }

    @Test
    void pssSchemeIsHonoured() throws Exception {
        SignatureEngine pss = new SignatureEngine(DigestAlgorithm.SHA384, RsaSignatureScheme.PSS);
        byte[] content = "pss content".getBytes(StandardCharsets.US_ASCII);
        byte[] hash = MessageDigest.getInstance("SHA-384").digest(content);
        try (CertificateBundle bundle = store.load(TestFixtures.ownerP12(), TestFixtures.PASSWORD)) {
            SignatureBytes signature = pss.sign(hash, bundle, TestFixtures.now());
            assertEquals("SHA384withRSAandMGF1", signature.signatureAlgorithm());
            CMSSignedData cms = new CMSSignedData(new CMSProcessableByteArray(content), signature.encoded());
            SignerInformation signer = cms.getSignerInfos().getSigners().iterator().next();
            X509CertificateHolder holder = (X509CertificateHolder) cms.getCertificates().getMatches(signer.getSID()).iterator().next();
            assertTrue(signer.verify(new JcaSimpleSignerInfoVerifierBuilder().setProvider("BC").build(holder)));
        }
    }

    @Test
    void hashOfWrongLengthIsRejected() throws Exception {
        try (CertificateBundle bundle = store.load(TestFixtures.ownerP12(), TestFixtures.PASSWORD)) {
            assertThrows(SigningException.class, () -> engine.sign(new byte[20], bundle, Instant.now()));
        }
    }
}
