package com.dtrsign.crypto;

import com.dtrsign.error.DocumentStructureException;
import com.dtrsign.error.SigningException;
import org.bouncycastle.asn1.ASN1EncodableVector;
import org.bouncycastle.asn1.DEROctetString;
import org.bouncycastle.asn1.DERSet;
import org.bouncycastle.asn1.cms.Attribute;
import org.bouncycastle.asn1.cms.AttributeTable;
import org.bouncycastle.asn1.cms.CMSAttributes;
import org.bouncycastle.asn1.cms.Time;
import org.bouncycastle.cert.jcajce.JcaCertStore;
import org.bouncycastle.cms.CMSAbsentContent;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.CMSSignedDataGenerator;
import org.bouncycastle.cms.DefaultSignedAttributeTableGenerator;
import org.bouncycastle.cms.SignerInfoGenerator;
import org.bouncycastle.cms.jcajce.JcaSignerInfoGeneratorBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.operator.jcajce.JcaDigestCalculatorProviderBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.cert.CertificateEncodingException;
import java.security.cert.X509Certificate;
import java.time.Instant;
import java.util.Date;
import java.util.List;
import java.util.Objects;

/**
 * Digests the signed byte ranges of a document and wraps a precomputed digest in a detached CMS SignedData.
 */
public final class SignatureEngine {

    private static final Logger log = LoggerFactory.getLogger(SignatureEngine.class);

    private final DigestAlgorithm digestAlgorithm;
    private final RsaSignatureScheme rsaScheme;

    public SignatureEngine() {
        this(DigestAlgorithm.SHA256, RsaSignatureScheme.PKCS1_V15);
    }

    public SignatureEngine(DigestAlgorithm digestAlgorithm, RsaSignatureScheme rsaScheme) {
        this.digestAlgorithm = Objects.requireNonNull(digestAlgorithm, "digestAlgorithm");
        this.rsaScheme = Objects.requireNonNull(rsaScheme, "rsaScheme");
        CryptoProviders.ensureBouncyCastle();
    }

    public DigestAlgorithm getDigestAlgorithm() {
        return digestAlgorithm;
    }

    public RsaSignatureScheme getRsaScheme() {
        return rsaScheme;
    }

    /**
     * Hashes {@code ranges} of {@code document} in order. The ranges must be the two spans around a single
     * signature placeholder: {@code [0, a]} and {@code [b, length - b]} with {@code a < b}.
     */
    public byte[] digest(byte[] document, List<ByteRange> ranges) throws DocumentStructureException {
        Objects.requireNonNull(document, "document");
        requirePlaceholderGap(ranges, document.length);
        MessageDigest md = newMessageDigest();
        for (ByteRange range : ranges) {
            md.update(document, (int) range.offset(), (int) range.length());
        }
        byte[] hash = md.digest();
        log.debug("[engine] {} over ranges {} of {} bytes", digestAlgorithm.getJcaName(), ranges, document.length);
        return hash;
    }

    public SignatureBytes sign(byte[] hash, CertificateBundle bundle, Instant signingTime) throws SigningException {
        Objects.requireNonNull(hash, "hash");
        Objects.requireNonNull(bundle, "bundle");
        Objects.requireNonNull(signingTime, "signingTime");
        if (hash.length != digestAlgorithm.getDigestLength()) {
            throw new SigningException("Digest length " + hash.length + " does not match "
                    + digestAlgorithm.getJcaName() + " (" + digestAlgorithm.getDigestLength() + " bytes)");
        }
        String signatureAlgorithm = signatureAlgorithmFor(bundle);
        X509Certificate leaf = bundle.getSigningCertificate();
        try {
            ASN1EncodableVector signedAttributes = new ASN1EncodableVector();
            signedAttributes.add(new Attribute(CMSAttributes.messageDigest, new DERSet(new DEROctetString(hash))));
            signedAttributes.add(new Attribute(CMSAttributes.signingTime, new DERSet(new Time(Date.from(signingTime)))));

            ContentSigner contentSigner = new JcaContentSignerBuilder(signatureAlgorithm)
                    .setProvider(BouncyCastleProvider.PROVIDER_NAME)
                    .build(bundle.getPrivateKey());
            SignerInfoGenerator signerInfo = new JcaSignerInfoGeneratorBuilder(
                    new JcaDigestCalculatorProviderBuilder().setProvider(BouncyCastleProvider.PROVIDER_NAME).build())
                    .setSignedAttributeGenerator(new DefaultSignedAttributeTableGenerator(new AttributeTable(signedAttributes)))
                    .build(contentSigner, leaf);

            CMSSignedDataGenerator generator = new CMSSignedDataGenerator();
            generator.addSignerInfoGenerator(signerInfo);
            generator.addCertificates(new JcaCertStore(bundle.getChain()));
            CMSSignedData signedData = generator.generate(new CMSAbsentContent(), false);
            byte[] encoded = signedData.getEncoded();

            log.info("[engine] CMS {} signature built for '{}' ({} bytes, chain={})",
                    signatureAlgorithm, bundle.getSignerName(), encoded.length, bundle.getChain().size());
            return new SignatureBytes(encoded, signingTime, leaf.getSubjectX500Principal().getName(),
                    digestAlgorithm, signatureAlgorithm);
        } catch (OperatorCreationException | CertificateEncodingException | CMSException | IOException e) {
            throw new SigningException("CMS signature generation failed with " + signatureAlgorithm + ": " + e.getMessage(), e);
        }
    }

    private String signatureAlgorithmFor(CertificateBundle bundle) throws SigningException {
        String prefix = digestAlgorithm.getSignaturePrefix();
        if (bundle.isEc()) {
            return prefix + "withECDSA";
        }
        if (!"RSA".equals(bundle.getKeyAlgorithm())) {
            throw new SigningException("No signature scheme for key algorithm " + bundle.getKeyAlgorithm());
        }
        return rsaScheme == RsaSignatureScheme.PSS ? prefix + "withRSAandMGF1" : prefix + "withRSA";
    }

    private MessageDigest newMessageDigest() {
        try {
            return MessageDigest.getInstance(digestAlgorithm.getJcaName());
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(digestAlgorithm.getJcaName() + " is not available", e);
        }
    }

    public static void requirePlaceholderGap(List<ByteRange> ranges, long documentLength) throws DocumentStructureException {
        if (ranges == null || ranges.size() != 2) {
            throw new DocumentStructureException("Expected exactly two byte ranges around the signature placeholder, got "
                    + (ranges == null ? "none" : ranges.toString()));
        }
        ByteRange head = ranges.get(0);
        ByteRange tail = ranges.get(1);
        if (head.offset() != 0) {
            throw new DocumentStructureException("First byte range must start at 0: " + head);
        }
        if (tail.offset() <= head.end()) {
            throw new DocumentStructureException("Byte ranges " + ranges + " leave no room for the placeholder");
        }
        if (tail.end() != documentLength) {
            throw new DocumentStructureException("Byte ranges " + ranges + " do not end at document length " + documentLength);
        }
    }
}
