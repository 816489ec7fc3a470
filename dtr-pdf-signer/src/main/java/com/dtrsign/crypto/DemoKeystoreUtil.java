package com.dtrsign.crypto;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.PublicKey;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Objects;

/**
 * Generates throw-away PKCS#12 bundles for local runs and tests.
 */
public final class DemoKeystoreUtil {

    public static final String DEMO_ALIAS = "demo";

    private static final SecureRandom SERIALS = new SecureRandom();

    private DemoKeystoreUtil() {
    }

    public static final class Params {
        private String commonName = "Demo Signer";
        private String keyAlgorithm = "RSA";
        private Instant notBefore = Instant.now().minus(Duration.ofHours(1));
        private Instant notAfter = Instant.now().plus(Duration.ofDays(365));
        private Integer keyUsage;
        private boolean issuedByDemoCa;

        public String getCommonName() {
            return commonName;
        }

        public void setCommonName(String commonName) {
            this.commonName = commonName;
        }

        public String getKeyAlgorithm() {
            return keyAlgorithm;
        }

        /**
         * {@code RSA}, {@code EC} or {@code DSA}; the latter only exists to exercise rejection paths.
         */
        public void setKeyAlgorithm(String keyAlgorithm) {
            this.keyAlgorithm = keyAlgorithm;
        }

        public Instant getNotBefore() {
            return notBefore;
        }

        public void setNotBefore(Instant notBefore) {
            this.notBefore = notBefore;
        }

        public Instant getNotAfter() {
            return notAfter;
        }

        public void setNotAfter(Instant notAfter) {
            this.notAfter = notAfter;
        }

        public Integer getKeyUsage() {
            return keyUsage;
        }

        /**
         * BouncyCastle {@link KeyUsage} bit mask, or {@code null} to omit the extension.
         */
        public void setKeyUsage(Integer keyUsage) {
            this.keyUsage = keyUsage;
        }

        public boolean isIssuedByDemoCa() {
            return issuedByDemoCa;
        }

        public void setIssuedByDemoCa(boolean issuedByDemoCa) {
            this.issuedByDemoCa = issuedByDemoCa;
        }
    }

    public static byte[] createPkcs12(char[] password, String commonName) throws GeneralSecurityException, IOException {
        Params params = new Params();
        params.setCommonName(commonName);
        return createPkcs12(password, params);
    }

    public static byte[] createPkcs12(char[] password, Params params) throws GeneralSecurityException, IOException {
        Objects.requireNonNull(password, "password");
        Objects.requireNonNull(params, "params");
        CryptoProviders.ensureBouncyCastle();

        KeyPair leafPair = generateKeyPair(params.getKeyAlgorithm());
        X500Name subject = new X500Name("CN=" + params.getCommonName());
        Certificate[] chain;
        if (params.isIssuedByDemoCa()) {
            KeyPair caPair = generateKeyPair("RSA");
            X500Name caName = new X500Name("CN=Demo Issuing CA");
            X509Certificate ca = buildCertificate(caName, caName, caPair.getPublic(), caPair.getPrivate(), "RSA",
                    params.getNotBefore(), params.getNotAfter().plus(Duration.ofDays(365)),
                    KeyUsage.keyCertSign | KeyUsage.cRLSign, true);
            X509Certificate leaf = buildCertificate(subject, caName, leafPair.getPublic(), caPair.getPrivate(), "RSA",
                    params.getNotBefore(), params.getNotAfter(), params.getKeyUsage(), false);
            chain = new Certificate[]{leaf, ca};
        } else {
            X509Certificate leaf = buildCertificate(subject, subject, leafPair.getPublic(), leafPair.getPrivate(),
                    params.getKeyAlgorithm(), params.getNotBefore(), params.getNotAfter(), params.getKeyUsage(), false);
            chain = new Certificate[]{leaf};
        }

        KeyStore ks = KeyStore.getInstance("PKCS12");
        ks.load(null, null);
        ks.setKeyEntry(DEMO_ALIAS, leafPair.getPrivate(), password, chain);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        ks.store(out, password);
        return out.toByteArray();
    }

    public static void writePkcs12(Path target, char[] password, Params params) throws GeneralSecurityException, IOException {
        Objects.requireNonNull(target, "target");
        Path parent = target.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(target, createPkcs12(password, params));
    }

    private static KeyPair generateKeyPair(String algorithm) throws GeneralSecurityException {
        KeyPairGenerator kpg = KeyPairGenerator.getInstance(algorithm);
        kpg.initialize("EC".equals(algorithm) ? 256 : 2048);
        return kpg.generateKeyPair();
    }

    private static X509Certificate buildCertificate(X500Name subject, X500Name issuer, PublicKey publicKey,
                                                    PrivateKey issuerKey, String issuerKeyAlgorithm,
                                                    Instant notBefore, Instant notAfter, Integer keyUsage,
                                                    boolean ca) throws GeneralSecurityException, IOException {
        JcaX509v3CertificateBuilder certBuilder = new JcaX509v3CertificateBuilder(
                issuer,
                new BigInteger(64, SERIALS).abs().add(BigInteger.ONE),
                Date.from(notBefore),
                Date.from(notAfter),
                subject,
                publicKey);
        if (ca) {
            certBuilder.addExtension(Extension.basicConstraints, true, new BasicConstraints(true));
        }
        if (keyUsage != null) {
            certBuilder.addExtension(Extension.keyUsage, true, new KeyUsage(keyUsage));
        }
        try {
            ContentSigner signer = new JcaContentSignerBuilder(signatureAlgorithm(issuerKeyAlgorithm))
                    .setProvider(BouncyCastleProvider.PROVIDER_NAME)
                    .build(issuerKey);
            X509CertificateHolder holder = certBuilder.build(signer);
            return new JcaX509CertificateConverter()
                    .setProvider(BouncyCastleProvider.PROVIDER_NAME)
                    .getCertificate(holder);
        } catch (OperatorCreationException e) {
            throw new GeneralSecurityException("Unable to build demo certificate for " + subject, e);
        }
    }

    private static String signatureAlgorithm(String keyAlgorithm) {
        switch (keyAlgorithm) {
            case "EC":
                return "SHA256withECDSA";
            case "DSA":
                return "SHA256withDSA";
            default:
                return "SHA256withRSA";
        }
    }
}
