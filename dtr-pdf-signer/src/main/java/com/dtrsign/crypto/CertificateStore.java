package com.dtrsign.crypto;

import com.dtrsign.error.ExpiredCertificateException;
import com.dtrsign.error.InvalidCredentialsException;
import com.dtrsign.error.MalformedCertificateException;
import com.dtrsign.error.UnsupportedKeyTypeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.crypto.BadPaddingException;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.Key;
import java.security.KeyStore;
import java.security.KeyStoreException;
import java.security.NoSuchAlgorithmException;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.UnrecoverableKeyException;
import java.security.cert.Certificate;
import java.security.cert.CertificateException;
import java.security.cert.CertificateExpiredException;
import java.security.cert.CertificateNotYetValidException;
import java.security.cert.X509Certificate;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Date;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * Parses password-protected PKCS#12 containers into {@link CertificateBundle}s. Works purely in memory.
 */
public final class CertificateStore {

    private static final Logger log = LoggerFactory.getLogger(CertificateStore.class);

    private static final Set<String> SUPPORTED_KEY_ALGORITHMS = Set.of("RSA", "EC", "ECDSA");
    private static final byte[] PAIRING_CHALLENGE = "dtr-signer key pairing challenge".getBytes(StandardCharsets.US_ASCII);
    private static final int DIGITAL_SIGNATURE_BIT = 0;

    private final Clock clock;

    public CertificateStore() {
        this(Clock.systemUTC());
    }

    public CertificateStore(Clock clock) {
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    public CertificateBundle load(byte[] pkcs12, char[] password)
            throws InvalidCredentialsException, MalformedCertificateException, UnsupportedKeyTypeException {
        if (pkcs12 == null || pkcs12.length == 0) {
            throw new MalformedCertificateException("PKCS#12 container is empty");
        }
        char[] pwd = password == null ? new char[0] : password.clone();
        try {
            KeyStore keyStore = openKeyStore(pkcs12, pwd);
            String alias = firstKeyAlias(keyStore);
            PrivateKey privateKey = recoverKey(keyStore, alias, pwd);
            List<X509Certificate> chain = readChain(keyStore, alias);

            requireSupportedKey(privateKey);
            requireMatchingPair(privateKey, chain.get(0));

            log.info("[certificate-store] loaded alias='{}' keyAlgorithm={} chainLength={} subject='{}'",
                    alias, privateKey.getAlgorithm(), chain.size(),
                    chain.get(0).getSubjectX500Principal().getName());
            return new CertificateBundle(privateKey, chain);
        } finally {
            Arrays.fill(pwd, '\0');
        }
    }

    public void validate(CertificateBundle bundle) throws ExpiredCertificateException, UnsupportedKeyTypeException {
        validate(bundle, clock.instant());
    }

    public void validate(CertificateBundle bundle, Instant at)
            throws ExpiredCertificateException, UnsupportedKeyTypeException {
        Objects.requireNonNull(bundle, "bundle");
        Objects.requireNonNull(at, "at");
        X509Certificate leaf = bundle.getSigningCertificate();
        try {
            leaf.checkValidity(Date.from(at));
        } catch (CertificateExpiredException e) {
            throw new ExpiredCertificateException("Signing certificate expired on "
                    + leaf.getNotAfter().toInstant(), e);
        } catch (CertificateNotYetValidException e) {
            throw new ExpiredCertificateException("Signing certificate is not valid before "
                    + leaf.getNotBefore().toInstant(), e);
        }
        boolean[] keyUsage = leaf.getKeyUsage();
        if (keyUsage != null && (keyUsage.length <= DIGITAL_SIGNATURE_BIT || !keyUsage[DIGITAL_SIGNATURE_BIT])) {
            throw new UnsupportedKeyTypeException("Certificate key usage does not permit digitalSignature: "
                    + leaf.getSubjectX500Principal().getName());
        }
        log.debug("[certificate-store] certificate valid at {} (notAfter={})", at, leaf.getNotAfter().toInstant());
    }

    private static KeyStore openKeyStore(byte[] pkcs12, char[] pwd)
            throws InvalidCredentialsException, MalformedCertificateException {
        try {
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(new ByteArrayInputStream(pkcs12), pwd);
            return keyStore;
        } catch (IOException e) {
            if (isPasswordFailure(e)) {
                throw new InvalidCredentialsException("PKCS#12 password is incorrect", e);
            }
            throw new MalformedCertificateException("Not a valid PKCS#12 container: " + e.getMessage(), e);
        } catch (KeyStoreException | NoSuchAlgorithmException | CertificateException | RuntimeException e) {
            throw new MalformedCertificateException("Not a valid PKCS#12 container: " + e.getMessage(), e);
        }
    }

    private static String firstKeyAlias(KeyStore keyStore) throws MalformedCertificateException {
        try {
            for (String alias : Collections.list(keyStore.aliases())) {
                if (keyStore.isKeyEntry(alias)) {
                    return alias;
                }
            }
        } catch (KeyStoreException e) {
            throw new MalformedCertificateException("Unable to enumerate PKCS#12 entries", e);
        }
        throw new MalformedCertificateException("No private key entry found in PKCS#12 container");
    }

    private static PrivateKey recoverKey(KeyStore keyStore, String alias, char[] pwd)
            throws InvalidCredentialsException, MalformedCertificateException {
        Key key;
        try {
            key = keyStore.getKey(alias, pwd);
        } catch (UnrecoverableKeyException e) {
            throw new InvalidCredentialsException("Private key entry '" + alias + "' cannot be decrypted with the given password", e);
        } catch (KeyStoreException | NoSuchAlgorithmException e) {
            throw new MalformedCertificateException("Private key entry '" + alias + "' is unreadable", e);
        }
        if (!(key instanceof PrivateKey)) {
            throw new MalformedCertificateException("Entry '" + alias + "' does not hold a private key");
        }
        return (PrivateKey) key;
    }

    private static List<X509Certificate> readChain(KeyStore keyStore, String alias) throws MalformedCertificateException {
        Certificate[] raw;
        try {
            raw = keyStore.getCertificateChain(alias);
        } catch (KeyStoreException e) {
            throw new MalformedCertificateException("Certificate chain for '" + alias + "' is unreadable", e);
        }
        if (raw == null || raw.length == 0) {
            throw new MalformedCertificateException("Certificate chain for '" + alias + "' is empty");
        }
        List<X509Certificate> chain = new ArrayList<>(raw.length);
        for (Certificate certificate : raw) {
            if (!(certificate instanceof X509Certificate)) {
                throw new MalformedCertificateException("Unsupported certificate type " + certificate.getType());
            }
            chain.add((X509Certificate) certificate);
        }
        return chain;
    }

    private static void requireSupportedKey(PrivateKey key) throws UnsupportedKeyTypeException {
        if (!SUPPORTED_KEY_ALGORITHMS.contains(key.getAlgorithm())) {
            throw new UnsupportedKeyTypeException("Unsupported private key algorithm '" + key.getAlgorithm()
                    + "'; only RSA and EC keys can sign");
        }
    }

    private static void requireMatchingPair(PrivateKey key, X509Certificate leaf) throws MalformedCertificateException {
        String algorithm = "RSA".equals(key.getAlgorithm()) ? "SHA256withRSA" : "SHA256withECDSA";
        try {
            Signature signer = Signature.getInstance(algorithm);
            signer.initSign(key);
            signer.update(PAIRING_CHALLENGE);
            byte[] challengeSignature = signer.sign();

            Signature verifier = Signature.getInstance(algorithm);
            verifier.initVerify(leaf.getPublicKey());
            verifier.update(PAIRING_CHALLENGE);
            if (verifier.verify(challengeSignature)) {
                return;
            }
        } catch (GeneralSecurityException e) {
            throw new MalformedCertificateException("Private key does not match the leaf certificate "
                    + leaf.getSubjectX500Principal().getName(), e);
        }
        throw new MalformedCertificateException("Private key does not match the leaf certificate "
                + leaf.getSubjectX500Principal().getName());
    }

    private static boolean isPasswordFailure(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof UnrecoverableKeyException || t instanceof BadPaddingException) {
                return true;
            }
            String message = t.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains("password")) {
                return true;
            }
        }
        return false;
    }
}
