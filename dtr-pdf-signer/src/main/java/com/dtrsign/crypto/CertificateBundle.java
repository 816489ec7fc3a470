package com.dtrsign.crypto;

import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x500.style.IETFUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.security.auth.DestroyFailedException;
import java.security.PrivateKey;
import java.security.cert.X509Certificate;
import java.util.List;
import java.util.Objects;

/**
 * Decrypted private key plus its certificate chain (leaf first), scoped to a single signing request.
 * <p>
 * Always used with try-with-resources: {@link #close()} destroys the key where the provider allows it and
 * makes the bundle unusable.
 */
public final class CertificateBundle implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CertificateBundle.class);

    private final List<X509Certificate> chain;
    private final String keyAlgorithm;
    private PrivateKey privateKey;
    private volatile boolean closed;

    CertificateBundle(PrivateKey privateKey, List<X509Certificate> chain) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
        Objects.requireNonNull(chain, "chain");
        if (chain.isEmpty()) {
            throw new IllegalArgumentException("Certificate chain must not be empty");
        }
        this.chain = List.copyOf(chain);
        this.keyAlgorithm = privateKey.getAlgorithm();
    }

    public PrivateKey getPrivateKey() {
        ensureOpen();
        return privateKey;
    }

    public X509Certificate getSigningCertificate() {
        return chain.get(0);
    }

    public List<X509Certificate> getChain() {
        return chain;
    }

    public String getKeyAlgorithm() {
        return keyAlgorithm;
    }

    public boolean isEc() {
        return "EC".equals(keyAlgorithm) || "ECDSA".equals(keyAlgorithm);
    }

    /**
     * Common name of the signing certificate, falling back to the full subject DN.
     */
    public String getSignerName() {
        X509Certificate leaf = getSigningCertificate();
        X500Name subject = X500Name.getInstance(leaf.getSubjectX500Principal().getEncoded());
        RDN[] cn = subject.getRDNs(BCStyle.CN);
        if (cn.length > 0 && cn[0].getFirst() != null) {
            return IETFUtils.valueToString(cn[0].getFirst().getValue());
        }
        return leaf.getSubjectX500Principal().getName();
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        PrivateKey key = privateKey;
        privateKey = null;
        if (key == null || key.isDestroyed()) {
            return;
        }
        try {
            key.destroy();
            log.debug("[bundle] private key destroyed");
        } catch (DestroyFailedException e) {
            log.debug("[bundle] {} key of class {} cannot be destroyed in place; reference released",
                    keyAlgorithm, key.getClass().getSimpleName());
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Certificate bundle has already been released");
        }
    }
}
