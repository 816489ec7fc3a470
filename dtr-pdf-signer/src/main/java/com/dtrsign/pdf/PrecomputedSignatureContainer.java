package com.dtrsign.pdf;

import com.dtrsign.crypto.DigestAlgorithm;
import com.itextpdf.text.pdf.PdfDictionary;
import com.itextpdf.text.pdf.security.ExternalSignatureContainer;

import java.io.IOException;
import java.io.InputStream;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;

/**
 * Second pass of deferred signing: hands back an already built CMS blob after checking that the byte ranges
 * still hash to the digest it was built over.
 */
final class PrecomputedSignatureContainer implements ExternalSignatureContainer {

    private final byte[] cms;
    private final DigestAlgorithm digestAlgorithm;
    private final byte[] expectedDigest;

    PrecomputedSignatureContainer(byte[] cms, DigestAlgorithm digestAlgorithm, byte[] expectedDigest) {
        this.cms = cms;
        this.digestAlgorithm = digestAlgorithm;
        this.expectedDigest = expectedDigest;
    }

    @Override
    public byte[] sign(InputStream data) throws GeneralSecurityException {
        MessageDigest md = MessageDigest.getInstance(digestAlgorithm.getJcaName());
        byte[] buffer = new byte[8192];
        try {
            int n;
            while ((n = data.read(buffer)) > 0) {
                md.update(buffer, 0, n);
            }
        } catch (IOException e) {
            throw new GeneralSecurityException("Unable to read signed byte ranges", e);
        }
        if (!MessageDigest.isEqual(md.digest(), expectedDigest)) {
            throw new GeneralSecurityException("Signed byte ranges changed after the digest was taken");
        }
        return cms;
    }

    @Override
    public void modifySigningDictionary(PdfDictionary signDic) {
        // dictionary was written when the placeholder was reserved
    }
}
