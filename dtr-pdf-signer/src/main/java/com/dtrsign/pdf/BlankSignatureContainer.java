package com.dtrsign.pdf;

import com.itextpdf.text.pdf.PdfDictionary;
import com.itextpdf.text.pdf.PdfName;
import com.itextpdf.text.pdf.PdfObject;
import com.itextpdf.text.pdf.PdfString;
import com.itextpdf.text.pdf.security.ExternalSignatureContainer;

import java.io.InputStream;

/**
 * First pass of deferred signing: marks the dictionary as a detached PKCS#7 signature and leaves
 * {@code /Contents} zero-filled.
 */
final class BlankSignatureContainer implements ExternalSignatureContainer {

    private final String signerName;

    BlankSignatureContainer(String signerName) {
        this.signerName = signerName;
    }

    @Override
    public byte[] sign(InputStream data) {
        return new byte[0];
    }

    @Override
    public void modifySigningDictionary(PdfDictionary signDic) {
        signDic.put(PdfName.FILTER, PdfName.ADOBE_PPKLITE);
        signDic.put(PdfName.SUBFILTER, PdfName.ADBE_PKCS7_DETACHED);
        if (signerName != null && !signerName.isBlank()) {
            signDic.put(PdfName.NAME, new PdfString(signerName, PdfObject.TEXT_UNICODE));
        }
    }
}
