package com.dtrsign.pdf;

import com.dtrsign.crypto.ByteRange;
import com.dtrsign.crypto.CryptoProviders;
import com.dtrsign.error.DocumentStructureException;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.digitalsignature.PDSignature;
import org.apache.pdfbox.pdmodel.interactive.form.PDSignatureField;
import org.bouncycastle.asn1.cms.Attribute;
import org.bouncycastle.asn1.cms.AttributeTable;
import org.bouncycastle.asn1.cms.CMSAttributes;
import org.bouncycastle.asn1.cms.Time;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cms.CMSException;
import org.bouncycastle.cms.CMSProcessableByteArray;
import org.bouncycastle.cms.CMSSignedData;
import org.bouncycastle.cms.SignerInformation;
import org.bouncycastle.cms.jcajce.JcaSimpleSignerInfoVerifierBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.util.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.security.cert.CertificateException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Objects;

/**
 * Independent read-back of signed documents with PDFBox: enumerates signature fields and verifies each CMS
 * signature against the bytes its /ByteRange covers.
 */
public final class SignatureInspector {

    private static final Logger log = LoggerFactory.getLogger(SignatureInspector.class);

    public SignatureInspector() {
        CryptoProviders.ensureBouncyCastle();
    }

    public List<SignatureReport> inspect(byte[] pdf) throws DocumentStructureException {
        Objects.requireNonNull(pdf, "pdf");
        try (PDDocument doc = Loader.loadPDF(pdf)) {
            List<SignatureReport> reports = new ArrayList<>();
            for (PDSignatureField field : doc.getSignatureFields()) {
                PDSignature signature = field.getSignature();
                if (signature == null) {
                    continue;
                }
                reports.add(inspect(doc, field, signature, pdf));
            }
            return reports;
        } catch (IOException e) {
            throw new DocumentStructureException("Unable to read PDF for inspection: " + e.getMessage(), e);
        }
    }

    /**
     * True when the document carries at least one signature and every signature verifies.
     */
    public boolean allValid(byte[] pdf) throws DocumentStructureException {
        List<SignatureReport> reports = inspect(pdf);
        return !reports.isEmpty() && reports.stream().allMatch(SignatureReport::cmsValid);
    }

    private SignatureReport inspect(PDDocument doc, PDSignatureField field, PDSignature signature, byte[] pdf) {
        String name = field.getFullyQualifiedName();
        int page = pageOf(doc, field);
        int[] raw = signature.getByteRange();
        List<ByteRange> ranges = new ArrayList<>();
        if (raw != null) {
            for (int i = 0; i + 1 < raw.length; i += 2) {
                ranges.add(new ByteRange(raw[i], raw[i + 1]));
            }
        }
        boolean wholeDocument = !ranges.isEmpty() && ranges.get(ranges.size() - 1).end() == pdf.length;

        String subject = null;
        Instant signingTime = signature.getSignDate() == null ? null : signature.getSignDate().toInstant();
        boolean valid = false;
        String error = null;
        try {
            byte[] contents = signature.getContents(pdf);
            byte[] signedContent = signature.getSignedContent(pdf);
            CMSSignedData cms = new CMSSignedData(new CMSProcessableByteArray(signedContent), contents);
            SignerInformation signer = cms.getSignerInfos().getSigners().iterator().next();
            Store<X509CertificateHolder> certificates = cms.getCertificates();
            Collection<X509CertificateHolder> matches = certificates.getMatches(signer.getSID());
            Iterator<X509CertificateHolder> it = matches.iterator();
            if (!it.hasNext()) {
                error = "Signing certificate not embedded";
            } else {
                X509CertificateHolder holder = it.next();
                subject = holder.getSubject().toString();
                valid = signer.verify(new JcaSimpleSignerInfoVerifierBuilder()
                        .setProvider(BouncyCastleProvider.PROVIDER_NAME)
                        .build(holder));
                if (!valid) {
                    error = "CMS signature does not verify";
                }
            }
            Instant cmsTime = signingTimeOf(signer);
            if (cmsTime != null) {
                signingTime = cmsTime;
            }
        } catch (IOException | CMSException | OperatorCreationException | CertificateException | RuntimeException e) {
            error = e.getClass().getSimpleName() + ": " + e.getMessage();
        }

        log.debug("[inspect] field='{}' page={} byteRange={} wholeDoc={} valid={} signer='{}'",
                name, page, ranges, wholeDocument, valid, subject);
        return new SignatureReport(name, page, signature.getSubFilter(), subject, signingTime, ranges,
                wholeDocument, valid, error);
    }

    private static Instant signingTimeOf(SignerInformation signer) {
        AttributeTable attributes = signer.getSignedAttributes();
        if (attributes == null) {
            return null;
        }
        Attribute attribute = attributes.get(CMSAttributes.signingTime);
        if (attribute == null || attribute.getAttrValues().size() == 0) {
            return null;
        }
        return Time.getInstance(attribute.getAttrValues().getObjectAt(0)).getDate().toInstant();
    }

    private static int pageOf(PDDocument doc, PDSignatureField field) {
        List<PDAnnotationWidget> widgets = field.getWidgets();
        if (widgets.isEmpty() || widgets.get(0).getPage() == null) {
            return -1;
        }
        return doc.getPages().indexOf(widgets.get(0).getPage()) + 1;
    }
}
