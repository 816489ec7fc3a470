package com.dtrsign.signing;

import com.dtrsign.TestFixtures;
import com.dtrsign.config.SigningConfig;
import com.dtrsign.error.ErrorKind;
import com.dtrsign.error.InvalidCredentialsException;
import com.dtrsign.pdf.SignatureInspector;
import com.dtrsign.pdf.SignatureReport;
import com.dtrsign.pdf.stamp.StampRect;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.contentstream.operator.Operator;
import org.apache.pdfbox.cos.COSBase;
import org.apache.pdfbox.cos.COSName;
import org.apache.pdfbox.cos.COSNumber;
import org.apache.pdfbox.pdfparser.PDFStreamParser;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.graphics.PDXObject;
import org.apache.pdfbox.pdmodel.graphics.form.PDFormXObject;
import org.apache.pdfbox.pdmodel.graphics.image.PDImageXObject;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotation;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.form.PDSignatureField;
import org.apache.pdfbox.util.Matrix;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.CancellationException;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * End-to-end signing runs against the blank DTR template, verified with PDFBox.
 */
class SigningOrchestratorTest {

    private final SigningOrchestrator orchestrator = new SigningOrchestrator(SigningConfig.load());
    private final SignatureInspector inspector = new SignatureInspector();

    private static SigningRequest.Builder owner(byte[] pdf) throws Exception {
        return SigningRequest.builder()
                .pdf(pdf)
                .pkcs12(TestFixtures.ownerP12())
                .password(TestFixtures.PASSWORD)
                .image(TestFixtures.signatureImage())
                .role(SignerRole.OWNER);
    }

    private static SigningRequest.Builder incharge(byte[] pdf) throws Exception {
        return SigningRequest.builder()
                .pdf(pdf)
                .pkcs12(TestFixtures.inchargeP12())
                .password(TestFixtures.PASSWORD)
                .image(TestFixtures.signatureImage())
                .role(SignerRole.IN_CHARGE);
    }

    private static boolean startsWith(byte[] bytes, byte[] prefix) {
        return bytes.length >= prefix.length && Arrays.equals(bytes, 0, prefix.length, prefix, 0, prefix.length);
    }

    private static SignatureReport report(List<SignatureReport> reports, String fieldName) {
        return reports.stream().filter(r -> r.fieldName().equals(fieldName)).findFirst().orElseThrow();
    }

    private static Map<String, PDAnnotationWidget> signatureWidgets(PDDocument doc) throws IOException {
        Map<String, PDAnnotationWidget> widgets = new TreeMap<>();
        for (PDSignatureField field : doc.getSignatureFields()) {
            widgets.put(field.getFullyQualifiedName(), field.getWidgets().get(0));
        }
        return widgets;
    }

    private static void assertRect(StampRect expected, PDRectangle actual) {
        assertEquals(expected.llx(), actual.getLowerLeftX(), 0.01f);
        assertEquals(expected.lly(), actual.getLowerLeftY(), 0.01f);
        assertEquals(expected.urx(), actual.getUpperRightX(), 0.01f);
        assertEquals(expected.ury(), actual.getUpperRightY(), 0.01f);
    }

    /**
     * Transformation of every image drawn by {@code form}, nested forms included, in the form's own space.
     */
    private static List<Matrix> imagePlacements(PDFormXObject form, Matrix ctm) throws IOException {
        List<Matrix> found = new ArrayList<>();
        Deque<Matrix> saved = new ArrayDeque<>();
        Matrix current = form.getMatrix().multiply(ctm);
        List<COSBase> operands = new ArrayList<>();
        for (Object token : new PDFStreamParser(form).parse()) {
            if (token instanceof COSBase) {
                operands.add((COSBase) token);
                continue;
            }
            switch (((Operator) token).getName()) {
                case "q":
                    saved.push(current);
                    break;
                case "Q":
                    current = saved.pop();
                    break;
                case "cm":
                    Matrix cm = new Matrix(number(operands, 0), number(operands, 1), number(operands, 2),
                            number(operands, 3), number(operands, 4), number(operands, 5));
                    current = cm.multiply(current);
                    break;
                case "Do":
                    PDXObject xObject = form.getResources().getXObject((COSName) operands.get(0));
                    if (xObject instanceof PDImageXObject) {
                        found.add(current);
                    } else if (xObject instanceof PDFormXObject) {
                        found.addAll(imagePlacements((PDFormXObject) xObject, current));
                    }
                    break;
                default:
                    break;
            }
            operands.clear();
        }
        return found;
    }

    private static float number(List<COSBase> operands, int index) {
        return ((COSNumber) operands.get(index)).floatValue();
    }

    @Test
    void ownerSignsBothCopies() throws Exception {
        byte[] original = TestFixtures.dtr();
        SigningResult result = orchestrator.sign(owner(original).build());

        assertTrue(result.isSuccess());
        byte[] signed = result.requireSuccess();
        assertTrue(signed.length > original.length);
        assertTrue(startsWith(signed, original));
        assertEquals(List.of("OwnerSignature1", "OwnerSignature2"),
                result.outcomes().stream().map(FieldOutcome::fieldName).toList());
        assertEquals(2, result.fields().size());

        List<SignatureReport> reports = inspector.inspect(signed);
        assertEquals(2, reports.size());
        for (SignatureReport report : reports) {
            assertTrue(report.cmsValid(), report.error());
            assertEquals(1, report.page());
            assertEquals("adbe.pkcs7.detached", report.subFilter());
        }
    }

    @Test
    @DisplayName("Owner then in-charge: every revision still verifies")
    void ownerThenInchargeChain() throws Exception {
        byte[] original = TestFixtures.dtr();
        SigningResult result = orchestrator.signChain(List.of(
                owner(original).build(),
                incharge(original).build()));

        assertTrue(result.isSuccess());
        byte[] signed = result.document();
        assertTrue(startsWith(signed, original));
        assertEquals(List.of("OwnerSignature1", "OwnerSignature2", "InchargeSignature1", "InchargeSignature2"),
                result.outcomes().stream().map(FieldOutcome::fieldName).toList());

        List<SignatureReport> reports = inspector.inspect(signed);
        assertEquals(4, reports.size());
        assertTrue(reports.stream().allMatch(SignatureReport::cmsValid));
        long wholeDocument = reports.stream().filter(SignatureReport::coversWholeDocument).count();
        assertEquals(1, wholeDocument);
        SignatureReport last = reports.stream().filter(SignatureReport::coversWholeDocument).findFirst().orElseThrow();
        assertEquals("InchargeSignature2", last.fieldName());
        assertTrue(last.signerSubject().contains("Ivan Incharge"));
    }

    @Test
    void ownerSignatureCoversExactlyTheOwnerRevision() throws Exception {
        byte[] ownerOut = orchestrator.sign(owner(TestFixtures.dtr()).build()).requireSuccess();
        byte[] signed = orchestrator.sign(incharge(ownerOut).build()).requireSuccess();

        assertTrue(startsWith(signed, ownerOut));
        List<SignatureReport> reports = inspector.inspect(signed);
        SignatureReport ownerLast = report(reports, "OwnerSignature2");
        assertTrue(ownerLast.cmsValid(), ownerLast.error());
        assertEquals(ownerOut.length, ownerLast.coveredLength());
        assertTrue(report(reports, "OwnerSignature1").coveredLength() < ownerOut.length);
        assertTrue(report(reports, "InchargeSignature2").coversWholeDocument());
        assertTrue(report(reports, "InchargeSignature1").coveredLength() < signed.length);
    }

    @Test
    void chainLeavesCallerPasswordsAlone() throws Exception {
        byte[] original = TestFixtures.dtr();
        SigningRequest first = owner(original).build();
        SigningRequest second = incharge(original).build();

        assertTrue(orchestrator.signChain(List.of(first, second)).isSuccess());
        assertArrayEquals(TestFixtures.PASSWORD, first.password());
        assertArrayEquals(TestFixtures.PASSWORD, second.password());
    }

    @Test
    @DisplayName("200x100 stamp at scale 0.9 is drawn at rect * 0.9, centred in the widget")
    void stampGeometryInSignedDocument() throws Exception {
        StampRect rect = new StampRect(100f, 400f, 300f, 500f);
        SigningResult result = orchestrator.sign(owner(TestFixtures.dtr())
                .image(TestFixtures.signatureImage(200, 100))
                .rect(rect)
                .scaleFactor(0.9)
                .build());
        assertTrue(result.isSuccess());

        try (PDDocument doc = Loader.loadPDF(result.document())) {
            PDAnnotationWidget widget = signatureWidgets(doc).get("OwnerSignature1");
            assertRect(rect, widget.getRectangle());

            List<Matrix> images = imagePlacements(widget.getNormalAppearanceStream(), new Matrix());
            assertEquals(1, images.size());
            Matrix image = images.get(0);
            assertEquals(180f, image.getValue(0, 0), 0.5f);
            assertEquals(90f, image.getValue(1, 1), 0.5f);
            assertEquals(110f, rect.llx() + image.getValue(2, 0), 0.5f);
            assertEquals(405f, rect.lly() + image.getValue(2, 1), 0.5f);
        }
    }

    @Test
    void preparedEmptyFieldIsSignedInPlace() throws Exception {
        StampRect prepared = new StampRect(60f, 300f, 240f, 360f);
        byte[] original = TestFixtures.dtrWithEmptySignatureField("InchargeSignature1", prepared);

        SigningResult result = orchestrator.sign(incharge(original).build());

        assertTrue(result.isSuccess());
        assertEquals(List.of("InchargeSignature1", "InchargeSignature2"),
                result.outcomes().stream().map(FieldOutcome::fieldName).toList());
        byte[] signed = result.document();
        assertTrue(startsWith(signed, original));

        List<SignatureReport> reports = inspector.inspect(signed);
        assertEquals(2, reports.size());
        assertTrue(reports.stream().allMatch(SignatureReport::cmsValid));
        try (PDDocument doc = Loader.loadPDF(signed)) {
            Map<String, PDAnnotationWidget> widgets = signatureWidgets(doc);
            assertEquals(List.of("InchargeSignature1", "InchargeSignature2"), new ArrayList<>(widgets.keySet()));
            assertRect(prepared, widgets.get("InchargeSignature1").getRectangle());
            assertEquals(1, imagePlacements(widgets.get("InchargeSignature1").getNormalAppearanceStream(),
                    new Matrix()).size());
        }
    }

    @Test
    void wholeMonthStampsEveryDay() throws Exception {
        SigningResult result = orchestrator.sign(owner(TestFixtures.dtr()).wholeMonth(true).build());

        assertTrue(result.isSuccess());
        assertEquals(1, result.fields().size());
        byte[] signed = result.document();
        assertTrue(inspector.allValid(signed));
        try (PDDocument doc = Loader.loadPDF(signed)) {
            List<PDAnnotation> annotations = doc.getPage(0).getAnnotations();
            long stamps = annotations.stream().filter(a -> "Stamp".equals(a.getSubtype())).count();
            assertEquals(30, stamps);
        }
    }

    @Test
    void partialMonthFitsInTheGrid() throws Exception {
        SigningResult result = orchestrator.sign(owner(TestFixtures.dtr()).wholeMonth(true).dayCount(15).build());
        assertTrue(result.isSuccess());
        try (PDDocument doc = Loader.loadPDF(result.document())) {
            long stamps = doc.getPage(0).getAnnotations().stream()
                    .filter(a -> "Stamp".equals(a.getSubtype())).count();
            assertEquals(14, stamps);
        }
    }

    @Test
    void wrongPasswordLeavesDocumentUntouched() throws Exception {
        byte[] original = TestFixtures.dtr();
        SigningResult result = orchestrator.sign(owner(original).password("nope".toCharArray()).build());

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.INVALID_CREDENTIALS, result.errorKind().orElseThrow());
        assertArrayEquals(original, result.document());
        assertFalse(result.outcomes().get(0).success());
        assertThrows(InvalidCredentialsException.class, result::requireSuccess);
    }

    @Test
    void expiredCertificateIsRejected() throws Exception {
        Instant now = TestFixtures.now();
        byte[] p12 = TestFixtures.p12("RSA", now.minus(Duration.ofDays(30)), now.minus(Duration.ofDays(1)), null);
        SigningOrchestrator fixed = new SigningOrchestrator(SigningConfig.load(), Clock.fixed(now, ZoneOffset.UTC));

        byte[] original = TestFixtures.dtr();
        SigningResult result = fixed.sign(owner(original).pkcs12(p12).build());

        assertEquals(ErrorKind.EXPIRED_CERTIFICATE, result.errorKind().orElseThrow());
        assertArrayEquals(original, result.document());
    }

    @Test
    void rectangleOffThePageIsRejected() throws Exception {
        byte[] original = TestFixtures.dtr();
        SigningResult result = orchestrator.sign(owner(original)
                .rect(new StampRect(500f, 700f, 700f, 760f))
                .build());
        assertEquals(ErrorKind.PLACEMENT_OUT_OF_BOUNDS, result.errorKind().orElseThrow());
        assertArrayEquals(original, result.document());
    }

    @Test
    void thirtyTwoDaysExceedTheGrid() throws Exception {
        byte[] original = TestFixtures.dtr();
        SigningResult result = orchestrator.sign(owner(original).wholeMonth(true).dayCount(32).build());
        assertEquals(ErrorKind.GRID_CAPACITY_EXCEEDED, result.errorKind().orElseThrow());
        assertArrayEquals(original, result.document());
    }

    @Test
    void failedChainReturnsOriginal() throws Exception {
        byte[] original = TestFixtures.dtr();
        SigningResult result = orchestrator.signChain(List.of(
                owner(original).build(),
                incharge(original).password("wrong".toCharArray()).build()));

        assertFalse(result.isSuccess());
        assertEquals(ErrorKind.INVALID_CREDENTIALS, result.errorKind().orElseThrow());
        assertArrayEquals(original, result.document());
    }

    @Test
    void leaveApplicationOwnerSlot() throws Exception {
        SigningResult result = orchestrator.sign(owner(TestFixtures.dtr())
                .kind(DocumentKind.LEAVE_APPLICATION)
                .build());
        assertTrue(result.isSuccess());
        assertEquals(List.of("OwnerSignature1"), result.outcomes().stream().map(FieldOutcome::fieldName).toList());
        assertTrue(inspector.allValid(result.document()));
    }

    @Test
    void passwordCopyIsClearedAfterSigning() throws Exception {
        SigningRequest request = owner(TestFixtures.dtr()).build();
        orchestrator.sign(request);
        for (char c : request.password()) {
            assertEquals('\0', c);
        }
        assertEquals('1', TestFixtures.PASSWORD[0]);
    }

    @Test
    void interruptedCallerAborts() throws Exception {
        SigningRequest request = owner(TestFixtures.dtr()).build();
        Thread.currentThread().interrupt();
        try {
            assertThrows(CancellationException.class, () -> orchestrator.sign(request));
        } finally {
            Thread.interrupted();
        }
    }

    @Test
    void executorSignsOffThread() throws Exception {
        try (SigningExecutor executor = new SigningExecutor(orchestrator, 2)) {
            SigningResult result = executor.submit(owner(TestFixtures.dtr()).build()).get(60, TimeUnit.SECONDS);
            assertTrue(result.isSuccess());
            assertTrue(inspector.allValid(result.document()));
        }
    }
}
