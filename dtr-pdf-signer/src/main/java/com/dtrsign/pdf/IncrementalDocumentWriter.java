package com.dtrsign.pdf;

import com.dtrsign.config.SigningConfig;
import com.dtrsign.crypto.ByteRange;
import com.dtrsign.crypto.SignatureBytes;
import com.dtrsign.crypto.SignatureEngine;
import com.dtrsign.error.DocumentStructureException;
import com.dtrsign.error.PlacementOutOfBoundsException;
import com.dtrsign.error.ReservedSpaceExhaustedException;
import com.dtrsign.pdf.stamp.StampAppearance;
import com.dtrsign.pdf.stamp.StampRaster;
import com.dtrsign.pdf.stamp.StampRect;
import com.itextpdf.text.DocumentException;
import com.itextpdf.text.Element;
import com.itextpdf.text.Font;
import com.itextpdf.text.Image;
import com.itextpdf.text.Phrase;
import com.itextpdf.text.Rectangle;
import com.itextpdf.text.pdf.AcroFields;
import com.itextpdf.text.pdf.ColumnText;
import com.itextpdf.text.pdf.PdfAnnotation;
import com.itextpdf.text.pdf.PdfArray;
import com.itextpdf.text.pdf.PdfDictionary;
import com.itextpdf.text.pdf.PdfName;
import com.itextpdf.text.pdf.PdfReader;
import com.itextpdf.text.pdf.PdfSignatureAppearance;
import com.itextpdf.text.pdf.PdfStamper;
import com.itextpdf.text.pdf.PdfTemplate;
import com.itextpdf.text.pdf.security.MakeSignature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Calendar;
import java.util.GregorianCalendar;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;

/**
 * Appends signature revisions to a PDF with iText 5 in append mode. Each signature goes through
 * {@link #reserve}, {@link #digest} and {@link #finalizeSignature}; bytes of earlier
 * revisions are never rewritten.
 */
public final class IncrementalDocumentWriter {

    private static final Logger log = LoggerFactory.getLogger(IncrementalDocumentWriter.class);

    public static final String HEADER_ERROR = "PDF header not at byte 0 (BOM or stray bytes), signatures would be ignored.";

    private static final byte[] PDF_MAGIC = "%PDF-".getBytes(StandardCharsets.US_ASCII);
    private static final DateTimeFormatter CAPTION_TIME = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss z");

    private final int reservedSignatureSize;
    private final String reason;
    private final String location;
    private final String contact;
    private final boolean captionEnabled;
    private final ZoneId zone;

    public IncrementalDocumentWriter(SigningConfig config) {
        this(config, ZoneId.systemDefault());
    }

    public IncrementalDocumentWriter(SigningConfig config, ZoneId zone) {
        Objects.requireNonNull(config, "config");
        this.reservedSignatureSize = config.getReservedSignatureSize();
        this.reason = config.getReason();
        this.location = config.getLocation();
        this.contact = config.getContact();
        this.captionEnabled = config.isCaptionEnabled();
        this.zone = Objects.requireNonNull(zone, "zone");
    }

    public BaseDocument open(byte[] pdf) throws DocumentStructureException {
        Objects.requireNonNull(pdf, "pdf");
        if (pdf.length < PDF_MAGIC.length || Arrays.mismatch(pdf, 0, PDF_MAGIC.length, PDF_MAGIC, 0, PDF_MAGIC.length) != -1) {
            throw new DocumentStructureException(HEADER_ERROR);
        }
        PdfReader reader;
        try {
            reader = new PdfReader(pdf);
        } catch (IOException | RuntimeException e) {
            throw new DocumentStructureException("Unable to parse PDF: " + e.getMessage(), e);
        }
        try {
            if (reader.isRebuilt()) {
                throw new DocumentStructureException("Cross-reference table is damaged; appending a revision would invalidate it");
            }
            if (reader.isEncrypted()) {
                throw new DocumentStructureException("Encrypted documents cannot be signed incrementally");
            }
            List<StampRect> mediaBoxes = new ArrayList<>(reader.getNumberOfPages());
            for (int page = 1; page <= reader.getNumberOfPages(); page++) {
                Rectangle box = reader.getPageSize(page);
                mediaBoxes.add(new StampRect(box.getLeft(), box.getBottom(), box.getRight(), box.getTop()));
            }
            AcroFields fields = reader.getAcroFields();
            Set<String> fieldNames = new LinkedHashSet<>(fields.getFields().keySet());
            List<String> signatureNames = fields.getSignatureNames();
            Map<String, EmptySignatureField> emptySignatureFields = emptySignatureFields(fields);
            log.debug("[writer] opened {}B pages={} fields={} signatures={} emptySignatureFields={}", pdf.length,
                    mediaBoxes.size(), fieldNames.size(), signatureNames, emptySignatureFields.keySet());
            return new BaseDocument(pdf.clone(), mediaBoxes, fieldNames, signatureNames, emptySignatureFields);
        } catch (IllegalArgumentException e) {
            throw new DocumentStructureException("Page without a usable media box: " + e.getMessage(), e);
        } finally {
            reader.close();
        }
    }

    /**
     * Appends a revision holding signature field {@code fieldName}: the first appearance becomes the visible
     * signature widget, the rest are printable, locked stamp annotations of the same revision. When
     * {@code fieldName} is an unsigned signature field of {@code base}, that field is signed and the first
     * appearance must sit exactly on its widget.
     */
    public ReservedDocument reserve(BaseDocument base, String fieldName, List<StampAppearance> appearances,
                                    String signerName, Instant signingTime)
            throws DocumentStructureException, PlacementOutOfBoundsException {
        Objects.requireNonNull(base, "base");
        Objects.requireNonNull(fieldName, "fieldName");
        Objects.requireNonNull(signingTime, "signingTime");
        if (appearances == null || appearances.isEmpty()) {
            throw new IllegalArgumentException("At least one stamp appearance is required");
        }
        EmptySignatureField existing = base.emptySignatureField(fieldName).orElse(null);
        if (existing == null && base.fieldNames().contains(fieldName)) {
            throw new IllegalArgumentException("Field '" + fieldName + "' already exists in the document");
        }
        if (existing != null && (appearances.get(0).page() != existing.page()
                || !appearances.get(0).widgetRect().equals(existing.rect()))) {
            throw new IllegalArgumentException("Empty signature field '" + fieldName + "' sits at " + existing.rect()
                    + " on page " + existing.page() + ", stamp was placed at " + appearances.get(0).widgetRect()
                    + " on page " + appearances.get(0).page());
        }
        for (StampAppearance stamp : appearances) {
            StampRect mediaBox = base.pageSize(stamp.page());
            if (!stamp.widgetRect().isWithin(mediaBox)) {
                throw new PlacementOutOfBoundsException("Stamp rectangle " + stamp.widgetRect()
                        + " exceeds media box " + mediaBox + " of page " + stamp.page());
            }
        }

        byte[] out;
        PdfReader reader = null;
        try {
            reader = new PdfReader(base.rawBytes());
            ByteArrayOutputStream os = new ByteArrayOutputStream(base.length() + 2 * reservedSignatureSize + 65536);
            PdfStamper stamper = PdfStamper.createSignature(reader, os, '\0', null, true);
            log.debug("[writer] createSignature append=true field='{}'", fieldName);

            PdfSignatureAppearance appearance = stamper.getSignatureAppearance();
            if (reason != null && !reason.isBlank()) {
                appearance.setReason(reason);
            }
            if (location != null && !location.isBlank()) {
                appearance.setLocation(location);
            }
            if (contact != null && !contact.isBlank()) {
                appearance.setContact(contact);
            }
            appearance.setSignDate(toCalendar(signingTime));

            StampAppearance primary = appearances.get(0);
            if (existing != null) {
                appearance.setVisibleSignature(fieldName);
                log.debug("[writer] signing existing empty field='{}' page={} rect={}", fieldName, existing.page(),
                        existing.rect());
            } else {
                appearance.setVisibleSignature(toRectangle(primary.widgetRect()), primary.page(), fieldName);
            }
            Image image = toImage(primary.raster());
            PdfTemplate layer2 = appearance.getLayer(2);
            drawImage(layer2, primary, image);
            if (captionEnabled) {
                drawCaption(layer2, primary.widgetRect(), signerName, signingTime);
            }
            for (int i = 1; i < appearances.size(); i++) {
                addStampAnnotation(stamper, appearances.get(i), image, fieldName, i, signerName);
            }

            MakeSignature.signExternalContainer(appearance, new BlankSignatureContainer(signerName), reservedSignatureSize);
            out = os.toByteArray();
        } catch (IOException | DocumentException | GeneralSecurityException e) {
            throw new DocumentStructureException("Unable to reserve signature field '" + fieldName + "': "
                    + e.getMessage(), e);
        } finally {
            if (reader != null) {
                reader.close();
            }
        }

        requirePrefixUnchanged(base.rawBytes(), out);
        List<ByteRange> ranges = readByteRange(out, fieldName);
        SignatureEngine.requirePlaceholderGap(ranges, out.length);
        ReservedDocument reserved = new ReservedDocument(base, out, fieldName, ranges);
        log.info("[writer] reserved field='{}' page={} appearances={} size={}B byteRange={} capacity={}B",
                fieldName, primary(appearances).page(), appearances.size(), out.length, ranges,
                reserved.signatureCapacity());
        return reserved;
    }

    public DigestedDocument digest(ReservedDocument reserved, SignatureEngine engine) throws DocumentStructureException {
        Objects.requireNonNull(reserved, "reserved");
        Objects.requireNonNull(engine, "engine");
        byte[] hash = engine.digest(reserved.rawBytes(), reserved.byteRanges());
        return new DigestedDocument(reserved, hash, engine.getDigestAlgorithm());
    }

    /**
     * Writes {@code signature} hex encoded into the reserved placeholder, zero padded. The result has exactly the
     * length of the reserved document.
     */
    public FinalizedDocument finalizeSignature(DigestedDocument digested, SignatureBytes signature)
            throws ReservedSpaceExhaustedException, DocumentStructureException {
        Objects.requireNonNull(digested, "digested");
        Objects.requireNonNull(signature, "signature");
        ReservedDocument reserved = digested.reserved();
        String fieldName = reserved.fieldName();
        if (signature.length() > reserved.signatureCapacity()) {
            throw new ReservedSpaceExhaustedException("CMS signature of " + signature.length()
                    + " bytes does not fit the " + reserved.signatureCapacity() + " bytes reserved for field '"
                    + fieldName + "'");
        }

        byte[] in = reserved.rawBytes();
        byte[] out;
        PdfReader reader = null;
        try {
            reader = new PdfReader(in);
            ByteArrayOutputStream os = new ByteArrayOutputStream(in.length);
            MakeSignature.signDeferred(reader, fieldName, os,
                    new PrecomputedSignatureContainer(signature.encoded(), digested.digestAlgorithm(), digested.digest()));
            out = os.toByteArray();
        } catch (IOException | DocumentException | GeneralSecurityException e) {
            throw new DocumentStructureException("Unable to finalize signature field '" + fieldName + "': "
                    + e.getMessage(), e);
        } finally {
            if (reader != null) {
                reader.close();
            }
        }

        if (out.length != in.length) {
            throw new DocumentStructureException("Finalized document length " + out.length
                    + " differs from reserved length " + in.length);
        }
        ByteRange head = reserved.byteRanges().get(0);
        ByteRange tail = reserved.byteRanges().get(1);
        if (Arrays.mismatch(in, 0, (int) head.end(), out, 0, (int) head.end()) != -1
                || Arrays.mismatch(in, (int) tail.offset(), in.length, out, (int) tail.offset(), out.length) != -1) {
            throw new DocumentStructureException("Bytes outside the placeholder of field '" + fieldName + "' changed");
        }
        BaseDocument next = open(out);
        log.info("[writer] finalized field='{}' signature={}B of {}B reserved, document={}B",
                fieldName, signature.length(), reserved.signatureCapacity(), out.length);
        return new FinalizedDocument(next, fieldName, reserved.byteRanges());
    }

    static void requirePrefixUnchanged(byte[] previous, byte[] current) throws DocumentStructureException {
        if (current.length <= previous.length) {
            throw new DocumentStructureException("Incremental update did not append any bytes");
        }
        int mismatch = Arrays.mismatch(previous, 0, previous.length, current, 0, previous.length);
        if (mismatch != -1) {
            throw new DocumentStructureException(String.format(
                    "Non-incremental change at offset %d: prev=0x%02X, curr=0x%02X",
                    mismatch, previous[mismatch], current[mismatch]));
        }
        log.debug("[writer] incremental check OK, first {}B unchanged", previous.length);
    }

    private static List<ByteRange> readByteRange(byte[] pdf, String fieldName) throws DocumentStructureException {
        PdfReader reader;
        try {
            reader = new PdfReader(pdf);
        } catch (IOException e) {
            throw new DocumentStructureException("Reserved document cannot be re-read: " + e.getMessage(), e);
        }
        try {
            PdfDictionary signature = reader.getAcroFields().getSignatureDictionary(fieldName);
            PdfArray byteRange = signature == null ? null : signature.getAsArray(PdfName.BYTERANGE);
            if (byteRange == null || byteRange.size() != 4) {
                throw new DocumentStructureException("Signature field '" + fieldName + "' has no usable /ByteRange");
            }
            List<ByteRange> ranges = new ArrayList<>(2);
            ranges.add(new ByteRange(byteRange.getAsNumber(0).longValue(), byteRange.getAsNumber(1).longValue()));
            ranges.add(new ByteRange(byteRange.getAsNumber(2).longValue(), byteRange.getAsNumber(3).longValue()));
            return ranges;
        } finally {
            reader.close();
        }
    }

    private static Map<String, EmptySignatureField> emptySignatureFields(AcroFields fields) {
        Map<String, EmptySignatureField> empty = new LinkedHashMap<>();
        for (String name : fields.getBlankSignatureNames()) {
            List<AcroFields.FieldPosition> positions = fields.getFieldPositions(name);
            if (positions == null || positions.isEmpty()) {
                continue;
            }
            AcroFields.FieldPosition position = positions.get(0);
            Rectangle box = position.position;
            if (box.getWidth() <= 0f || box.getHeight() <= 0f) {
                continue;
            }
            empty.put(name, new EmptySignatureField(name, position.page,
                    new StampRect(box.getLeft(), box.getBottom(), box.getRight(), box.getTop())));
        }
        return empty;
    }

    private static void drawImage(PdfTemplate canvas, StampAppearance stamp, Image image) throws DocumentException {
        StampRect widget = stamp.widgetRect();
        StampRect target = stamp.imageRect();
        image.scaleAbsolute(target.width(), target.height());
        image.setAbsolutePosition(target.llx() - widget.llx(), target.lly() - widget.lly());
        canvas.addImage(image);
    }

    private void drawCaption(PdfTemplate canvas, StampRect widget, String signerName, Instant signingTime) {
        float size = Math.max(4f, Math.min(7f, widget.height() / 4f));
        Font font = new Font(Font.FontFamily.HELVETICA, size);
        String signed = CAPTION_TIME.withZone(zone).format(signingTime);
        ColumnText.showTextAligned(canvas, Element.ALIGN_LEFT,
                new Phrase("Signed by: " + (signerName == null ? "" : signerName), font), 2f, 2f + size * 1.2f, 0f);
        ColumnText.showTextAligned(canvas, Element.ALIGN_LEFT,
                new Phrase("Date Signed: " + signed, font), 2f, 2f, 0f);
    }

    private static void addStampAnnotation(PdfStamper stamper, StampAppearance stamp, Image image,
                                           String fieldName, int index, String signerName) throws DocumentException {
        StampRect widget = stamp.widgetRect();
        PdfTemplate template = PdfTemplate.createTemplate(stamper.getWriter(), widget.width(), widget.height());
        drawImage(template, stamp, image);
        PdfAnnotation annotation = PdfAnnotation.createStamp(stamper.getWriter(), toRectangle(widget),
                signerName == null ? fieldName : "Signed by " + signerName, "Approved");
        annotation.setAppearance(PdfAnnotation.APPEARANCE_NORMAL, template);
        annotation.setFlags(PdfAnnotation.FLAGS_PRINT | PdfAnnotation.FLAGS_LOCKED);
        annotation.setName(fieldName + "-" + index);
        stamper.addAnnotation(annotation, stamp.page());
    }

    static Image toImage(StampRaster raster) throws DocumentException, IOException {
        Image image;
        if (raster.isLossless()) {
            image = Image.getInstance(raster.width(), raster.height(), 3, 8, raster.colorData());
        } else {
            image = Image.getInstance(raster.colorData());
        }
        if (!raster.isOpaque()) {
            Image mask = Image.getInstance(raster.width(), raster.height(), 1, 8, raster.alpha());
            mask.makeMask();
            image.setImageMask(mask);
        }
        return image;
    }

    private static StampAppearance primary(List<StampAppearance> appearances) {
        return appearances.get(0);
    }

    private static Rectangle toRectangle(StampRect rect) {
        return new Rectangle(rect.llx(), rect.lly(), rect.urx(), rect.ury());
    }

    private static Calendar toCalendar(Instant instant) {
        Calendar calendar = new GregorianCalendar(TimeZone.getTimeZone("UTC"));
        calendar.setTimeInMillis(instant.toEpochMilli());
        return calendar;
    }
}
