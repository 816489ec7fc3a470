package com.dtrsign.pdf;

import com.itextpdf.text.BaseColor;
import com.itextpdf.text.Document;
import com.itextpdf.text.DocumentException;
import com.itextpdf.text.Element;
import com.itextpdf.text.Font;
import com.itextpdf.text.FontFactory;
import com.itextpdf.text.PageSize;
import com.itextpdf.text.Phrase;
import com.itextpdf.text.Rectangle;
import com.itextpdf.text.pdf.ColumnText;
import com.itextpdf.text.pdf.PdfContentByte;
import com.itextpdf.text.pdf.PdfFormField;
import com.itextpdf.text.pdf.PdfWriter;
import com.itextpdf.text.pdf.TextField;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Blank one-page Daily Time Record (US Letter) with a 31-day table whose owner and in-charge columns line up
 * with the default whole-month grid.
 */
public final class DtrTemplate {

    public static final int DAYS = 31;
    public static final float TABLE_TOP = 718f;
    public static final float ROW_HEIGHT = 16f;

    public static final String FIELD_EMPLOYEE = "EmployeeName";
    public static final String FIELD_MONTH = "Month";

    private static final float HEADER_HEIGHT = 16f;
    private static final float[] COLUMNS = {50f, 80f, 135f, 190f, 245f, 295f, 420f, 545f};
    private static final String[] HEADER_LABELS = {
            "Day",
            "AM In",
            "AM Out",
            "PM In",
            "PM Out",
            "Owner",
            "In-charge"
    };

    private DtrTemplate() {
    }

    public static byte[] create(String employeeName, String month) throws DocumentException {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        write(out, employeeName, month);
        return out.toByteArray();
    }

    public static void createTemplate(Path dest, String employeeName, String month) throws IOException, DocumentException {
        Objects.requireNonNull(dest, "dest must not be null");
        Path parent = dest.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(dest, create(employeeName, month));
    }

    private static void write(ByteArrayOutputStream out, String employeeName, String month) throws DocumentException {
        Document doc = new Document(PageSize.LETTER, 36f, 36f, 36f, 36f);
        PdfWriter writer = PdfWriter.getInstance(doc, out);
        writer.setPdfVersion(PdfWriter.PDF_VERSION_1_7);
        doc.open();

        PdfContentByte canvas = writer.getDirectContent();
        drawTitle(canvas);
        addTextField(writer, FIELD_EMPLOYEE, new Rectangle(110f, 744f, 330f, 758f), safe(employeeName));
        addTextField(writer, FIELD_MONTH, new Rectangle(400f, 744f, 545f, 758f), safe(month));

        float headerTop = TABLE_TOP + HEADER_HEIGHT;
        float tableBottom = TABLE_TOP - ROW_HEIGHT * DAYS;
        drawTableBorder(canvas, headerTop, tableBottom);
        drawHeaderText(canvas, headerTop);
        drawDayNumbers(canvas);
        drawFooter(canvas, tableBottom);

        doc.close();
    }

    private static void drawTitle(PdfContentByte canvas) {
        Font titleFont = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 14f, BaseColor.BLACK);
        Font labelFont = FontFactory.getFont(FontFactory.HELVETICA, 9f, BaseColor.BLACK);
        ColumnText.showTextAligned(canvas, Element.ALIGN_CENTER, new Phrase("DAILY TIME RECORD", titleFont),
                306f, 766f, 0f);
        ColumnText.showTextAligned(canvas, Element.ALIGN_LEFT, new Phrase("Employee:", labelFont), 50f, 748f, 0f);
        ColumnText.showTextAligned(canvas, Element.ALIGN_LEFT, new Phrase("Month:", labelFont), 360f, 748f, 0f);
    }

    private static void drawTableBorder(PdfContentByte canvas, float top, float bottom) {
        float left = COLUMNS[0];
        float right = COLUMNS[COLUMNS.length - 1];
        canvas.saveState();
        canvas.setLineWidth(0.6f);
        canvas.moveTo(left, top);
        canvas.lineTo(right, top);
        for (int row = 0; row <= DAYS; row++) {
            float y = TABLE_TOP - row * ROW_HEIGHT;
            canvas.moveTo(left, y);
            canvas.lineTo(right, y);
        }
        for (float x : COLUMNS) {
            canvas.moveTo(x, top);
            canvas.lineTo(x, bottom);
        }
        canvas.stroke();
        canvas.restoreState();
    }

    private static void drawHeaderText(PdfContentByte canvas, float headerTop) {
        Font headerFont = FontFactory.getFont(FontFactory.HELVETICA_BOLD, 8f, BaseColor.BLACK);
        float baseline = headerTop - HEADER_HEIGHT + 5f;
        for (int i = 0; i < HEADER_LABELS.length; i++) {
            ColumnText.showTextAligned(canvas, Element.ALIGN_LEFT, new Phrase(HEADER_LABELS[i], headerFont),
                    COLUMNS[i] + 3f, baseline, 0f);
        }
    }

    private static void drawDayNumbers(PdfContentByte canvas) {
        Font font = FontFactory.getFont(FontFactory.HELVETICA, 8f, BaseColor.BLACK);
        for (int day = 1; day <= DAYS; day++) {
            float baseline = TABLE_TOP - day * ROW_HEIGHT + 5f;
            ColumnText.showTextAligned(canvas, Element.ALIGN_LEFT, new Phrase(String.valueOf(day), font),
                    COLUMNS[0] + 3f, baseline, 0f);
        }
    }

    private static void drawFooter(PdfContentByte canvas, float tableBottom) {
        Font font = FontFactory.getFont(FontFactory.HELVETICA, 8f, BaseColor.BLACK);
        ColumnText.showTextAligned(canvas, Element.ALIGN_LEFT,
                new Phrase("I certify on my honor that the above is a true and correct report of the hours of work performed.", font),
                50f, tableBottom - 14f, 0f);
        canvas.saveState();
        canvas.setLineWidth(0.6f);
        canvas.moveTo(50f, 100f);
        canvas.lineTo(250f, 100f);
        canvas.moveTo(360f, 100f);
        canvas.lineTo(560f, 100f);
        canvas.stroke();
        canvas.restoreState();
        ColumnText.showTextAligned(canvas, Element.ALIGN_CENTER, new Phrase("Employee", font), 150f, 90f, 0f);
        ColumnText.showTextAligned(canvas, Element.ALIGN_CENTER, new Phrase("In-charge", font), 460f, 90f, 0f);
    }

    private static void addTextField(PdfWriter writer, String name, Rectangle rect, String value)
            throws DocumentException {
        TextField field = new TextField(writer, rect, name);
        field.setFontSize(9f);
        field.setOptions(TextField.REMOVE_TRAILING_SPACES);
        field.setText(value);
        try {
            PdfFormField formField = field.getTextField();
            writer.addAnnotation(formField);
        } catch (IOException e) {
            throw new DocumentException(e);
        }
    }

    private static String safe(String input) {
        return input == null ? "" : input;
    }
}
