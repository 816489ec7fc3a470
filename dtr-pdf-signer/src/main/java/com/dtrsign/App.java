package com.dtrsign;

import com.dtrsign.config.SigningConfig;
import com.dtrsign.crypto.DemoKeystoreUtil;
import com.dtrsign.error.ErrorKind;
import com.dtrsign.pdf.DtrTemplate;
import com.dtrsign.pdf.SignatureInspector;
import com.dtrsign.pdf.SignatureReport;
import com.dtrsign.pdf.stamp.StampRect;
import com.dtrsign.signing.DocumentKind;
import com.dtrsign.signing.FieldOutcome;
import com.dtrsign.signing.SignatureField;
import com.dtrsign.signing.SignerRole;
import com.dtrsign.signing.SigningOrchestrator;
import com.dtrsign.signing.SigningRequest;
import com.dtrsign.signing.SigningResult;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.interactive.annotation.PDAnnotationWidget;
import org.apache.pdfbox.pdmodel.interactive.form.PDAcroForm;
import org.apache.pdfbox.pdmodel.interactive.form.PDField;
import picocli.CommandLine;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.Callable;

public class App {

    static final int EXIT_OK = 0;
    static final int EXIT_NO_SIGNATURES = 1;
    static final int EXIT_INVALID_SIGNATURE = 2;
    static final int EXIT_BAD_INPUT = 3;

    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    static CommandLine commandLine() {
        return new CommandLine(new Root()).setCaseInsensitiveEnumValuesAllowed(true);
    }

    /**
     * Pipeline failures exit with 10 + the error kind's ordinal so scripts can tell them apart.
     */
    static int exitCode(ErrorKind kind) {
        return 10 + kind.ordinal();
    }

    @CommandLine.Command(name = "dtr-signer", mixinStandardHelpOptions = true,
            subcommands = {
                    CreateDtr.class,
                    Sign.class,
                    VerifyPdf.class,
                    GenDemoP12.class,
                    ListFields.class
            })
    static class Root implements Runnable {
        @Override
        public void run() {
            CommandLine.usage(this, System.out);
        }
    }

    @CommandLine.Command(name = "create-dtr", description = "Create a blank one-page Daily Time Record PDF")
    static class CreateDtr implements Callable<Integer> {
        @CommandLine.Option(names = "--out", required = true, description = "Destination PDF file")
        private Path output;

        @CommandLine.Option(names = "--employee", defaultValue = "", description = "Employee name")
        private String employee;

        @CommandLine.Option(names = "--month", defaultValue = "", description = "Month covered, e.g. 'March 2025'")
        private String month;

        @Override
        public Integer call() throws Exception {
            DtrTemplate.createTemplate(output.toAbsolutePath(), employee, month);
            System.out.println("DTR template written to " + output.toAbsolutePath());
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "sign", description = "Stamp and sign a DTR or leave application for one signer role")
    static class Sign implements Callable<Integer> {
        @CommandLine.Option(names = "--src", required = true, description = "Source PDF to sign")
        private Path source;

        @CommandLine.Option(names = "--dest", required = true, description = "Destination PDF")
        private Path destination;

        @CommandLine.Option(names = "--pkcs12", required = true, description = "Signer PKCS#12 file")
        private Path pkcs12;

        @CommandLine.Option(names = "--password", required = true, interactive = true, arity = "0..1",
                description = "Password for PKCS#12")
        private char[] password;

        @CommandLine.Option(names = "--image", required = true, description = "Signature image (PNG, JPEG, ...)")
        private Path image;

        @CommandLine.Option(names = "--role", defaultValue = "OWNER",
                description = "Signer role: ${COMPLETION-CANDIDATES}")
        private SignerRole role;

        @CommandLine.Option(names = "--kind", defaultValue = "DTR",
                description = "Document kind: ${COMPLETION-CANDIDATES}")
        private DocumentKind kind;

        @CommandLine.Option(names = "--page", defaultValue = "1", description = "1-based page index")
        private int page;

        @CommandLine.Option(names = "--rect", description = "Explicit stamp rectangle 'llx,lly,urx,ury' in points")
        private String rect;

        @CommandLine.Option(names = "--scale", description = "Stamp scale factor in (0, 1]")
        private Double scale;

        @CommandLine.Option(names = "--quality", description = "Image quality 0-100; 100 is lossless")
        private Integer quality;

        @CommandLine.Option(names = "--whole-month", description = "Stamp every day cell of the month grid")
        private boolean wholeMonth;

        @CommandLine.Option(names = "--days", description = "Number of day cells in whole-month mode")
        private Integer days;

        @CommandLine.Option(names = "--config", description = "Properties file overriding the bundled defaults")
        private Path config;

        @Override
        public Integer call() throws Exception {
            BufferedImage stamp = ImageIO.read(image.toFile());
            if (stamp == null) {
                System.err.println("Unsupported or unreadable image: " + image.toAbsolutePath());
                return EXIT_BAD_INPUT;
            }
            SigningRequest request = SigningRequest.builder()
                    .pdf(Files.readAllBytes(source))
                    .pkcs12(Files.readAllBytes(pkcs12))
                    .password(password)
                    .image(stamp)
                    .role(role)
                    .kind(kind)
                    .page(page)
                    .rect(rect == null ? null : StampRect.parse(rect))
                    .scaleFactor(scale)
                    .imageQuality(quality)
                    .wholeMonth(wholeMonth)
                    .dayCount(days)
                    .build();
            Arrays.fill(password, '\0');

            SigningResult result = new SigningOrchestrator(SigningConfig.load(config)).sign(request);
            if (!result.isSuccess()) {
                FieldOutcome failed = result.outcomes().get(0);
                ErrorKind kind = result.errorKind().orElseThrow();
                System.err.println("[" + kind.code() + "] " + failed.message());
                return exitCode(kind);
            }
            Files.write(destination, result.document());
            for (SignatureField field : result.fields()) {
                System.out.println("Signed " + field.name() + " (" + field.role() + ") at " + field.signingTime());
            }
            System.out.println("Signed document -> " + destination.toAbsolutePath());
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "verify", description = "Verify every signature in a PDF")
    static class VerifyPdf implements Callable<Integer> {
        @CommandLine.Option(names = "--pdf", required = true, description = "PDF to verify")
        private Path pdf;

        @Override
        public Integer call() throws Exception {
            byte[] bytes = Files.readAllBytes(pdf);
            List<SignatureReport> reports = new SignatureInspector().inspect(bytes);
            if (reports.isEmpty()) {
                System.out.println("[verify] No digital signatures found.");
                return EXIT_NO_SIGNATURES;
            }
            int exitCode = EXIT_OK;
            for (SignatureReport report : reports) {
                System.out.println("[verify] Signature name: " + report.fieldName());
                System.out.println("  - Subject: " + report.signerSubject());
                System.out.println("  - Signed on: " + report.signingTime());
                System.out.println("  - Byte range: " + report.byteRanges()
                        + (report.coversWholeDocument() ? " (whole document)" : " (earlier revision)"));
                System.out.println("  - Integrity check: " + (report.cmsValid() ? "OK" : "FAILED " + report.error()));
                if (!report.cmsValid()) {
                    exitCode = EXIT_INVALID_SIGNATURE;
                }
            }
            return exitCode;
        }
    }

    @CommandLine.Command(name = "list-fields", description = "List all AcroForm fields in a PDF")
    static class ListFields implements Callable<Integer> {

        @CommandLine.Option(names = "--src", required = true, description = "Source PDF")
        private Path source;

        @Override
        public Integer call() throws Exception {
            Path srcFile = source.toAbsolutePath();
            if (!Files.exists(srcFile)) {
                System.err.println("Source PDF does not exist: " + srcFile);
                return EXIT_BAD_INPUT;
            }

            try (PDDocument doc = Loader.loadPDF(srcFile.toFile())) {
                PDAcroForm form = doc.getDocumentCatalog().getAcroForm();
                if (form == null || form.getFields().isEmpty()) {
                    System.out.println("No AcroForm fields found.");
                    return EXIT_OK;
                }

                for (PDField field : form.getFieldTree()) {
                    PDAnnotationWidget widget = field.getWidgets().isEmpty() ? null : field.getWidgets().get(0);
                    Integer pageIndex = null;
                    String rect = "n/a";
                    if (widget != null) {
                        if (widget.getPage() != null) {
                            pageIndex = doc.getPages().indexOf(widget.getPage()) + 1;
                        }
                        if (widget.getRectangle() != null) {
                            rect = widget.getRectangle().toString();
                        }
                    }
                    System.out.printf("%s | %s | page=%s | rect=%s%n",
                            field.getFullyQualifiedName(), field.getFieldType(), pageIndex, rect);
                }
            }
            return EXIT_OK;
        }
    }

    @CommandLine.Command(name = "gen-demo-p12", description = "Generate a self-signed demo PKCS#12 file")
    static class GenDemoP12 implements Callable<Integer> {
        @CommandLine.Option(names = "--out", required = true)
        private Path output;

        @CommandLine.Option(names = "--password", required = true)
        private char[] password;

        @CommandLine.Option(names = "--cn", required = true)
        private String commonName;

        @CommandLine.Option(names = "--key-alg", defaultValue = "RSA", description = "RSA or EC")
        private String keyAlgorithm;

        @CommandLine.Option(names = "--valid-days", defaultValue = "365")
        private int validDays;

        @Override
        public Integer call() throws Exception {
            DemoKeystoreUtil.Params params = new DemoKeystoreUtil.Params();
            params.setCommonName(commonName);
            params.setKeyAlgorithm(keyAlgorithm.toUpperCase(Locale.ROOT));
            params.setNotAfter(Instant.now().plus(Duration.ofDays(validDays)));
            DemoKeystoreUtil.writePkcs12(output.toAbsolutePath(), password, params);
            Arrays.fill(password, '\0');
            System.out.println("Demo keystore written to " + output.toAbsolutePath());
            return EXIT_OK;
        }
    }
}
