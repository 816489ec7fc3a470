package com.dtrsign.signing;

import com.dtrsign.config.SigningConfig;
import com.dtrsign.crypto.ByteRange;
import com.dtrsign.crypto.CertificateBundle;
import com.dtrsign.crypto.CertificateStore;
import com.dtrsign.crypto.SignatureBytes;
import com.dtrsign.crypto.SignatureEngine;
import com.dtrsign.error.SignaturePipelineException;
import com.dtrsign.pdf.BaseDocument;
import com.dtrsign.pdf.DigestedDocument;
import com.dtrsign.pdf.FinalizedDocument;
import com.dtrsign.pdf.IncrementalDocumentWriter;
import com.dtrsign.pdf.ReservedDocument;
import com.dtrsign.pdf.stamp.StampAppearance;
import com.dtrsign.pdf.stamp.StampCompositor;
import com.dtrsign.pdf.stamp.StampRect;
import com.dtrsign.pdf.stamp.StampSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CancellationException;

/**
 * Runs the signing pipeline: compose stamp, reserve placeholder, digest, build CMS, finalize. One field per
 * {@link StampSpec}; every field of a call is appended in its own revision. A call either signs all of its
 * fields or returns the input untouched.
 * <p>
 * Stateless apart from its collaborators, so one instance may serve concurrent requests.
 */
public final class SigningOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(SigningOrchestrator.class);

    private final CertificateStore certificateStore;
    private final StampCompositor compositor;
    private final SignatureEngine engine;
    private final IncrementalDocumentWriter writer;
    private final PlacementPlanner planner;
    private final Clock clock;

    public SigningOrchestrator(SigningConfig config) {
        this(config, Clock.systemUTC());
    }

    public SigningOrchestrator(SigningConfig config, Clock clock) {
        this(new CertificateStore(clock),
                new StampCompositor(config.getEnhancer()),
                new SignatureEngine(config.getDigestAlgorithm(), config.getRsaScheme()),
                new IncrementalDocumentWriter(config),
                new PlacementPlanner(config),
                clock);
    }

    public SigningOrchestrator(CertificateStore certificateStore, StampCompositor compositor, SignatureEngine engine,
                               IncrementalDocumentWriter writer, PlacementPlanner planner, Clock clock) {
        this.certificateStore = Objects.requireNonNull(certificateStore, "certificateStore");
        this.compositor = Objects.requireNonNull(compositor, "compositor");
        this.engine = Objects.requireNonNull(engine, "engine");
        this.writer = Objects.requireNonNull(writer, "writer");
        this.planner = Objects.requireNonNull(planner, "planner");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Loads and validates the request's credentials, plans the placements and signs. The certificate bundle
     * lives exactly as long as this call and the request's password copy is cleared on return.
     */
    public SigningResult sign(SigningRequest request) {
        Objects.requireNonNull(request, "request");
        List<StampSpec> specs = planner.plan(request);
        log.info("[orchestrator] role={} kind={} page={} wholeMonth={} fields={}", request.role(), request.kind(),
                request.page(), request.wholeMonth(), specs.size());
        try (CertificateBundle bundle = certificateStore.load(request.pkcs12(), request.password())) {
            certificateStore.validate(bundle, clock.instant());
            return signRole(request.pdf(), bundle, specs, request.role());
        } catch (SignaturePipelineException e) {
            log.warn("[orchestrator] role={} rejected: {} ({})", request.role(), e.getMessage(), e.getKind().code());
            return SigningResult.failure(request.pdf().clone(),
                    FieldOutcome.failed(null, request.role(), e.getKind(), e.getMessage()), e);
        } finally {
            request.clearPassword();
        }
    }

    /**
     * Signs {@code steps} in order, feeding each step the previous step's output; the first step's document is
     * the starting point. Stops at the first failure, whose result carries the original document.
     * <p>
     * Each step runs on a copy of its request, so only the copies' passwords are cleared; the caller still owns
     * the passwords of {@code steps}.
     */
    public SigningResult signChain(List<SigningRequest> steps) {
        if (steps == null || steps.isEmpty()) {
            throw new IllegalArgumentException("At least one signing step is required");
        }
        byte[] original = steps.get(0).pdf();
        byte[] current = original;
        List<FieldOutcome> outcomes = new ArrayList<>();
        List<SignatureField> fields = new ArrayList<>();
        for (SigningRequest step : steps) {
            SigningResult result = sign(step.withPdf(current));
            if (!result.isSuccess()) {
                SignaturePipelineException failure = result.failure().orElseThrow();
                return SigningResult.failure(original.clone(), result.outcomes().get(0), failure);
            }
            outcomes.addAll(result.outcomes());
            fields.addAll(result.fields());
            current = result.document();
        }
        return SigningResult.success(current, outcomes, fields);
    }

    /**
     * Signs one field per spec for {@code role} using an already loaded bundle. Fields are named
     * {@code <Prefix>Signature<n>} with the smallest free {@code n}; when that name is an unsigned signature
     * field of the document, the stamp moves onto its widget and that field is signed.
     */
    public SigningResult signRole(byte[] pdf, CertificateBundle bundle, List<StampSpec> stampSpecs, SignerRole role) {
        Objects.requireNonNull(pdf, "pdf");
        Objects.requireNonNull(bundle, "bundle");
        Objects.requireNonNull(role, "role");
        if (stampSpecs == null || stampSpecs.isEmpty()) {
            throw new IllegalArgumentException("At least one stamp spec is required");
        }
        List<FieldOutcome> outcomes = new ArrayList<>();
        List<SignatureField> fields = new ArrayList<>();
        String currentField = null;
        try {
            checkInterrupted("open");
            BaseDocument base = writer.open(pdf);
            for (StampSpec spec : stampSpecs) {
                currentField = role.nextFieldName(base.occupiedFieldNames());
                StampSpec placed = base.emptySignatureField(currentField)
                        .map(empty -> spec.at(empty.page(), empty.rect()))
                        .orElse(spec);
                FinalizedDocument signed = signField(base, bundle, placed, role, currentField, fields);
                outcomes.add(FieldOutcome.signed(signed.fieldName(), role));
                base = signed.asBase();
            }
            log.info("[orchestrator] role={} signed fields={} document={}B", role,
                    outcomes.stream().map(FieldOutcome::fieldName).toList(), base.length());
            return SigningResult.success(base.bytes(), outcomes, fields);
        } catch (SignaturePipelineException e) {
            log.warn("[orchestrator] role={} field='{}' failed: {} ({})", role, currentField, e.getMessage(),
                    e.getKind().code());
            return SigningResult.failure(pdf.clone(),
                    FieldOutcome.failed(currentField, role, e.getKind(), e.getMessage()), e);
        }
    }

    private FinalizedDocument signField(BaseDocument base, CertificateBundle bundle, StampSpec spec, SignerRole role,
                                        String fieldName, List<SignatureField> fields)
            throws SignaturePipelineException {
        StampRect mediaBox = base.pageSize(spec.page());
        List<StampAppearance> appearances = compositor.compose(spec, mediaBox);
        Instant signingTime = clock.instant();

        checkInterrupted("reserve");
        ReservedDocument reserved = writer.reserve(base, fieldName, appearances, bundle.getSignerName(), signingTime);
        checkInterrupted("digest");
        DigestedDocument digested = writer.digest(reserved, engine);
        checkInterrupted("sign");
        SignatureBytes signature = engine.sign(digested.digest(), bundle, signingTime);
        checkInterrupted("finalize");
        FinalizedDocument finalized = writer.finalizeSignature(digested, signature);

        fields.add(new SignatureField(fieldName, role, signingTime,
                new ByteRange(reserved.placeholderOffset(), reserved.placeholderLength())));
        return finalized;
    }

    private static void checkInterrupted(String stage) {
        if (Thread.currentThread().isInterrupted()) {
            throw new CancellationException("Signing interrupted before " + stage);
        }
    }
}
