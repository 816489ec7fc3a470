package com.dtrsign.signing;

import com.dtrsign.error.ErrorKind;
import com.dtrsign.error.SignaturePipelineException;

import java.util.List;
import java.util.Optional;

/**
 * Output of a signing run. On failure {@link #document()} is the unchanged input.
 */
public final class SigningResult {

    private final byte[] document;
    private final List<FieldOutcome> outcomes;
    private final List<SignatureField> fields;
    private final SignaturePipelineException failure;

    private SigningResult(byte[] document, List<FieldOutcome> outcomes, List<SignatureField> fields,
                          SignaturePipelineException failure) {
        this.document = document;
        this.outcomes = List.copyOf(outcomes);
        this.fields = List.copyOf(fields);
        this.failure = failure;
    }

    static SigningResult success(byte[] document, List<FieldOutcome> outcomes, List<SignatureField> fields) {
        return new SigningResult(document, outcomes, fields, null);
    }

    static SigningResult failure(byte[] original, FieldOutcome outcome, SignaturePipelineException failure) {
        return new SigningResult(original, List.of(outcome), List.of(), failure);
    }

    public boolean isSuccess() {
        return failure == null;
    }

    public byte[] document() {
        return document.clone();
    }

    public List<FieldOutcome> outcomes() {
        return outcomes;
    }

    public List<SignatureField> fields() {
        return fields;
    }

    public Optional<ErrorKind> errorKind() {
        return Optional.ofNullable(failure).map(SignaturePipelineException::getKind);
    }

    public Optional<SignaturePipelineException> failure() {
        return Optional.ofNullable(failure);
    }

    /**
     * Signed document bytes, or the pipeline error that stopped the run.
     */
    public byte[] requireSuccess() throws SignaturePipelineException {
        if (failure != null) {
            throw failure;
        }
        return document();
    }
}
