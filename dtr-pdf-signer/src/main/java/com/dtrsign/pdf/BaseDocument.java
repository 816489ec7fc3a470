package com.dtrsign.pdf;

import com.dtrsign.error.PlacementOutOfBoundsException;
import com.dtrsign.pdf.stamp.StampRect;

import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * A parsed, unmodified PDF revision that the next signature builds on.
 */
public final class BaseDocument {

    private final byte[] bytes;
    private final List<StampRect> mediaBoxes;
    private final Set<String> fieldNames;
    private final List<String> signatureNames;
    private final Map<String, EmptySignatureField> emptySignatureFields;

    BaseDocument(byte[] bytes, List<StampRect> mediaBoxes, Set<String> fieldNames, List<String> signatureNames,
                 Map<String, EmptySignatureField> emptySignatureFields) {
        this.bytes = bytes;
        this.mediaBoxes = List.copyOf(mediaBoxes);
        this.fieldNames = Set.copyOf(fieldNames);
        this.signatureNames = List.copyOf(signatureNames);
        this.emptySignatureFields = Map.copyOf(emptySignatureFields);
    }

    public DocumentState state() {
        return DocumentState.BASE;
    }

    public byte[] bytes() {
        return bytes.clone();
    }

    byte[] rawBytes() {
        return bytes;
    }

    public int length() {
        return bytes.length;
    }

    public int pageCount() {
        return mediaBoxes.size();
    }

    /**
     * Media box of the 1-based {@code page}.
     */
    public StampRect pageSize(int page) throws PlacementOutOfBoundsException {
        if (page < 1 || page > mediaBoxes.size()) {
            throw new PlacementOutOfBoundsException("Page " + page + " does not exist; document has "
                    + mediaBoxes.size() + " page(s)");
        }
        return mediaBoxes.get(page - 1);
    }

    /**
     * Every AcroForm field name already present, signed or not.
     */
    public Set<String> fieldNames() {
        return fieldNames;
    }

    public List<String> signatureNames() {
        return signatureNames;
    }

    /**
     * Unsigned signature field {@code name} with a visible widget, if the document has one.
     */
    public Optional<EmptySignatureField> emptySignatureField(String name) {
        return Optional.ofNullable(emptySignatureFields.get(name));
    }

    /**
     * Field names a new field must not reuse: every field except unsigned signature fields that can be signed
     * into.
     */
    public Set<String> occupiedFieldNames() {
        Set<String> occupied = new LinkedHashSet<>(fieldNames);
        occupied.removeAll(emptySignatureFields.keySet());
        return occupied;
    }

    public boolean startsWith(byte[] prefix) {
        return prefix.length <= bytes.length
                && Arrays.mismatch(bytes, 0, prefix.length, prefix, 0, prefix.length) == -1;
    }
}
