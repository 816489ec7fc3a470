package com.dtrsign.pdf;

import com.dtrsign.pdf.stamp.StampRect;

/**
 * An unsigned signature field already present in a document, with the widget it will be signed into.
 */
public record EmptySignatureField(String name, int page, StampRect rect) {
}
