package com.dtrsign.signing;

import com.dtrsign.crypto.ByteRange;

import java.time.Instant;

/**
 * A signature field written by this run.
 *
 * @param placeholder span of the hex /Contents placeholder (brackets included) in the signed revision
 */
public record SignatureField(String name, SignerRole role, Instant signingTime, ByteRange placeholder) {
}
