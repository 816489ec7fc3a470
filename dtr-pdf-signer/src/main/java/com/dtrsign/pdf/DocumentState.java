package com.dtrsign.pdf;

/**
 * Lifecycle of a document inside one signature round.
 */
public enum DocumentState {
    BASE,
    PLACEHOLDER_RESERVED,
    DIGESTED,
    FINALIZED
}
