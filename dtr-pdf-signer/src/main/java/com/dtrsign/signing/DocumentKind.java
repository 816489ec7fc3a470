package com.dtrsign.signing;

/**
 * Form layout being signed; selects the fixed signature slots.
 */
public enum DocumentKind {
    DTR,
    LEAVE_APPLICATION
}
