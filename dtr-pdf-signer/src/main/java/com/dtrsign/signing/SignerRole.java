package com.dtrsign.signing;

import java.util.Locale;
import java.util.Set;

/**
 * Who is signing. The prefix names the role's signature fields: {@code <Prefix>Signature<n>}.
 */
public enum SignerRole {
    OWNER("Owner"),
    IN_CHARGE("Incharge"),
    HEAD("Head"),
    SAO("Sao"),
    CAO("Cao");

    private final String fieldPrefix;

    SignerRole(String fieldPrefix) {
        this.fieldPrefix = fieldPrefix;
    }

    public String getFieldPrefix() {
        return fieldPrefix;
    }

    /**
     * Key of this role in configuration, e.g. {@code grid.anchor.incharge}.
     */
    public String configKey() {
        return fieldPrefix.toLowerCase(Locale.ROOT);
    }

    /**
     * Smallest-numbered field name for this role that is not yet taken.
     */
    public String nextFieldName(Set<String> existing) {
        int n = 1;
        while (existing.contains(fieldPrefix + "Signature" + n)) {
            n++;
        }
        return fieldPrefix + "Signature" + n;
    }

    public static SignerRole parse(String value) {
        String normalized = value.strip().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("INCHARGE")) {
            return IN_CHARGE;
        }
        return valueOf(normalized);
    }
}
