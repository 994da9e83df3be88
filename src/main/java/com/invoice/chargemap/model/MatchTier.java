package com.invoice.chargemap.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Which kind of rule produced a charge type.
 */
public enum MatchTier {
    VENDOR_SPECIFIC("vendor-specific"),
    DEFAULT("default"),
    UNCLASSIFIED("unclassified");

    private final String label;

    MatchTier(String label) {
        this.label = label;
    }

    @JsonValue
    public String getLabel() {
        return label;
    }
}
