package com.example.reconcile.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of issue. Declaration order is the presentation order.
 */
public enum IssueType {
    INCONSISTENCY("inconsistency", "INC"),
    LOW_CONFIDENCE("low_confidence", "LOW"),
    NORMALIZATION_FAILURE("normalization_failure", "NRM");

    private final String wireName;
    private final String idPrefix;

    IssueType(String wireName, String idPrefix) {
        this.wireName = wireName;
        this.idPrefix = idPrefix;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public String idPrefix() {
        return idPrefix;
    }
}
