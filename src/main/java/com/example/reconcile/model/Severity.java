package com.example.reconcile.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Issue severity, highest first.
 */
public enum Severity {
    HIGH("high"),
    MEDIUM("medium"),
    LOW("low");

    private final String wireName;

    Severity(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
