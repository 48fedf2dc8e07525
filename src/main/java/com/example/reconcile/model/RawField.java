package com.example.reconcile.model;

/**
 * Unvalidated value as extracted from the source document.
 */
public record RawField(
        String recordId,
        String fieldName,
        String rawValue,
        SourceLocation sourceLocation
) {
    public RawField {
        if (sourceLocation == null) sourceLocation = SourceLocation.UNKNOWN;
    }
}
