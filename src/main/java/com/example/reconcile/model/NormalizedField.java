package com.example.reconcile.model;

import java.util.Objects;

/**
 * Result of normalizing one {@link RawField}: either a typed value or a failure.
 * A typed value may still carry a strict-validation violation (plausible but invalid,
 * e.g. an email without top-level domain).
 */
public record NormalizedField(
        String recordId,
        String fieldName,
        FieldType type,
        String rawValue,
        SourceLocation sourceLocation,
        TypedValue value,
        NormalizationFailure failure,
        String ruleId,
        String strictViolation
) {
    public NormalizedField {
        if ((value == null) == (failure == null)) {
            throw new IllegalArgumentException("Exactly one of value or failure must be set for " + fieldName);
        }
        Objects.requireNonNull(type, "type");
        if (sourceLocation == null) sourceLocation = SourceLocation.UNKNOWN;
    }

    public boolean isSuccess() {
        return value != null;
    }

    public boolean isStrict() {
        return value != null && strictViolation == null;
    }

    public String evidenceRef() {
        return recordId + "." + fieldName + " @ " + sourceLocation.describe();
    }
}
