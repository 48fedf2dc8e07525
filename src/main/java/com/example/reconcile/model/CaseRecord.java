package com.example.reconcile.model;

import java.util.List;
import java.util.Optional;

/**
 * Normalized record: the grouping unit of a case file.
 */
public record CaseRecord(
        String recordId,
        RecordType recordType,
        SourceLocation sourceLocation,
        List<NormalizedField> fields
) {
    public CaseRecord {
        fields = List.copyOf(fields);
        if (sourceLocation == null) sourceLocation = SourceLocation.UNKNOWN;
    }

    public Optional<NormalizedField> field(String name) {
        return fields.stream().filter(f -> f.fieldName().equals(name)).findFirst();
    }

    /** Typed value of a field, when present and successfully normalized. */
    public Optional<TypedValue> value(String name) {
        return field(name).filter(NormalizedField::isSuccess).map(NormalizedField::value);
    }
}
