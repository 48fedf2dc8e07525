package com.example.reconcile.field;

import com.example.reconcile.model.EntityKind;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.RecordType;

import java.util.List;

/**
 * Declared expectations for one field of one record type.
 *
 * @param recordType   owning record type
 * @param fieldName    field name as produced by the extraction step
 * @param type         declared field type
 * @param required     whether an absent or blank value is a high severity failure
 * @param entityKey    entity this field identifies, or null
 * @param determinedBy entity whose records must agree on this field, or null when not a point value
 * @param eventFields  fields identifying the described event, in order of preference; a record
 *                     is matched on the first one it carries
 * @param critical     drives a financial amount or a legal/contractual date
 */
public record FieldSpec(
        RecordType recordType,
        String fieldName,
        FieldType type,
        boolean required,
        EntityKind entityKey,
        EntityKind determinedBy,
        List<String> eventFields,
        boolean critical
) {
    public FieldSpec {
        eventFields = eventFields != null ? List.copyOf(eventFields) : List.of();
    }

    public static FieldSpec of(RecordType recordType, String fieldName, FieldType type) {
        return new FieldSpec(recordType, fieldName, type, false, null, null, List.of(), false);
    }

    public FieldSpec asRequired() {
        return new FieldSpec(recordType, fieldName, type, true, entityKey, determinedBy, eventFields, critical);
    }

    public FieldSpec identifies(EntityKind kind) {
        return new FieldSpec(recordType, fieldName, type, required, kind, determinedBy, eventFields, critical);
    }

    public FieldSpec determinedBy(EntityKind kind, String... events) {
        return new FieldSpec(recordType, fieldName, type, required, entityKey, kind, List.of(events), critical);
    }

    public FieldSpec asCritical() {
        return new FieldSpec(recordType, fieldName, type, required, entityKey, determinedBy, eventFields, true);
    }

    public FieldSpec withType(FieldType newType) {
        return new FieldSpec(recordType, fieldName, newType, required, entityKey, determinedBy, eventFields, critical);
    }

    public boolean isPointValue() {
        return determinedBy != null;
    }
}
