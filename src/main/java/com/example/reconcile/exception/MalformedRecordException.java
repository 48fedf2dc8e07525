package com.example.reconcile.exception;

/**
 * A record lacks the structural fields needed to process it. Fatal for that record only.
 */
public class MalformedRecordException extends RuntimeException {

    private final String recordRef;
    private final String fieldName;

    public MalformedRecordException(String recordRef, String fieldName, String message) {
        super(message);
        this.recordRef = recordRef;
        this.fieldName = fieldName;
    }

    public String getRecordRef() {
        return recordRef;
    }

    public String getFieldName() {
        return fieldName;
    }
}
