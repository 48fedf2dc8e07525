package com.example.reconcile.model;

/**
 * Structurally validated identity code (fiscal code, IBAN, policy number, ...).
 */
public record IdentityCode(FieldType kind, String code) implements TypedValue {

    @Override
    public String canonical() {
        return code;
    }
}
