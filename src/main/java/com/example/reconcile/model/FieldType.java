package com.example.reconcile.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Declared type of an extracted field. Each type has exactly one handler.
 */
public enum FieldType {
    PHONE("phone", FieldCategory.CONTACT),
    EMAIL("email", FieldCategory.CONTACT),
    DATE("date", FieldCategory.VALUE),
    AMOUNT("amount", FieldCategory.VALUE),
    FISCAL_CODE("fiscal_code", FieldCategory.IDENTITY),
    IBAN("iban", FieldCategory.IDENTITY),
    IDENTIFIER("identifier", FieldCategory.IDENTITY),
    FREE_TEXT("free_text", FieldCategory.FREE_TEXT);

    private final String wireName;
    private final FieldCategory category;

    FieldType(String wireName, FieldCategory category) {
        this.wireName = wireName;
        this.category = category;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    public FieldCategory category() {
        return category;
    }

    public static FieldType fromWireName(String name) {
        for (FieldType type : values()) {
            if (type.wireName.equalsIgnoreCase(name) || type.name().equalsIgnoreCase(name)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown field type: " + name);
    }
}
