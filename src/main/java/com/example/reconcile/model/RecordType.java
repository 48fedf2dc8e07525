package com.example.reconcile.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Kind of record found in a case file.
 */
public enum RecordType {
    CUSTOMER("customer", "cliente", "anagrafica"),
    TRANSACTION("transaction", "transazione", "transazioni"),
    POLICY("policy", "polizza", "amministrativi"),
    TICKET("ticket", "tickets", "segnalazione");

    private final String wireName;
    private final String[] aliases;

    RecordType(String wireName, String... aliases) {
        this.wireName = wireName;
        this.aliases = aliases;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /**
     * Resolves a record type label as produced by the extraction step.
     * Accepts the English wire name, the Italian section labels and the enum name.
     */
    public static Optional<RecordType> fromLabel(String label) {
        if (label == null || label.isBlank()) return Optional.empty();
        String key = label.strip().toLowerCase(Locale.ROOT);
        for (RecordType type : values()) {
            if (type.wireName.equals(key) || type.name().toLowerCase(Locale.ROOT).equals(key)) {
                return Optional.of(type);
            }
            for (String alias : type.aliases) {
                if (alias.equals(key)) return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
