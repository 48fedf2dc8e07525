package com.example.reconcile.model;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Resolution carried by a human {@link ReviewDecision}.
 */
public enum Resolution {
    ACCEPTED("accepted"),
    REJECTED("rejected"),
    DEFERRED("deferred");

    private final String wireName;

    Resolution(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }
}
