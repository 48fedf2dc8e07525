package com.example.reconcile.model;

import java.util.List;

/**
 * Whitespace-normalized text plus the flagged keywords found in it.
 */
public record FreeText(String text, List<String> flaggedKeywords) implements TypedValue {

    public FreeText {
        flaggedKeywords = flaggedKeywords != null ? List.copyOf(flaggedKeywords) : List.of();
    }

    @Override
    public String canonical() {
        return text;
    }
}
