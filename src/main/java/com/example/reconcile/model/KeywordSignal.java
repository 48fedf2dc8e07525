package com.example.reconcile.model;

import java.util.List;

/**
 * Flagged keywords found in a free-text field. Informational only.
 */
public record KeywordSignal(
        String recordRef,
        String fieldName,
        List<String> keywords,
        String evidenceRef
) {
    public KeywordSignal {
        keywords = List.copyOf(keywords);
    }
}
