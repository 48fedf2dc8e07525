package com.example.reconcile.model;

/**
 * Suggested surface-form correction of a field. Never applied by the engine on its own.
 *
 * @param fieldName      affected field
 * @param recordRef      affected record
 * @param originalValue  raw value as extracted
 * @param suggestedValue canonical surface form
 * @param confidence     certainty that the transform preserves the value
 * @param issueRef       id of an issue on the same field, if any
 */
public record AutoFixSuggestion(
        String fieldName,
        String recordRef,
        String originalValue,
        String suggestedValue,
        double confidence,
        String issueRef
) {
    public AutoFixSuggestion withIssueRef(String newIssueRef) {
        return new AutoFixSuggestion(fieldName, recordRef, originalValue, suggestedValue, confidence, newIssueRef);
    }

    public boolean targets(String record, String field) {
        return recordRef.equals(record) && fieldName.equals(field);
    }
}
