package com.example.reconcile.model;

import java.util.List;

/**
 * A single finding of a review run. Immutable; the router assigns ids and the final
 * {@code decisionRequired} flag through copies.
 *
 * @param id               issue id (INC-001, LOW-001, NRM-001), null until routed
 * @param type             issue type
 * @param severity         severity level
 * @param fieldName        affected field
 * @param recordRef        affected record (first occurrence for inconsistencies)
 * @param confidence       field confidence; null (N/A) for inconsistencies
 * @param reason           human readable reason
 * @param evidenceRef      where the evidence was read
 * @param decisionRequired whether a human decision blocks approval
 * @param entityKey        entity group for inconsistencies, null otherwise
 * @param variants         conflicting values for inconsistencies, empty otherwise
 */
public record Issue(
        String id,
        IssueType type,
        Severity severity,
        String fieldName,
        String recordRef,
        Double confidence,
        String reason,
        String evidenceRef,
        boolean decisionRequired,
        String entityKey,
        List<ConflictVariant> variants
) {
    public Issue {
        variants = variants != null ? List.copyOf(variants) : List.of();
        if (type == IssueType.LOW_CONFIDENCE && confidence == null) {
            throw new IllegalArgumentException("low_confidence issue on " + fieldName + " needs a confidence");
        }
    }

    public static Issue lowConfidence(NormalizedField field, Severity severity, double confidence, String reason) {
        return new Issue(null, IssueType.LOW_CONFIDENCE, severity, field.fieldName(), field.recordId(),
                confidence, reason, field.evidenceRef(), severity == Severity.HIGH, null, List.of());
    }

    public static Issue normalizationFailure(String recordRef, String fieldName, Severity severity,
                                             String reason, String evidenceRef) {
        return new Issue(null, IssueType.NORMALIZATION_FAILURE, severity, fieldName, recordRef,
                0.0, reason, evidenceRef, severity == Severity.HIGH, null, List.of());
    }

    public static Issue inconsistency(EntityKey key, String fieldName, Severity severity, String reason,
                                      List<ConflictVariant> variants) {
        ConflictVariant first = variants.get(0);
        String evidence = variants.stream()
                .map(v -> v.value() + " <- " + String.join(", ", v.evidenceRefs()))
                .reduce((a, b) -> a + " | " + b)
                .orElse("");
        return new Issue(null, IssueType.INCONSISTENCY, severity, fieldName, first.recordRefs().get(0),
                null, reason, evidence, true, key.toString(), variants);
    }

    /** Creates a copy with a new ID. */
    public Issue withId(String newId) {
        return new Issue(newId, type, severity, fieldName, recordRef, confidence, reason, evidenceRef,
                decisionRequired, entityKey, variants);
    }

    /** Creates a copy with a new decision flag. */
    public Issue withDecisionRequired(boolean required) {
        return new Issue(id, type, severity, fieldName, recordRef, confidence, reason, evidenceRef,
                required, entityKey, variants);
    }
}
