package com.example.reconcile.field;

import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.NormalizedField;

import java.util.Optional;

/**
 * Capability implemented once per {@link FieldType}: normalize a raw value, score the
 * result in isolation, and propose a formatting-only fix.
 * <p>
 * Implementations are stateless and thread-safe.
 */
public interface FieldHandler {

    /** Score of a strictly valid value with no known ambiguity. */
    double STRICT_SCORE = 0.98;

    FieldType type();

    /**
     * Parses a non-blank raw value.
     *
     * @param raw raw extracted text, never blank
     * @return typed value, plausible value with a strict violation, or failure
     */
    NormalizationOutcome normalize(String raw);

    /**
     * Confidence of a successfully normalized field before cross-field corroboration.
     */
    double baseScore(NormalizedField field);

    /**
     * Canonical surface form for a field whose raw text differs only in formatting.
     * Empty when no value-preserving transform exists.
     */
    Optional<FixProposal> proposeFix(NormalizedField field);
}
