package com.example.reconcile.model;

/**
 * Normalized field with its confidence in [0,1].
 */
public record ScoredField(NormalizedField field, double confidence) {}
