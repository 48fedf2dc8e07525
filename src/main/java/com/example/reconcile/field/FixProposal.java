package com.example.reconcile.field;

/**
 * Value-preserving correction of a field's surface form.
 *
 * @param suggestedValue canonical surface form
 * @param confidence     certainty that the transform is value-preserving
 */
public record FixProposal(String suggestedValue, double confidence) {}
