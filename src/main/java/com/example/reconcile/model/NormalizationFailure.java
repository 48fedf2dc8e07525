package com.example.reconcile.model;

/**
 * Reason a raw value could not be turned into a typed value.
 */
public record NormalizationFailure(String reason, String ruleId) {}
