package com.example.reconcile.model;

/**
 * Semantic value produced by a successful normalization.
 */
public interface TypedValue {

    /** Canonical surface form; equal canonical forms mean equal values. */
    String canonical();

    /** Key used when this value identifies an event, e.g. an amount's magnitude. */
    default String groupingKey() {
        return canonical();
    }
}
