package com.example.reconcile.model;

/**
 * Overall outcome of a review run.
 */
public enum Recommendation {
    APPROVE,
    REVIEW_REQUIRED
}
