package com.example.reconcile.model;

/**
 * Precision of a normalized calendar date.
 */
public enum DateGranularity {
    DAY,
    MONTH,
    YEAR
}
