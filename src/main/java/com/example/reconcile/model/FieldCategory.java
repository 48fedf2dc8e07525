package com.example.reconcile.model;

/**
 * Coarse grouping of field types, used for thresholds and severities.
 */
public enum FieldCategory {
    IDENTITY,
    CONTACT,
    VALUE,
    FREE_TEXT
}
