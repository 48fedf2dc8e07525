package com.example.reconcile.model;

/**
 * Kind of real-world entity an identifier field points to.
 */
public enum EntityKind {
    PERSON,
    POLICY,
    TICKET
}
