package com.example.reconcile.model;

/**
 * Email address; the domain is stored lower-case.
 */
public record EmailAddress(String localPart, String domain) implements TypedValue {

    @Override
    public String canonical() {
        return localPart + "@" + domain;
    }
}
