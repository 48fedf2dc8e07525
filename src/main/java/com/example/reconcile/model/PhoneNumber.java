package com.example.reconcile.model;

/**
 * E.164 phone number split into country calling code and subscriber digits.
 */
public record PhoneNumber(String countryCode, String subscriber) implements TypedValue {

    @Override
    public String canonical() {
        return "+" + countryCode + subscriber;
    }
}
