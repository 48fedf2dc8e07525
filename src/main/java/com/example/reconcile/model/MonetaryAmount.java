package com.example.reconcile.model;

import java.math.BigDecimal;

/**
 * Signed decimal amount with an ISO currency code.
 */
public record MonetaryAmount(BigDecimal value, String currency) implements TypedValue {

    @Override
    public String canonical() {
        return value.toPlainString() + " " + currency;
    }

    /** Sign-less key: a refund and its payment describe the same event. */
    @Override
    public String groupingKey() {
        return value.abs().toPlainString() + " " + currency;
    }

    public int signum() {
        return value.signum();
    }
}
