package com.example.reconcile.exception;

/**
 * A review decision that cannot be applied (unknown issue, missing resolution, issue already terminal).
 */
public class InvalidDecisionException extends RuntimeException {

    private final boolean conflict;

    public InvalidDecisionException(String message) {
        this(message, false);
    }

    private InvalidDecisionException(String message, boolean conflict) {
        super(message);
        this.conflict = conflict;
    }

    /** The decision is well-formed but the issue's current state does not accept it. */
    public static InvalidDecisionException conflict(String message) {
        return new InvalidDecisionException(message, true);
    }

    public boolean isConflict() {
        return conflict;
    }
}
