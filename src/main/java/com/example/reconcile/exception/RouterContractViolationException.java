package com.example.reconcile.exception;

/**
 * An issue reached {@code resolved} without a backing decision or an eligible auto-apply.
 * Signals a defect in the routing logic, never bad input.
 */
public class RouterContractViolationException extends IllegalStateException {

    public RouterContractViolationException(String message) {
        super(message);
    }
}
