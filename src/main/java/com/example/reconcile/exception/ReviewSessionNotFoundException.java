package com.example.reconcile.exception;

public class ReviewSessionNotFoundException extends RuntimeException {

    public ReviewSessionNotFoundException(String sessionId) {
        super("Review session not found: " + sessionId);
    }
}
