package com.example.reconcile.exception;

/**
 * The caller-imposed run timeout elapsed; the whole run is aborted and no partial report is returned.
 */
public class ReviewTimeoutException extends RuntimeException {

    public ReviewTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }
}
