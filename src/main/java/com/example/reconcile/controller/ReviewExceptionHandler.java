package com.example.reconcile.controller;

import com.example.reconcile.exception.InvalidDecisionException;
import com.example.reconcile.exception.ReviewSessionNotFoundException;
import com.example.reconcile.exception.ReviewTimeoutException;
import com.example.reconcile.exception.RouterContractViolationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.util.Map;

/**
 * Maps review engine exceptions to {@code {error, message}} bodies.
 */
@RestControllerAdvice
public class ReviewExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ReviewExceptionHandler.class);

    @ExceptionHandler(ReviewSessionNotFoundException.class)
    public ResponseEntity<Map<String, String>> notFound(ReviewSessionNotFoundException e) {
        return error(HttpStatus.NOT_FOUND, "Review session not found", e);
    }

    @ExceptionHandler(InvalidDecisionException.class)
    public ResponseEntity<Map<String, String>> invalidDecision(InvalidDecisionException e) {
        return error(e.isConflict() ? HttpStatus.CONFLICT : HttpStatus.BAD_REQUEST, "Invalid decision", e);
    }

    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class})
    public ResponseEntity<Map<String, String>> badRequest(Exception e) {
        return error(HttpStatus.BAD_REQUEST, "Invalid request", e);
    }

    @ExceptionHandler(ReviewTimeoutException.class)
    public ResponseEntity<Map<String, String>> timeout(ReviewTimeoutException e) {
        log.error("Review run aborted: {}", e.getMessage());
        return error(HttpStatus.GATEWAY_TIMEOUT, "Review timed out", e);
    }

    @ExceptionHandler(RouterContractViolationException.class)
    public ResponseEntity<Map<String, String>> contractViolation(RouterContractViolationException e) {
        log.error("Issue router contract violated", e);
        return error(HttpStatus.INTERNAL_SERVER_ERROR, "Internal routing error", e);
    }

    private static ResponseEntity<Map<String, String>> error(HttpStatus status, String error, Exception e) {
        return ResponseEntity.status(status).body(Map.of(
                "error", error,
                "message", e.getMessage() != null ? e.getMessage() : "Unknown error"
        ));
    }
}
