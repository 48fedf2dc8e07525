package com.example.reconcile.model;

/**
 * Human decision on an issue, supplied by the review collaborator.
 *
 * @param issueId       issue the decision applies to
 * @param resolution    accepted, rejected or deferred
 * @param resolvedValue corrected value chosen by the reviewer (optional)
 */
public record ReviewDecision(
        String issueId,
        Resolution resolution,
        String resolvedValue
) {}
