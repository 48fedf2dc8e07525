package com.example.reconcile.model;

import java.util.List;

/**
 * Result of one pipeline run: the routed report plus the fixes applied by the caller's auto-apply policy.
 */
public record ReviewRun(RoutingResult routing, List<AutoFixSuggestion> appliedFixes) {

    public ReviewRun {
        appliedFixes = appliedFixes != null ? List.copyOf(appliedFixes) : List.of();
    }

    public ReviewReport report() {
        return routing.report();
    }
}
