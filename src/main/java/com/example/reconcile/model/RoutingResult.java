package com.example.reconcile.model;

import java.util.List;

/**
 * Router output: the report plus one routing status per issue, in report order.
 */
public record RoutingResult(ReviewReport report, List<IssueStatus> statuses) {

    public RoutingResult {
        statuses = List.copyOf(statuses);
    }
}
