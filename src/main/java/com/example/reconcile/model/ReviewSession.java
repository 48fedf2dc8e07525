package com.example.reconcile.model;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;

/**
 * Persisted review run. Phase one stores it with issues halted at {@code needs_human};
 * phase two loads it, applies decisions and stores the new copy.
 */
@Document(collection = "review_sessions")
public record ReviewSession(
        @Id String id,
        String documentName,
        ReviewReport report,
        List<IssueStatus> statuses,
        List<AutoFixSuggestion> appliedFixes,
        Instant createdAt,
        Instant updatedAt
) {
    public ReviewSession {
        statuses = statuses != null ? List.copyOf(statuses) : List.of();
        appliedFixes = appliedFixes != null ? List.copyOf(appliedFixes) : List.of();
    }

    public ReviewSession withProgress(ReviewReport newReport, List<IssueStatus> newStatuses,
                                      List<AutoFixSuggestion> newAppliedFixes, Instant now) {
        return new ReviewSession(id, documentName, newReport, newStatuses, newAppliedFixes, createdAt, now);
    }
}
