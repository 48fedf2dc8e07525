package com.example.reconcile.model;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;

/**
 * Structured output handed to the report-rendering collaborator.
 * Holds no timestamps so identical input yields an identical report.
 */
public record ReviewReport(
        String documentName,
        int recordCount,
        int recordsWithIssues,
        int issueCount,
        Map<String, Long> severityDistribution,
        List<Issue> issues,
        List<AutoFixSuggestion> autoFixSuggestions,
        List<KeywordSignal> signals,
        Recommendation overallRecommendation
) {

    /**
     * Factory method that computes the distribution statistics.
     */
    public static ReviewReport from(String documentName, int recordCount, List<Issue> issues,
                                    List<AutoFixSuggestion> suggestions, List<KeywordSignal> signals,
                                    Recommendation recommendation) {
        Map<String, Long> distribution = new LinkedHashMap<>();
        for (Severity severity : Severity.values()) {
            distribution.put(severity.wireName(),
                    issues.stream().filter(i -> i.severity() == severity).count());
        }
        int recordsWithIssues = (int) issues.stream()
                .flatMap(i -> i.variants().isEmpty()
                        ? Stream.of(i.recordRef())
                        : i.variants().stream().flatMap(v -> v.recordRefs().stream()))
                .distinct()
                .count();
        return new ReviewReport(
                documentName,
                recordCount,
                recordsWithIssues,
                issues.size(),
                distribution,
                List.copyOf(issues),
                List.copyOf(suggestions),
                List.copyOf(signals),
                recommendation
        );
    }

    public ReviewReport withRecommendation(Recommendation recommendation) {
        return new ReviewReport(documentName, recordCount, recordsWithIssues, issueCount, severityDistribution,
                issues, autoFixSuggestions, signals, recommendation);
    }
}
