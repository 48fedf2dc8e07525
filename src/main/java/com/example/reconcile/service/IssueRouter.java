package com.example.reconcile.service;

import com.example.reconcile.exception.InvalidDecisionException;
import com.example.reconcile.exception.RouterContractViolationException;
import com.example.reconcile.model.AutoFixSuggestion;
import com.example.reconcile.model.Issue;
import com.example.reconcile.model.IssueState;
import com.example.reconcile.model.IssueStatus;
import com.example.reconcile.model.IssueType;
import com.example.reconcile.model.KeywordSignal;
import com.example.reconcile.model.Recommendation;
import com.example.reconcile.model.ReviewDecision;
import com.example.reconcile.model.ReviewReport;
import com.example.reconcile.model.RoutingResult;
import com.example.reconcile.model.Severity;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;

/**
 * Merges the findings of scorer and checker into the ordered report, assigns ids,
 * decides which issues need a human, and drives the per-issue state machine.
 * <p>
 * Stateless: every operation takes the current {@link RoutingResult} and returns a new one.
 */
@Service
public class IssueRouter {

    private static final Logger log = LoggerFactory.getLogger(IssueRouter.class);

    /** Presentation order: severity (high first), type, field, record, reason. */
    static final Comparator<Issue> ISSUE_ORDER = Comparator
            .comparing(Issue::severity)
            .thenComparing(Issue::type)
            .thenComparing(Issue::fieldName)
            .thenComparing(Issue::recordRef)
            .thenComparing(Issue::reason);

    /**
     * Outcome of an auto-apply pass.
     *
     * @param routing updated routing state
     * @param applied suggestions applied in this pass
     */
    public record AutoApplyResult(RoutingResult routing, List<AutoFixSuggestion> applied) {}

    /**
     * Builds the report from the merged component outputs. Issues halt at
     * {@code auto_fix_available} or {@code needs_human}; nothing is resolved here.
     */
    public RoutingResult route(String documentName, int recordCount, List<Issue> issues,
                               List<AutoFixSuggestion> suggestions, List<KeywordSignal> signals) {
        Set<String> fixedFields = suggestions.stream()
                .map(s -> fieldKey(s.recordRef(), s.fieldName()))
                .collect(Collectors.toSet());

        List<Issue> ordered = issues.stream()
                .map(i -> i.withDecisionRequired(requiresDecision(i)))
                .sorted(ISSUE_ORDER)
                .toList();
        List<Issue> routed = assignIds(ordered);
        List<AutoFixSuggestion> linked = linkSuggestions(suggestions, routed);

        List<IssueStatus> statuses = new ArrayList<>(routed.size());
        for (Issue issue : routed) {
            boolean fixable = !issue.decisionRequired() && fixedFields.contains(fieldKey(issue.recordRef(), issue.fieldName()));
            IssueStatus status = IssueStatus.detected(issue)
                    .moveTo(fixable ? IssueState.AUTO_FIX_AVAILABLE : IssueState.NEEDS_HUMAN);
            statuses.add(status);
        }

        ReviewReport report = ReviewReport.from(documentName, recordCount, routed, linked, signals,
                recommendationFor(statuses));
        RoutingResult result = new RoutingResult(report, statuses);
        verifyContract(result);

        log.info("IssueRouter: {} issues ({} need a human), {} auto-fixes, recommendation {}",
                routed.size(), statuses.stream().filter(s -> s.state() == IssueState.NEEDS_HUMAN).count(),
                linked.size(), report.overallRecommendation());
        return result;
    }

    /**
     * Applies external decisions. Decisions are validated as a batch before any is applied.
     *
     * @throws InvalidDecisionException unknown issue, missing resolution, or issue already terminal
     */
    public RoutingResult applyDecisions(RoutingResult current, List<ReviewDecision> decisions) {
        Map<String, IssueStatus> byId = indexById(current.statuses());
        Set<String> seen = new HashSet<>();
        for (ReviewDecision decision : decisions) {
            if (decision.issueId() == null || !byId.containsKey(decision.issueId())) {
                throw new InvalidDecisionException("Unknown issue id: " + decision.issueId());
            }
            if (decision.resolution() == null) {
                throw new InvalidDecisionException("Decision on " + decision.issueId() + " has no resolution");
            }
            if (!seen.add(decision.issueId())) {
                throw new InvalidDecisionException("More than one decision for " + decision.issueId());
            }
            IssueStatus status = byId.get(decision.issueId());
            if (status.state().isTerminal()) {
                throw InvalidDecisionException.conflict("Issue %s is already %s"
                        .formatted(status.issueId(), status.state().wireName()));
            }
        }

        for (ReviewDecision decision : decisions) {
            IssueStatus status = byId.get(decision.issueId());
            byId.put(decision.issueId(), status.decided(decision.resolution(), decision.resolvedValue()));
            log.debug("IssueRouter: {} -> {}", decision.issueId(), decision.resolution().wireName());
        }

        RoutingResult updated = withStatuses(current, List.copyOf(byId.values()));
        verifyContract(updated);
        log.info("IssueRouter: applied {} decisions, recommendation {}", decisions.size(),
                updated.report().overallRecommendation());
        return updated;
    }

    /**
     * Applies auto-fix suggestions at or above {@code threshold}. An issue is resolved only when it
     * does not require a decision and is waiting in {@code auto_fix_available}; suggestions on
     * decision-required issues are left for the reviewer.
     */
    public AutoApplyResult autoApply(RoutingResult current, double threshold) {
        Map<String, IssueStatus> byId = indexById(current.statuses());
        List<AutoFixSuggestion> applied = new ArrayList<>();

        for (AutoFixSuggestion suggestion : current.report().autoFixSuggestions()) {
            if (suggestion.confidence() < threshold) continue;
            if (suggestion.issueRef() == null) {
                applied.add(suggestion);
                continue;
            }
            IssueStatus status = byId.get(suggestion.issueRef());
            if (status != null && status.state() == IssueState.AUTO_FIX_AVAILABLE && !status.decisionRequired()) {
                byId.put(status.issueId(), status.autoResolved(suggestion.suggestedValue()));
                applied.add(suggestion);
            }
        }

        RoutingResult updated = withStatuses(current, List.copyOf(byId.values()));
        verifyContract(updated);
        log.info("IssueRouter: auto-applied {} fixes at threshold {}", applied.size(), threshold);
        return new AutoApplyResult(updated, applied);
    }

    /**
     * Checks that every resolved issue is backed by a decision or an eligible auto-apply.
     *
     * @throws RouterContractViolationException when the routing state is inconsistent
     */
    public void verifyContract(RoutingResult result) {
        List<Issue> issues = result.report().issues();
        if (issues.size() != result.statuses().size()) {
            throw new RouterContractViolationException("%d issues but %d statuses"
                    .formatted(issues.size(), result.statuses().size()));
        }
        Set<String> fixedIssues = result.report().autoFixSuggestions().stream()
                .map(AutoFixSuggestion::issueRef)
                .filter(Objects::nonNull)
                .collect(Collectors.toSet());

        for (int i = 0; i < issues.size(); i++) {
            Issue issue = issues.get(i);
            IssueStatus status = result.statuses().get(i);
            if (!issue.id().equals(status.issueId())) {
                throw new RouterContractViolationException("Status %s out of order, expected %s"
                        .formatted(status.issueId(), issue.id()));
            }
            if (status.state() != IssueState.RESOLVED || status.resolution() != null) continue;

            boolean eligible = status.autoApplied() && !status.decisionRequired() && fixedIssues.contains(issue.id());
            if (!eligible) {
                throw new RouterContractViolationException(
                        "Issue %s resolved without a decision or an eligible auto-fix".formatted(issue.id()));
            }
        }
    }

    /** High severity always needs a human; inconsistencies never pick a winner on their own. */
    static boolean requiresDecision(Issue issue) {
        return issue.decisionRequired()
                || issue.severity() == Severity.HIGH
                || issue.type() == IssueType.INCONSISTENCY;
    }

    static Recommendation recommendationFor(List<IssueStatus> statuses) {
        return statuses.stream().anyMatch(IssueStatus::isBlocking)
                ? Recommendation.REVIEW_REQUIRED
                : Recommendation.APPROVE;
    }

    private List<Issue> assignIds(List<Issue> ordered) {
        Map<IssueType, AtomicInteger> counters = new EnumMap<>(IssueType.class);
        List<Issue> routed = new ArrayList<>(ordered.size());
        for (Issue issue : ordered) {
            int seq = counters.computeIfAbsent(issue.type(), k -> new AtomicInteger()).incrementAndGet();
            routed.add(issue.withId("%s-%03d".formatted(issue.type().idPrefix(), seq)));
        }
        return routed;
    }

    private List<AutoFixSuggestion> linkSuggestions(List<AutoFixSuggestion> suggestions, List<Issue> routed) {
        Map<String, String> firstIssueByField = new LinkedHashMap<>();
        for (Issue issue : routed) {
            firstIssueByField.putIfAbsent(fieldKey(issue.recordRef(), issue.fieldName()), issue.id());
        }
        return suggestions.stream()
                .map(s -> s.withIssueRef(firstIssueByField.get(fieldKey(s.recordRef(), s.fieldName()))))
                .toList();
    }

    private RoutingResult withStatuses(RoutingResult current, List<IssueStatus> statuses) {
        ReviewReport report = current.report().withRecommendation(recommendationFor(statuses));
        return new RoutingResult(report, statuses);
    }

    private static Map<String, IssueStatus> indexById(List<IssueStatus> statuses) {
        Map<String, IssueStatus> byId = new LinkedHashMap<>();
        statuses.forEach(s -> byId.put(s.issueId(), s));
        return byId;
    }

    private static String fieldKey(String recordRef, String fieldName) {
        return recordRef + "\u0000" + fieldName;
    }
}
