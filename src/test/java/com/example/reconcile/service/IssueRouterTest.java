package com.example.reconcile.service;

import com.example.reconcile.exception.InvalidDecisionException;
import com.example.reconcile.exception.RouterContractViolationException;
import com.example.reconcile.model.AutoFixSuggestion;
import com.example.reconcile.model.ConflictVariant;
import com.example.reconcile.model.EmailAddress;
import com.example.reconcile.model.EntityKey;
import com.example.reconcile.model.EntityKind;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.FreeText;
import com.example.reconcile.model.Issue;
import com.example.reconcile.model.IssueState;
import com.example.reconcile.model.IssueStatus;
import com.example.reconcile.model.IssueType;
import com.example.reconcile.model.NormalizedField;
import com.example.reconcile.model.Recommendation;
import com.example.reconcile.model.Resolution;
import com.example.reconcile.model.ReviewDecision;
import com.example.reconcile.model.RoutingResult;
import com.example.reconcile.model.Severity;
import com.example.reconcile.model.SourceLocation;
import com.example.reconcile.model.TypedValue;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;

class IssueRouterTest {

    private final IssueRouter router = new IssueRouter();

    private static NormalizedField field(String record, String name, FieldType type, TypedValue value) {
        return new NormalizedField(record, name, type, "raw", new SourceLocation(1, null), value, null, "rule", null);
    }

    private static Issue emailIssue() {
        return Issue.lowConfidence(field("C1", "email", FieldType.EMAIL, new EmailAddress("mario", "gmail")),
                Severity.HIGH, 0.92, "email domain has no top-level domain");
    }

    private static Issue dateConflict() {
        return Issue.inconsistency(new EntityKey(EntityKind.POLICY, "PLZ-1"), "data", Severity.HIGH, "dates differ",
                List.of(new ConflictVariant("2024-01-13", 2, List.of("T1", "T2"), List.of("e1", "e2"), 2),
                        new ConflictVariant("2024-01", 1, List.of("T3"), List.of("e3"), 4)));
    }

    private static Issue noisyNote() {
        return Issue.lowConfidence(field("K1", "descrizione", FieldType.FREE_TEXT, new FreeText("ritardo", List.of())),
                Severity.LOW, 0.70, "text contains unreadable characters");
    }

    private static Issue ambiguousAmount() {
        return Issue.lowConfidence(field("T1", "importo", FieldType.AMOUNT, new FreeText("x", List.of())),
                Severity.MEDIUM, 0.83, "positive amount on a refund transaction");
    }

    private static Issue badFiscalCode() {
        return Issue.normalizationFailure("C1", "codice_fiscale", Severity.HIGH, "checksum invalid", "C1.codice_fiscale @ page 1");
    }

    private static Issue blankAddress() {
        return Issue.normalizationFailure("C1", "indirizzo", Severity.LOW, "empty value", "C1.indirizzo @ page 1");
    }

    private static final AutoFixSuggestion NOTE_FIX =
            new AutoFixSuggestion("descrizione", "K1", "ritardo\u0007", "ritardo", 0.80, null);
    private static final AutoFixSuggestion EMAIL_FIX =
            new AutoFixSuggestion("email", "C1", "mario@gmail", "mario@gmail.com", 0.99, null);
    private static final AutoFixSuggestion PHONE_FIX =
            new AutoFixSuggestion("telefono", "C2", "333 1234567", "+393331234567", 0.80, null);

    private RoutingResult route(List<Issue> issues, List<AutoFixSuggestion> fixes) {
        return router.route("case.pdf", 5, issues, fixes, List.of());
    }

    @Nested
    @DisplayName("route")
    class Route {

        @Test
        @DisplayName("orders by severity then type then field, and numbers per type")
        void ordering() {
            RoutingResult result = route(
                    List.of(blankAddress(), ambiguousAmount(), badFiscalCode(), emailIssue(), dateConflict()), List.of());

            assertThat(result.report().issues()).extracting(Issue::id)
                    .containsExactly("INC-001", "LOW-001", "NRM-001", "LOW-002", "NRM-002");
            assertThat(result.report().issues()).extracting(Issue::fieldName)
                    .containsExactly("data", "email", "codice_fiscale", "importo", "indirizzo");
        }

        @Test
        @DisplayName("identical input in any order yields an identical report")
        void deterministic() {
            List<Issue> issues = new ArrayList<>(List.of(
                    blankAddress(), ambiguousAmount(), badFiscalCode(), emailIssue(), dateConflict(), noisyNote()));
            RoutingResult first = route(issues, List.of(NOTE_FIX));
            Collections.reverse(issues);
            RoutingResult second = route(issues, List.of(NOTE_FIX));

            assertThat(second.report()).isEqualTo(first.report());
            assertThat(second.statuses()).isEqualTo(first.statuses());
        }

        @Test
        @DisplayName("halts high severity issues at needs_human and fixable ones at auto_fix_available")
        void initialStates() {
            RoutingResult result = route(List.of(emailIssue(), noisyNote(), blankAddress()), List.of(EMAIL_FIX, NOTE_FIX));

            assertThat(result.statuses()).extracting(IssueStatus::issueId, IssueStatus::state).containsExactly(
                    tuple("LOW-001", IssueState.NEEDS_HUMAN),
                    tuple("LOW-002", IssueState.AUTO_FIX_AVAILABLE),
                    tuple("NRM-001", IssueState.NEEDS_HUMAN));
            assertThat(result.report().autoFixSuggestions()).extracting(AutoFixSuggestion::issueRef)
                    .containsExactly("LOW-001", "LOW-002");
        }

        @Test
        @DisplayName("high severity forces a decision even without the flag")
        void highSeverityRequiresDecision() {
            Issue unflagged = new Issue(null, IssueType.NORMALIZATION_FAILURE, Severity.HIGH,
                    "iban", "C1", 0.0, "checksum invalid", "C1.iban", false, null, List.of());

            assertThat(route(List.of(unflagged), List.of()).report().issues().get(0).decisionRequired()).isTrue();
        }

        @Test
        @DisplayName("recommendation")
        void recommendation() {
            assertThat(route(List.of(dateConflict()), List.of()).report().overallRecommendation())
                    .isEqualTo(Recommendation.REVIEW_REQUIRED);
            assertThat(route(List.of(ambiguousAmount(), noisyNote()), List.of()).report().overallRecommendation())
                    .isEqualTo(Recommendation.APPROVE);
            assertThat(route(List.of(), List.of(PHONE_FIX)).report().overallRecommendation())
                    .isEqualTo(Recommendation.APPROVE);
        }

        @Test
        @DisplayName("report carries counts and severity distribution")
        void reportCounts() {
            RoutingResult result = route(List.of(dateConflict(), emailIssue(), blankAddress()), List.of());

            assertThat(result.report().recordCount()).isEqualTo(5);
            assertThat(result.report().issueCount()).isEqualTo(3);
            assertThat(result.report().recordsWithIssues()).isEqualTo(4);
            assertThat(result.report().severityDistribution()).containsExactly(
                    Map.entry("high", 2L), Map.entry("medium", 0L), Map.entry("low", 1L));
        }
    }

    @Nested
    @DisplayName("decisions")
    class Decisions {

        private RoutingResult routed;

        @BeforeEach
        void setUp() {
            routed = route(List.of(dateConflict(), emailIssue()), List.of());
        }

        @Test
        @DisplayName("accepting every blocking issue approves the report")
        void acceptAll() {
            RoutingResult decided = router.applyDecisions(routed, List.of(
                    new ReviewDecision("INC-001", Resolution.ACCEPTED, "2024-01-13"),
                    new ReviewDecision("LOW-001", Resolution.REJECTED, null)));

            assertThat(decided.statuses()).allMatch(s -> s.state() == IssueState.RESOLVED);
            assertThat(decided.statuses().get(0).resolvedValue()).isEqualTo("2024-01-13");
            assertThat(decided.report().overallRecommendation()).isEqualTo(Recommendation.APPROVE);
        }

        @Test
        @DisplayName("a deferred issue stays blocking")
        void deferred() {
            RoutingResult decided = router.applyDecisions(routed, List.of(
                    new ReviewDecision("INC-001", Resolution.ACCEPTED, "2024-01-13"),
                    new ReviewDecision("LOW-001", Resolution.DEFERRED, null)));

            assertThat(decided.statuses().get(1).state()).isEqualTo(IssueState.DEFERRED);
            assertThat(decided.report().overallRecommendation()).isEqualTo(Recommendation.REVIEW_REQUIRED);
        }

        @Test
        void unknownIssue() {
            assertThatThrownBy(() -> router.applyDecisions(routed,
                    List.of(new ReviewDecision("INC-042", Resolution.ACCEPTED, null))))
                    .isInstanceOf(InvalidDecisionException.class)
                    .hasMessageContaining("INC-042")
                    .matches(e -> !((InvalidDecisionException) e).isConflict());
        }

        @Test
        void missingResolution() {
            assertThatThrownBy(() -> router.applyDecisions(routed, List.of(new ReviewDecision("INC-001", null, null))))
                    .isInstanceOf(InvalidDecisionException.class);
        }

        @Test
        @DisplayName("terminal issues accept no further decisions")
        void terminal() {
            RoutingResult decided = router.applyDecisions(routed,
                    List.of(new ReviewDecision("INC-001", Resolution.DEFERRED, null)));

            assertThatThrownBy(() -> router.applyDecisions(decided,
                    List.of(new ReviewDecision("INC-001", Resolution.ACCEPTED, null))))
                    .isInstanceOf(InvalidDecisionException.class)
                    .matches(e -> ((InvalidDecisionException) e).isConflict());
        }

        @Test
        @DisplayName("an invalid batch leaves every issue untouched")
        void atomicBatch() {
            assertThatThrownBy(() -> router.applyDecisions(routed, List.of(
                    new ReviewDecision("INC-001", Resolution.ACCEPTED, null),
                    new ReviewDecision("INC-001", Resolution.REJECTED, null))))
                    .isInstanceOf(InvalidDecisionException.class);

            assertThat(routed.statuses()).allMatch(s -> s.state() == IssueState.NEEDS_HUMAN);
        }
    }

    @Nested
    @DisplayName("auto-apply")
    class AutoApply {

        @Test
        @DisplayName("resolves only non-blocking issues whose fix clears the threshold")
        void threshold() {
            RoutingResult routed = route(List.of(emailIssue(), noisyNote()), List.of(EMAIL_FIX, NOTE_FIX, PHONE_FIX));

            IssueRouter.AutoApplyResult low = router.autoApply(routed, 0.75);

            assertThat(low.applied()).containsExactly(NOTE_FIX.withIssueRef("LOW-002"), PHONE_FIX);
            assertThat(low.routing().statuses().get(0).state()).isEqualTo(IssueState.NEEDS_HUMAN);
            IssueStatus note = low.routing().statuses().get(1);
            assertThat(note.state()).isEqualTo(IssueState.RESOLVED);
            assertThat(note.autoApplied()).isTrue();
            assertThat(note.resolvedValue()).isEqualTo("ritardo");

            IssueRouter.AutoApplyResult high = router.autoApply(routed, 0.9);
            assertThat(high.applied()).isEmpty();
            assertThat(high.routing().statuses().get(1).state()).isEqualTo(IssueState.AUTO_FIX_AVAILABLE);
        }
    }

    @Nested
    @DisplayName("contract")
    class Contract {

        @Test
        @DisplayName("a resolution without decision or eligible fix is a violation")
        void resolvedWithoutBacking() {
            RoutingResult routed = route(List.of(emailIssue()), List.of());
            IssueStatus forged = new IssueStatus("LOW-001", IssueState.RESOLVED, true, Severity.HIGH, null, "x", true);

            assertThatThrownBy(() -> router.verifyContract(new RoutingResult(routed.report(), List.of(forged))))
                    .isInstanceOf(RouterContractViolationException.class)
                    .hasMessageContaining("LOW-001");
        }

        @Test
        void statusCountMismatch() {
            RoutingResult routed = route(List.of(emailIssue()), List.of());

            assertThatThrownBy(() -> router.verifyContract(new RoutingResult(routed.report(), List.of())))
                    .isInstanceOf(RouterContractViolationException.class);
        }

        @Test
        @DisplayName("states only move forward")
        void illegalTransition() {
            IssueStatus status = IssueStatus.detected(emailIssue().withId("LOW-001"));

            assertThatThrownBy(() -> status.moveTo(IssueState.RESOLVED)).isInstanceOf(IllegalStateException.class);
        }
    }
}
