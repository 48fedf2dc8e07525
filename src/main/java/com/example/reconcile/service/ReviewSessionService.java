package com.example.reconcile.service;

import com.example.reconcile.exception.ReviewSessionNotFoundException;
import com.example.reconcile.model.AutoFixSuggestion;
import com.example.reconcile.model.CaseFile;
import com.example.reconcile.model.ReviewDecision;
import com.example.reconcile.model.ReviewRun;
import com.example.reconcile.model.ReviewSession;
import com.example.reconcile.model.RoutingResult;
import com.example.reconcile.orchestrator.ReviewPipelineOrchestrator;
import com.example.reconcile.repository.ReviewSessionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Two-phase review protocol. Phase one runs the pipeline and stores the session with issues
 * halted at {@code needs_human}; later calls load it, apply decisions or auto-fixes, and store
 * the updated copy. The router contract is checked after every mutation.
 */
@Service
public class ReviewSessionService {

    private static final Logger log = LoggerFactory.getLogger(ReviewSessionService.class);

    private final ReviewPipelineOrchestrator orchestrator;
    private final IssueRouter router;
    private final ReviewSessionRepository repository;
    private final Clock clock;

    public ReviewSessionService(ReviewPipelineOrchestrator orchestrator,
                                IssueRouter router,
                                ReviewSessionRepository repository,
                                Clock clock) {
        this.orchestrator = orchestrator;
        this.router = router;
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Runs the pipeline and persists the resulting session.
     *
     * @param autoApplyThreshold optional override of the configured auto-apply threshold
     */
    public ReviewSession start(CaseFile caseFile, Double autoApplyThreshold) {
        validateThreshold(autoApplyThreshold);
        ReviewRun run = orchestrator.run(caseFile, autoApplyThreshold);
        Instant now = clock.instant();
        ReviewSession session = new ReviewSession(UUID.randomUUID().toString(), caseFile.documentName(),
                run.report(), run.routing().statuses(), run.appliedFixes(), now, now);
        ReviewSession saved = repository.save(session);
        log.info("Review session {} stored for '{}': {}", saved.id(), saved.documentName(),
                saved.report().overallRecommendation());
        return saved;
    }

    /** Runs the pipeline without persisting anything. */
    public ReviewRun preview(CaseFile caseFile, Double autoApplyThreshold) {
        validateThreshold(autoApplyThreshold);
        return orchestrator.run(caseFile, autoApplyThreshold);
    }

    public ReviewSession get(String sessionId) {
        return repository.findById(sessionId)
                .orElseThrow(() -> new ReviewSessionNotFoundException(sessionId));
    }

    /**
     * Applies human decisions to a stored session. The batch is rejected as a whole
     * when any decision is invalid.
     */
    public ReviewSession submitDecisions(String sessionId, List<ReviewDecision> decisions) {
        ReviewSession session = get(sessionId);
        RoutingResult updated = router.applyDecisions(routingOf(session), decisions);
        ReviewSession saved = repository.save(session.withProgress(updated.report(), updated.statuses(),
                session.appliedFixes(), clock.instant()));
        log.info("Review session {}: {} decisions applied, recommendation {}", sessionId, decisions.size(),
                saved.report().overallRecommendation());
        return saved;
    }

    /**
     * Applies stored auto-fix suggestions with confidence at or above {@code threshold}.
     */
    public ReviewSession autoApply(String sessionId, double threshold) {
        validateThreshold(threshold);
        ReviewSession session = get(sessionId);
        IssueRouter.AutoApplyResult result = router.autoApply(routingOf(session), threshold);

        List<AutoFixSuggestion> appliedFixes = new ArrayList<>(session.appliedFixes());
        result.applied().stream().filter(fix -> !appliedFixes.contains(fix)).forEach(appliedFixes::add);

        ReviewSession saved = repository.save(session.withProgress(result.routing().report(),
                result.routing().statuses(), appliedFixes, clock.instant()));
        log.info("Review session {}: {} fixes auto-applied at {}", sessionId, result.applied().size(), threshold);
        return saved;
    }

    private RoutingResult routingOf(ReviewSession session) {
        RoutingResult routing = new RoutingResult(session.report(), session.statuses());
        router.verifyContract(routing);
        return routing;
    }

    private static void validateThreshold(Double threshold) {
        if (threshold != null && (threshold < 0.0 || threshold > 1.0 || threshold.isNaN())) {
            throw new IllegalArgumentException("Auto-apply threshold must be within [0, 1], got " + threshold);
        }
    }
}
