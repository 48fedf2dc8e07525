package com.example.reconcile.orchestrator;

import com.example.reconcile.config.ReviewProperties;
import com.example.reconcile.exception.ReviewTimeoutException;
import com.example.reconcile.model.AutoFixSuggestion;
import com.example.reconcile.model.CaseFile;
import com.example.reconcile.model.CaseRecord;
import com.example.reconcile.model.EntityKey;
import com.example.reconcile.model.Issue;
import com.example.reconcile.model.KeywordSignal;
import com.example.reconcile.model.RecordInput;
import com.example.reconcile.model.ReviewRun;
import com.example.reconcile.model.RoutingResult;
import com.example.reconcile.model.ScoredField;
import com.example.reconcile.service.AutoFixProposer;
import com.example.reconcile.service.ConfidenceScorer;
import com.example.reconcile.service.ConsistencyChecker;
import com.example.reconcile.service.FieldNormalizer;
import com.example.reconcile.service.IssueRouter;
import com.example.reconcile.service.KeywordSignalDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Review pipeline orchestrator.
 * Pipeline:
 * 1. Parallel normalization, one task per record
 * 2. Confidence scoring, one task per record
 * 3. Consistency check, one task per entity group (runs alongside step 2)
 * 4. Keyword signals and auto-fix proposals
 * 5. Issue routing
 * 6. Optional auto-apply above the caller's threshold
 * <p>
 * The whole run is bounded by {@code review.pipeline.timeout}; on expiry it is aborted
 * and no partial report is produced.
 */
@Service
public class ReviewPipelineOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ReviewPipelineOrchestrator.class);

    private final FieldNormalizer normalizer;
    private final ConfidenceScorer scorer;
    private final ConsistencyChecker checker;
    private final KeywordSignalDetector signalDetector;
    private final AutoFixProposer proposer;
    private final IssueRouter router;
    private final ExecutorService reviewExecutor;
    private final ReviewProperties.Pipeline pipeline;

    public ReviewPipelineOrchestrator(FieldNormalizer normalizer,
                                      ConfidenceScorer scorer,
                                      ConsistencyChecker checker,
                                      KeywordSignalDetector signalDetector,
                                      AutoFixProposer proposer,
                                      IssueRouter router,
                                      ExecutorService reviewExecutor,
                                      ReviewProperties properties) {
        this.normalizer = normalizer;
        this.scorer = scorer;
        this.checker = checker;
        this.signalDetector = signalDetector;
        this.proposer = proposer;
        this.router = router;
        this.reviewExecutor = reviewExecutor;
        this.pipeline = properties.pipeline();
    }

    /** Runs the pipeline with the configured auto-apply threshold. */
    public ReviewRun run(CaseFile caseFile) {
        return run(caseFile, null);
    }

    /**
     * Runs the pipeline.
     *
     * @param caseFile           records to review
     * @param autoApplyThreshold overrides the configured threshold; null falls back to it,
     *                           and when both are absent nothing is applied
     * @throws ReviewTimeoutException when the run exceeds the configured timeout
     */
    public ReviewRun run(CaseFile caseFile, Double autoApplyThreshold) {
        String documentName = caseFile.documentName();
        long deadline = System.nanoTime() + pipeline.timeout().toNanos();
        log.info("Starting review pipeline for '{}' ({} records)", documentName, caseFile.records().size());

        // Step 1: normalization
        log.info("[1/6] Normalizing {} records...", caseFile.records().size());
        List<CompletableFuture<FieldNormalizer.Result>> normalizeFutures = new ArrayList<>();
        for (int i = 0; i < caseFile.records().size(); i++) {
            RecordInput input = caseFile.records().get(i);
            int position = i;
            normalizeFutures.add(CompletableFuture.supplyAsync(() -> normalizer.normalize(input, position), reviewExecutor));
        }
        List<FieldNormalizer.Result> normalized = awaitAll(normalizeFutures, deadline, "normalization");

        List<CaseRecord> records = new ArrayList<>();
        List<Issue> structuralIssues = new ArrayList<>();
        for (FieldNormalizer.Result result : normalized) {
            if (result.isMalformed()) {
                structuralIssues.add(result.structuralIssue());
            } else {
                records.add(result.record());
            }
        }
        log.info("[1/6] Normalization completed: {} records, {} malformed", records.size(), structuralIssues.size());

        // Steps 2 and 3: scoring and consistency checks are independent
        log.info("[2/6] Scoring {} records...", records.size());
        List<CompletableFuture<ConfidenceScorer.RecordScore>> scoreFutures = records.stream()
                .map(r -> CompletableFuture.supplyAsync(() -> scorer.score(r), reviewExecutor))
                .toList();

        Map<EntityKey, List<CaseRecord>> groups = checker.group(records);
        log.info("[3/6] Checking consistency across {} entity groups...", groups.size());
        List<CompletableFuture<List<Issue>>> checkFutures = groups.entrySet().stream()
                .map(e -> CompletableFuture.supplyAsync(() -> checker.check(e.getKey(), e.getValue()), reviewExecutor))
                .toList();

        List<ConfidenceScorer.RecordScore> scores = awaitAll(scoreFutures, deadline, "scoring");
        List<ScoredField> scoredFields = new ArrayList<>();
        List<Issue> scoringIssues = new ArrayList<>();
        scores.forEach(s -> {
            scoredFields.addAll(s.scores());
            scoringIssues.addAll(s.issues());
        });
        records.forEach(r -> scoringIssues.addAll(scorer.missingRequired(r)));
        log.info("[2/6] Scoring completed: {} fields, {} issues", scoredFields.size(), scoringIssues.size());

        List<Issue> inconsistencies = awaitAll(checkFutures, deadline, "consistency check").stream()
                .flatMap(List::stream)
                .toList();
        log.info("[3/6] Consistency check completed: {} inconsistencies", inconsistencies.size());

        // Step 4: signals and proposals
        log.info("[4/6] Detecting keyword signals and proposing auto-fixes...");
        List<KeywordSignal> signals = signalDetector.detect(records);
        List<AutoFixSuggestion> suggestions = proposer.propose(scoredFields);
        log.info("[4/6] {} signals, {} auto-fix suggestions", signals.size(), suggestions.size());

        // Step 5: routing
        log.info("[5/6] Routing issues...");
        List<Issue> allIssues = new ArrayList<>(structuralIssues);
        allIssues.addAll(scoringIssues);
        allIssues.addAll(inconsistencies);
        RoutingResult routing = router.route(documentName, caseFile.records().size(), allIssues, suggestions, signals);

        // Step 6: optional auto-apply
        Double threshold = autoApplyThreshold != null ? autoApplyThreshold : pipeline.autoApplyThreshold();
        List<AutoFixSuggestion> applied = List.of();
        if (threshold != null) {
            log.info("[6/6] Auto-applying fixes with confidence >= {}...", threshold);
            IssueRouter.AutoApplyResult autoApplied = router.autoApply(routing, threshold);
            routing = autoApplied.routing();
            applied = autoApplied.applied();
        } else {
            log.info("[6/6] Auto-apply disabled");
        }

        log.info("Pipeline completed for '{}': {} issues, {} suggestions, {} applied, recommendation {}",
                documentName, routing.report().issueCount(), suggestions.size(), applied.size(),
                routing.report().overallRecommendation());
        return new ReviewRun(routing, applied);
    }

    private <T> List<T> awaitAll(List<CompletableFuture<T>> futures, long deadline, String stage) {
        CompletableFuture<Void> all = CompletableFuture.allOf(futures.toArray(new CompletableFuture[0]));
        try {
            all.get(Math.max(0, deadline - System.nanoTime()), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            futures.forEach(f -> f.cancel(true));
            throw new ReviewTimeoutException("Review run exceeded %s during %s"
                    .formatted(format(pipeline.timeout()), stage), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            futures.forEach(f -> f.cancel(true));
            throw new ReviewTimeoutException("Review run interrupted during " + stage, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException runtime) throw runtime;
            if (e.getCause() instanceof Error error) throw error;
            throw new IllegalStateException("Review " + stage + " failed", e.getCause());
        }
        return futures.stream().map(CompletableFuture::join).toList();
    }

    private static String format(Duration duration) {
        return duration.toMillis() + "ms";
    }
}
