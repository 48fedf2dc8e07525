package com.example.reconcile.controller;

import com.example.reconcile.model.CaseFile;
import com.example.reconcile.model.ReviewDecision;
import com.example.reconcile.model.ReviewReport;
import com.example.reconcile.model.ReviewSession;
import com.example.reconcile.service.ReviewSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * REST surface of the review engine.
 */
@RestController
@RequestMapping("/api")
public class ReviewController {

    private static final Logger log = LoggerFactory.getLogger(ReviewController.class);

    private final ReviewSessionService sessionService;

    public ReviewController(ReviewSessionService sessionService) {
        this.sessionService = sessionService;
    }

    /**
     * Runs a review and stores the session.
     *
     * <p>Endpoint: POST /api/reviews
     */
    @PostMapping("/reviews")
    public ResponseEntity<?> startReview(@RequestBody CaseFile caseFile,
                                         @RequestParam(required = false) Double autoApplyThreshold) {
        if (caseFile.records().isEmpty()) {
            return badRequest("Case file has no records.");
        }
        log.info("Received review request for '{}' ({} records)", caseFile.documentName(), caseFile.records().size());
        ReviewSession session = sessionService.start(caseFile, autoApplyThreshold);
        return ResponseEntity.status(HttpStatus.CREATED).body(session);
    }

    /**
     * Runs a review without storing it and returns only the report.
     *
     * <p>Endpoint: POST /api/reviews/preview
     */
    @PostMapping("/reviews/preview")
    public ResponseEntity<?> preview(@RequestBody CaseFile caseFile,
                                     @RequestParam(required = false) Double autoApplyThreshold) {
        if (caseFile.records().isEmpty()) {
            return badRequest("Case file has no records.");
        }
        ReviewReport report = sessionService.preview(caseFile, autoApplyThreshold).report();
        return ResponseEntity.ok(report);
    }

    @GetMapping("/reviews/{id}")
    public ReviewSession getReview(@PathVariable String id) {
        return sessionService.get(id);
    }

    /**
     * Applies human decisions to a stored review.
     *
     * <p>Endpoint: POST /api/reviews/{id}/decisions
     */
    @PostMapping("/reviews/{id}/decisions")
    public ResponseEntity<?> submitDecisions(@PathVariable String id, @RequestBody List<ReviewDecision> decisions) {
        if (decisions.isEmpty()) {
            return badRequest("No decisions supplied.");
        }
        return ResponseEntity.ok(sessionService.submitDecisions(id, decisions));
    }

    @PostMapping("/reviews/{id}/auto-apply")
    public ReviewSession autoApply(@PathVariable String id, @RequestParam double threshold) {
        return sessionService.autoApply(id, threshold);
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        return ResponseEntity.ok(Map.of(
                "status", "ok",
                "service", "field-reconcile"
        ));
    }

    private ResponseEntity<Map<String, String>> badRequest(String message) {
        return ResponseEntity.badRequest().body(Map.of("error", message));
    }
}
