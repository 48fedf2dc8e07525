package com.example.reconcile.service;

import com.example.reconcile.config.ReviewProperties;
import com.example.reconcile.field.FieldCatalog;
import com.example.reconcile.field.FieldHandlerRegistry;
import com.example.reconcile.field.FieldSpec;
import com.example.reconcile.field.FiscalCodeFieldHandler;
import com.example.reconcile.model.CalendarDate;
import com.example.reconcile.model.CaseRecord;
import com.example.reconcile.model.DateGranularity;
import com.example.reconcile.model.FieldCategory;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.FreeText;
import com.example.reconcile.model.Issue;
import com.example.reconcile.model.MonetaryAmount;
import com.example.reconcile.model.NormalizedField;
import com.example.reconcile.model.ScoredField;
import com.example.reconcile.model.Severity;
import com.example.reconcile.model.TypedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Assigns each normalized field a confidence in [0,1] and emits {@code low_confidence}
 * and {@code normalization_failure} issues.
 * <p>
 * Score = handler base score x corroboration factor, rounded to two decimals.
 * Deterministic and side-effect free.
 */
@Service
public class ConfidenceScorer {

    private static final Logger log = LoggerFactory.getLogger(ConfidenceScorer.class);

    /** Penalty applied when another field of the same record contradicts this one. */
    static final double CORROBORATION_FACTOR = 0.85;

    static final String REASON_MISSING = "required field missing";

    private static final List<String> REFUND_MARKERS = List.of("rimborso", "rimborsi", "refund", "storno");

    private final FieldHandlerRegistry handlers;
    private final FieldCatalog catalog;
    private final ReviewProperties.Scoring thresholds;

    public ConfidenceScorer(FieldHandlerRegistry handlers, FieldCatalog catalog, ReviewProperties properties) {
        this.handlers = handlers;
        this.catalog = catalog;
        this.thresholds = properties.scoring();
    }

    /**
     * Scores of one record plus the issues they raise.
     */
    public record RecordScore(List<ScoredField> scores, List<Issue> issues) {}

    public RecordScore score(CaseRecord record) {
        List<ScoredField> scores = new ArrayList<>(record.fields().size());
        List<Issue> issues = new ArrayList<>();

        for (NormalizedField field : record.fields()) {
            FieldSpec spec = catalog.specFor(record.recordType(), field.fieldName());
            if (!field.isSuccess()) {
                scores.add(new ScoredField(field, 0.0));
                Severity severity = failureSeverity(field, spec);
                issues.add(Issue.normalizationFailure(field.recordId(), field.fieldName(), severity,
                        field.failure().reason(), field.evidenceRef()));
                continue;
            }

            Optional<String> conflict = corroborationConflict(field, record);
            double confidence = round(handlers.handlerFor(field.type()).baseScore(field)
                    * (conflict.isPresent() ? CORROBORATION_FACTOR : 1.0));
            scores.add(new ScoredField(field, confidence));

            double threshold = thresholdFor(field.type().category());
            if (confidence < threshold) {
                String reason = field.strictViolation() != null
                        ? field.strictViolation()
                        : conflict.orElse("confidence below threshold " + threshold);
                issues.add(Issue.lowConfidence(field, lowConfidenceSeverity(field.type().category()),
                        confidence, reason));
            }
            log.debug("ConfidenceScorer: {}.{} -> {}", field.recordId(), field.fieldName(), confidence);
        }
        return new RecordScore(scores, issues);
    }

    /**
     * Required fields the record does not carry at all. Each one is a high severity
     * {@code normalization_failure}; an alias identifying the same entity satisfies the requirement.
     */
    public List<Issue> missingRequired(CaseRecord record) {
        List<Issue> issues = new ArrayList<>();
        for (FieldSpec required : catalog.specsFor(record.recordType())) {
            if (!required.required() || isPresent(required, record)) continue;
            issues.add(Issue.normalizationFailure(record.recordId(), required.fieldName(), Severity.HIGH,
                    REASON_MISSING, record.recordId() + "." + required.fieldName() + " @ "
                            + record.sourceLocation().describe()));
        }
        if (!issues.isEmpty()) {
            log.debug("ConfidenceScorer: {} misses {} required fields", record.recordId(), issues.size());
        }
        return issues;
    }

    private boolean isPresent(FieldSpec required, CaseRecord record) {
        for (NormalizedField field : record.fields()) {
            if (field.fieldName().equalsIgnoreCase(required.fieldName())) return true;
            FieldSpec spec = catalog.specFor(record.recordType(), field.fieldName());
            if (required.entityKey() != null && required.entityKey() == spec.entityKey()
                    && required.type() == spec.type()) {
                return true;
            }
        }
        return false;
    }

    double thresholdFor(FieldCategory category) {
        return switch (category) {
            case IDENTITY, CONTACT -> thresholds.identityThreshold();
            case VALUE -> thresholds.valueThreshold();
            case FREE_TEXT -> thresholds.freeTextThreshold();
        };
    }

    private static Severity lowConfidenceSeverity(FieldCategory category) {
        return switch (category) {
            case IDENTITY, CONTACT -> Severity.HIGH;
            case VALUE -> Severity.MEDIUM;
            case FREE_TEXT -> Severity.LOW;
        };
    }

    private static Severity failureSeverity(NormalizedField field, FieldSpec spec) {
        if (spec.required()) return Severity.HIGH;
        if (FieldNormalizer.RULE_BLANK.equals(field.ruleId())) return Severity.LOW;
        return field.type().category() == FieldCategory.FREE_TEXT ? Severity.LOW : Severity.HIGH;
    }

    /**
     * Cross-field checks inside one record. Returns the contradiction, if any.
     */
    private Optional<String> corroborationConflict(NormalizedField field, CaseRecord record) {
        if (field.type() == FieldType.AMOUNT) {
            Optional<TypedValue> kind = record.value("tipo");
            if (kind.isPresent() && kind.get() instanceof FreeText text) {
                boolean refund = isRefund(text.text());
                int signum = ((MonetaryAmount) field.value()).signum();
                if (refund && signum > 0) {
                    return Optional.of("positive amount on a refund transaction");
                }
                if (!refund && signum < 0) {
                    return Optional.of("negative amount on a transaction not marked as refund");
                }
            }
        }
        if (field.type() == FieldType.FISCAL_CODE) {
            Optional<TypedValue> birth = record.value("data_nascita");
            if (birth.isPresent() && birth.get() instanceof CalendarDate date
                    && date.granularity() == DateGranularity.DAY
                    && !FiscalCodeFieldHandler.birthDateMatches(field.value().canonical(), date.date())) {
                return Optional.of("birth date encoded in the fiscal code disagrees with data_nascita");
            }
        }
        return Optional.empty();
    }

    private static boolean isRefund(String type) {
        String lower = type.toLowerCase(Locale.ROOT);
        return REFUND_MARKERS.stream().anyMatch(lower::contains);
    }

    static double round(double score) {
        double clamped = Math.max(0.0, Math.min(1.0, score));
        return BigDecimal.valueOf(clamped).setScale(2, RoundingMode.HALF_UP).doubleValue();
    }
}
