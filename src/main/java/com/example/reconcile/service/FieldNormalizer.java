package com.example.reconcile.service;

import com.example.reconcile.exception.MalformedRecordException;
import com.example.reconcile.field.FieldCatalog;
import com.example.reconcile.field.FieldHandlerRegistry;
import com.example.reconcile.field.FieldSpec;
import com.example.reconcile.field.NormalizationOutcome;
import com.example.reconcile.model.CaseRecord;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.Issue;
import com.example.reconcile.model.NormalizationFailure;
import com.example.reconcile.model.NormalizedField;
import com.example.reconcile.model.RawField;
import com.example.reconcile.model.RecordInput;
import com.example.reconcile.model.RecordType;
import com.example.reconcile.model.Severity;
import com.example.reconcile.model.SourceLocation;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Turns raw extracted values into typed values, one {@link NormalizedField} per raw field.
 * Failures are returned as data. Pure and thread-safe: records may be normalized in parallel.
 */
@Service
public class FieldNormalizer {

    private static final Logger log = LoggerFactory.getLogger(FieldNormalizer.class);

    static final String RULE_BLANK = "blank";

    private final FieldHandlerRegistry handlers;
    private final FieldCatalog catalog;

    public FieldNormalizer(FieldHandlerRegistry handlers, FieldCatalog catalog) {
        this.handlers = handlers;
        this.catalog = catalog;
    }

    /**
     * Normalized record, or the standalone issue that replaces a malformed one.
     */
    public record Result(CaseRecord record, Issue structuralIssue) {
        public boolean isMalformed() {
            return record == null;
        }
    }

    /**
     * Normalizes one input record. A malformed record is isolated: it yields a
     * {@code normalization_failure} issue and no {@link CaseRecord}.
     *
     * @param input    record as extracted
     * @param position 0-based position in the case file, used when the record has no id
     */
    public Result normalize(RecordInput input, int position) {
        try {
            return new Result(normalizeRecord(input, position), null);
        } catch (MalformedRecordException e) {
            log.warn("FieldNormalizer: record {} excluded: {}", e.getRecordRef(), e.getMessage());
            SourceLocation location = input.sourceLocation() != null ? input.sourceLocation() : SourceLocation.UNKNOWN;
            Issue issue = Issue.normalizationFailure(e.getRecordRef(), e.getFieldName(), Severity.HIGH,
                    e.getMessage(), e.getRecordRef() + " @ " + location.describe());
            return new Result(null, issue);
        }
    }

    CaseRecord normalizeRecord(RecordInput input, int position) {
        String recordRef = input.recordId() != null && !input.recordId().isBlank()
                ? input.recordId().strip()
                : "record#" + (position + 1);
        if (input.recordId() == null || input.recordId().isBlank()) {
            throw new MalformedRecordException(recordRef, "record_id", "record has no record_id");
        }
        if (input.recordType() == null || input.recordType().isBlank()) {
            throw new MalformedRecordException(recordRef, "record_type", "record has no record_type");
        }
        RecordType type = RecordType.fromLabel(input.recordType())
                .orElseThrow(() -> new MalformedRecordException(recordRef, "record_type",
                        "unknown record_type '" + input.recordType() + "'"));
        if (input.fields() == null) {
            throw new MalformedRecordException(recordRef, "fields", "record has no fields");
        }

        List<NormalizedField> fields = new ArrayList<>(input.fields().size());
        for (Map.Entry<String, String> entry : input.fields().entrySet()) {
            RawField raw = new RawField(recordRef, entry.getKey(), entry.getValue(), input.sourceLocation());
            FieldSpec spec = catalog.specFor(type, entry.getKey());
            fields.add(normalizeField(raw, spec.type()));
        }
        log.debug("FieldNormalizer: {} ({}) normalized, {} fields", recordRef, type.wireName(), fields.size());
        return new CaseRecord(recordRef, type, input.sourceLocation(), fields);
    }

    /**
     * Normalizes one raw field against its declared type.
     */
    public NormalizedField normalizeField(RawField raw, FieldType expected) {
        if (raw.rawValue() == null || raw.rawValue().isBlank()) {
            return new NormalizedField(raw.recordId(), raw.fieldName(), expected, raw.rawValue(),
                    raw.sourceLocation(), null,
                    new NormalizationFailure("empty value", RULE_BLANK),
                    RULE_BLANK, null);
        }
        NormalizationOutcome outcome = handlers.handlerFor(expected).normalize(raw.rawValue());
        return new NormalizedField(raw.recordId(), raw.fieldName(), expected, raw.rawValue(),
                raw.sourceLocation(), outcome.value(), outcome.failure(), outcome.ruleId(),
                outcome.strictViolation());
    }
}
