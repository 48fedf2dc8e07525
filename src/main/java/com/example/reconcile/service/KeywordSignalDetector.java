package com.example.reconcile.service;

import com.example.reconcile.model.CaseRecord;
import com.example.reconcile.model.FreeText;
import com.example.reconcile.model.KeywordSignal;
import com.example.reconcile.model.NormalizedField;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects flagged keywords (complaint, legal, urgency) found in free-text fields.
 * Signals are informational and never change severity or recommendation.
 */
@Service
public class KeywordSignalDetector {

    public List<KeywordSignal> detect(List<CaseRecord> records) {
        List<KeywordSignal> signals = new ArrayList<>();
        for (CaseRecord record : records) {
            for (NormalizedField field : record.fields()) {
                if (field.value() instanceof FreeText text && !text.flaggedKeywords().isEmpty()) {
                    signals.add(new KeywordSignal(field.recordId(), field.fieldName(),
                            text.flaggedKeywords(), field.evidenceRef()));
                }
            }
        }
        return signals;
    }
}
