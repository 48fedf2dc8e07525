package com.example.reconcile.service;

import com.example.reconcile.field.FieldHandler;
import com.example.reconcile.field.FieldHandlerRegistry;
import com.example.reconcile.field.FixProposal;
import com.example.reconcile.field.NormalizationOutcome;
import com.example.reconcile.model.AutoFixSuggestion;
import com.example.reconcile.model.NormalizedField;
import com.example.reconcile.model.ScoredField;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Proposes formatting-only corrections. A suggestion is kept only when re-normalizing it
 * yields the same canonical value as the original field.
 */
@Service
public class AutoFixProposer {

    private static final Logger log = LoggerFactory.getLogger(AutoFixProposer.class);

    private final FieldHandlerRegistry handlers;

    public AutoFixProposer(FieldHandlerRegistry handlers) {
        this.handlers = handlers;
    }

    public List<AutoFixSuggestion> propose(List<ScoredField> scored) {
        List<AutoFixSuggestion> suggestions = new ArrayList<>();
        for (ScoredField entry : scored) {
            proposeFor(entry.field()).ifPresent(suggestions::add);
        }
        log.debug("AutoFixProposer: {} suggestions for {} fields", suggestions.size(), scored.size());
        return suggestions;
    }

    Optional<AutoFixSuggestion> proposeFor(NormalizedField field) {
        if (!field.isSuccess()) return Optional.empty();

        FieldHandler handler = handlers.handlerFor(field.type());
        Optional<FixProposal> proposal = handler.proposeFix(field);
        if (proposal.isEmpty() || proposal.get().suggestedValue().equals(field.rawValue())) {
            return Optional.empty();
        }

        NormalizationOutcome check = handler.normalize(proposal.get().suggestedValue());
        if (check.value() == null || !check.value().canonical().equals(field.value().canonical())) {
            log.warn("AutoFixProposer: dropped fix for {}.{}: '{}' does not round-trip",
                    field.recordId(), field.fieldName(), proposal.get().suggestedValue());
            return Optional.empty();
        }
        return Optional.of(new AutoFixSuggestion(field.fieldName(), field.recordId(), field.rawValue(),
                proposal.get().suggestedValue(), proposal.get().confidence(), null));
    }
}
