package com.example.reconcile.service;

import com.example.reconcile.ReviewFixtures;
import com.example.reconcile.field.AmountFieldHandler;
import com.example.reconcile.field.DateFieldHandler;
import com.example.reconcile.field.EmailFieldHandler;
import com.example.reconcile.field.FieldHandler;
import com.example.reconcile.field.FieldHandlerRegistry;
import com.example.reconcile.field.FiscalCodeFieldHandler;
import com.example.reconcile.field.FixProposal;
import com.example.reconcile.field.FreeTextFieldHandler;
import com.example.reconcile.field.IbanFieldHandler;
import com.example.reconcile.field.IdentifierFieldHandler;
import com.example.reconcile.field.NormalizationOutcome;
import com.example.reconcile.model.AutoFixSuggestion;
import com.example.reconcile.model.CaseRecord;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.NormalizedField;
import com.example.reconcile.model.PhoneNumber;
import com.example.reconcile.model.ScoredField;
import com.example.reconcile.model.SourceLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static com.example.reconcile.ReviewFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class AutoFixProposerTest {

    private final ConfidenceScorer scorer = new ConfidenceScorer(
            ReviewFixtures.registry(), ReviewFixtures.catalog(), ReviewFixtures.PROPERTIES);
    private final AutoFixProposer proposer = new AutoFixProposer(ReviewFixtures.registry());

    @Test
    @DisplayName("a spaced phone number gets a confident fix and no issue")
    void phoneFormatting() {
        ConfidenceScorer.RecordScore score = scorer.score(record("C1", "customer", 1, "telefono", "+39 333 1234567"));

        List<AutoFixSuggestion> suggestions = proposer.propose(score.scores());

        assertThat(score.issues()).isEmpty();
        assertThat(suggestions).singleElement().satisfies(fix -> {
            assertThat(fix.recordRef()).isEqualTo("C1");
            assertThat(fix.fieldName()).isEqualTo("telefono");
            assertThat(fix.originalValue()).isEqualTo("+39 333 1234567");
            assertThat(fix.suggestedValue()).isEqualTo("+393331234567");
            assertThat(fix.confidence()).isGreaterThanOrEqualTo(0.8);
            assertThat(fix.issueRef()).isNull();
        });
    }

    @Test
    @DisplayName("failed, canonical and non-fixable fields get no suggestion")
    void nothingToFix() {
        CaseRecord record = record("C1", "customer", 1,
                "telefono", "+393331234567",
                "iban", "IT00",
                "data_nascita", "10/12/85",
                "email", "mario.rossi@gmail");

        assertThat(proposer.propose(scorer.score(record).scores())).isEmpty();
    }

    @Test
    @DisplayName("text with unreadable characters gets no suggestion")
    void encodingNoise() {
        NormalizedField damaged = ReviewFixtures.field(FieldType.FREE_TEXT, "Ros\uFFFDi");

        assertThat(damaged.isSuccess()).isTrue();
        assertThat(proposer.proposeFor(damaged)).isEmpty();
        assertThat(proposer.proposeFor(ReviewFixtures.field(FieldType.FREE_TEXT, " Mario  Rossi ")))
                .hasValueSatisfying(fix -> assertThat(fix.suggestedValue()).isEqualTo("Mario Rossi"));
    }

    @Test
    @DisplayName("suggestions follow record and field order")
    void order() {
        CaseRecord first = record("C1", "customer", 1, "nome", " Mario ", "codice_fiscale", "rssmra85t10a562s");
        CaseRecord second = record("C2", "customer", 2, "cellulare", "0039 333 7654321");

        List<ScoredField> scored = new ArrayList<>(scorer.score(first).scores());
        scored.addAll(scorer.score(second).scores());

        assertThat(proposer.propose(scored))
                .extracting(AutoFixSuggestion::recordRef, AutoFixSuggestion::fieldName)
                .containsExactly(
                        tuple("C1", "nome"),
                        tuple("C1", "codice_fiscale"),
                        tuple("C2", "cellulare"));
    }

    @Test
    @DisplayName("a suggestion that would change the value is dropped")
    void roundTripGuard() {
        FieldHandler phone = mock(FieldHandler.class);
        when(phone.type()).thenReturn(FieldType.PHONE);
        when(phone.proposeFix(any())).thenReturn(Optional.of(new FixProposal("+390000000000", 0.95)));
        when(phone.normalize("+390000000000"))
                .thenReturn(NormalizationOutcome.strict(new PhoneNumber("39", "0000000000"), "phone.e164"));
        FieldHandlerRegistry registry = new FieldHandlerRegistry(List.of(phone,
                new EmailFieldHandler(), new DateFieldHandler(), new AmountFieldHandler(ReviewFixtures.PROPERTIES),
                new FiscalCodeFieldHandler(), new IbanFieldHandler(), new IdentifierFieldHandler(),
                new FreeTextFieldHandler(ReviewFixtures.PROPERTIES)));
        NormalizedField field = new NormalizedField("C1", "telefono", FieldType.PHONE, "333 1234567",
                SourceLocation.UNKNOWN, new PhoneNumber("39", "3331234567"), null, "phone.e164", null);

        assertThat(new AutoFixProposer(registry).propose(List.of(new ScoredField(field, 0.96)))).isEmpty();
    }
}
