package com.example.reconcile.service;

import com.example.reconcile.ReviewFixtures;
import com.example.reconcile.model.CaseRecord;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.Issue;
import com.example.reconcile.model.IssueType;
import com.example.reconcile.model.NormalizedField;
import com.example.reconcile.model.RecordInput;
import com.example.reconcile.model.RecordType;
import com.example.reconcile.model.Severity;
import com.example.reconcile.model.SourceLocation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.example.reconcile.ReviewFixtures.input;
import static org.assertj.core.api.Assertions.assertThat;

class FieldNormalizerTest {

    private final FieldNormalizer normalizer = ReviewFixtures.normalizer();

    @Nested
    @DisplayName("well-formed records")
    class WellFormed {

        @Test
        @DisplayName("normalizes each field against its declared type")
        void typedFields() {
            FieldNormalizer.Result result = normalizer.normalize(input("C1", "cliente", 2,
                    "nome", "Mario",
                    "telefono", "+39 333 1234567",
                    "data_nascita", "10/12/1985",
                    "note", "cliente storico"), 0);

            assertThat(result.isMalformed()).isFalse();
            CaseRecord record = result.record();
            assertThat(record.recordType()).isEqualTo(RecordType.CUSTOMER);
            assertThat(record.fields()).extracting(NormalizedField::type)
                    .containsExactly(FieldType.FREE_TEXT, FieldType.PHONE, FieldType.DATE, FieldType.FREE_TEXT);
            assertThat(record.value("telefono").orElseThrow().canonical()).isEqualTo("+393331234567");
            assertThat(record.field("telefono").orElseThrow().evidenceRef()).isEqualTo("C1.telefono @ page 2");
        }

        @Test
        @DisplayName("a blank value is a failure, never an exception")
        void blankValue() {
            CaseRecord record = normalizer.normalize(input("C1", "customer", 1, "email", "   "), 0).record();

            NormalizedField email = record.field("email").orElseThrow();
            assertThat(email.isSuccess()).isFalse();
            assertThat(email.failure().reason()).isEqualTo("empty value");
            assertThat(email.ruleId()).isEqualTo(FieldNormalizer.RULE_BLANK);
            assertThat(record.value("email")).isEmpty();
        }
    }

    @Nested
    @DisplayName("malformed records")
    class Malformed {

        @Test
        @DisplayName("unknown record type becomes a standalone high severity issue")
        void unknownType() {
            FieldNormalizer.Result result = normalizer.normalize(input("X1", "fattura", 7, "numero", "1"), 3);

            assertThat(result.isMalformed()).isTrue();
            Issue issue = result.structuralIssue();
            assertThat(issue.type()).isEqualTo(IssueType.NORMALIZATION_FAILURE);
            assertThat(issue.severity()).isEqualTo(Severity.HIGH);
            assertThat(issue.fieldName()).isEqualTo("record_type");
            assertThat(issue.recordRef()).isEqualTo("X1");
            assertThat(issue.reason()).isEqualTo("unknown record_type 'fattura'");
            assertThat(issue.evidenceRef()).isEqualTo("X1 @ page 7");
        }

        @Test
        @DisplayName("a missing id is referenced by position")
        void missingId() {
            Issue issue = normalizer.normalize(input(null, "customer", 1, "nome", "Mario"), 4).structuralIssue();

            assertThat(issue.recordRef()).isEqualTo("record#5");
            assertThat(issue.fieldName()).isEqualTo("record_id");
        }

        @Test
        void missingFields() {
            Issue issue = normalizer.normalize(new RecordInput("T1", "transaction", SourceLocation.UNKNOWN, null), 0)
                    .structuralIssue();

            assertThat(issue.fieldName()).isEqualTo("fields");
            assertThat(issue.evidenceRef()).isEqualTo("T1 @ page ?");
        }

        @Test
        void missingType() {
            Issue issue = normalizer.normalize(new RecordInput("T1", " ", null, Map.of()), 0).structuralIssue();

            assertThat(issue.fieldName()).isEqualTo("record_type");
            assertThat(issue.reason()).isEqualTo("record has no record_type");
        }
    }
}
