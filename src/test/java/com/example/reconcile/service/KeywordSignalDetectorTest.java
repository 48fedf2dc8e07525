package com.example.reconcile.service;

import com.example.reconcile.model.KeywordSignal;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.example.reconcile.ReviewFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;

class KeywordSignalDetectorTest {

    private final KeywordSignalDetector detector = new KeywordSignalDetector();

    @Test
    void reportsFlaggedFreeText() {
        List<KeywordSignal> signals = detector.detect(List.of(
                record("K1", "ticket", 4, "ticket_id", "TKT-1", "descrizione", "Reclamo per frode sul rimborso"),
                record("K2", "ticket", 5, "ticket_id", "TKT-2", "descrizione", "Richiesta informazioni")));

        assertThat(signals).singleElement().satisfies(signal -> {
            assertThat(signal.recordRef()).isEqualTo("K1");
            assertThat(signal.fieldName()).isEqualTo("descrizione");
            assertThat(signal.keywords()).containsExactly("reclamo", "frode");
            assertThat(signal.evidenceRef()).isEqualTo("K1.descrizione @ page 4");
        });
    }
}
