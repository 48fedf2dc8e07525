package com.example.reconcile.field;

import com.example.reconcile.ReviewFixtures;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.NormalizedField;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IdentifierFieldHandlerTest {

    private final IdentifierFieldHandler handler = new IdentifierFieldHandler();

    private static NormalizedField identifier(String raw) {
        return ReviewFixtures.field(FieldType.IDENTIFIER, raw);
    }

    @Test
    void upperCasesReference() {
        NormalizedField field = identifier(" plz-rca-77821 ");

        assertThat(field.value().canonical()).isEqualTo("PLZ-RCA-77821");
        assertThat(handler.proposeFix(field)).contains(new FixProposal("PLZ-RCA-77821", 0.90));
    }

    @Test
    void canonicalReferenceNeedsNoFix() {
        assertThat(handler.proposeFix(identifier("TKT-2024/0042"))).isEmpty();
    }

    @Test
    void failures() {
        assertThat(identifier("PLZ RCA 77821").failure().reason()).isEqualTo("identifier contains whitespace");
        assertThat(identifier("AB").failure().reason()).isEqualTo("not a reference code");
        assertThat(identifier("-AB1").failure().reason()).isEqualTo("not a reference code");
    }
}
