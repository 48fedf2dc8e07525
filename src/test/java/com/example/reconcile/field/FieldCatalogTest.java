package com.example.reconcile.field;

import com.example.reconcile.config.ReviewProperties;
import com.example.reconcile.model.EntityKind;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.RecordType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class FieldCatalogTest {

    private final FieldCatalog catalog = new FieldCatalog(ReviewProperties.defaults());

    @Test
    @DisplayName("declares identifiers and required fields")
    void builtInSpecs() {
        FieldSpec fiscalCode = catalog.specFor(RecordType.CUSTOMER, "codice_fiscale");

        assertThat(fiscalCode.type()).isEqualTo(FieldType.FISCAL_CODE);
        assertThat(fiscalCode.required()).isTrue();
        assertThat(fiscalCode.entityKey()).isEqualTo(EntityKind.PERSON);
        assertThat(catalog.specFor(RecordType.POLICY, "polizza_numero").entityKey()).isEqualTo(EntityKind.POLICY);
    }

    @Test
    @DisplayName("builder copies set the required and critical flags")
    void specBuilders() {
        FieldSpec plain = FieldSpec.of(RecordType.POLICY, "premio", FieldType.AMOUNT);
        FieldSpec flagged = plain.asRequired().asCritical();

        assertThat(plain.required()).isFalse();
        assertThat(plain.critical()).isFalse();
        assertThat(flagged.required()).isTrue();
        assertThat(flagged.critical()).isTrue();
        assertThat(flagged.fieldName()).isEqualTo("premio");
    }

    @Test
    @DisplayName("unknown fields are free text and lookups ignore case")
    void unknownFields() {
        assertThat(catalog.specFor(RecordType.TICKET, "note_interne").type()).isEqualTo(FieldType.FREE_TEXT);
        assertThat(catalog.specFor(RecordType.CUSTOMER, "EMAIL").type()).isEqualTo(FieldType.EMAIL);
    }

    @Test
    @DisplayName("transaction point values are compared per event")
    void transactionPointValues() {
        List<FieldSpec> pointValues = catalog.pointValueFields(RecordType.TRANSACTION, EntityKind.POLICY);

        assertThat(pointValues).extracting(FieldSpec::fieldName).containsExactly("data", "importo");
        assertThat(pointValues.get(0).eventFields()).containsExactly("transazione_id", "importo");
        assertThat(pointValues).allMatch(FieldSpec::critical);
        assertThat(catalog.pointValueFields(RecordType.TRANSACTION, EntityKind.PERSON)).isEmpty();
    }

    @Test
    @DisplayName("configured overrides replace the declared type")
    void overrides() {
        FieldCatalog custom = new FieldCatalog(new ReviewProperties(null, null, null,
                Map.of("customer.pec", "email", "cliente.fax", "PHONE", "nonsense", "email")));

        assertThat(custom.specFor(RecordType.CUSTOMER, "pec").type()).isEqualTo(FieldType.EMAIL);
        assertThat(custom.specFor(RecordType.CUSTOMER, "fax").type()).isEqualTo(FieldType.PHONE);
    }

    @Test
    void unknownOverrideTypeIsRejected() {
        assertThatThrownBy(() -> new FieldCatalog(new ReviewProperties(null, null, null,
                Map.of("customer.pec", "carrier-pigeon"))))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("carrier-pigeon");
    }
}
