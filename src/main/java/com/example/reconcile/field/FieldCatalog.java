package com.example.reconcile.field;

import com.example.reconcile.config.ReviewProperties;
import com.example.reconcile.model.EntityKind;
import com.example.reconcile.model.FieldType;
import com.example.reconcile.model.RecordType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static com.example.reconcile.model.FieldType.*;

/**
 * Declared field types per record type, following the case-file database schema
 * (Italian field names as produced by the extraction step, plus English aliases).
 * Unknown fields are free text. {@code review.field-types} overrides the declared type.
 */
@Component
public class FieldCatalog {

    private static final Logger log = LoggerFactory.getLogger(FieldCatalog.class);

    private final Map<RecordType, Map<String, FieldSpec>> specs = new EnumMap<>(RecordType.class);

    public FieldCatalog(ReviewProperties properties) {
        for (RecordType type : RecordType.values()) {
            specs.put(type, new LinkedHashMap<>());
        }
        registerDefaults();
        applyOverrides(properties.fieldTypes());
    }

    public FieldSpec specFor(RecordType recordType, String fieldName) {
        FieldSpec spec = specs.get(recordType).get(fieldName.toLowerCase(Locale.ROOT));
        return spec != null ? spec : FieldSpec.of(recordType, fieldName, FREE_TEXT);
    }

    public List<FieldSpec> specsFor(RecordType recordType) {
        return List.copyOf(specs.get(recordType).values());
    }

    /** Point-value fields of a record type that must agree across records of the given entity. */
    public List<FieldSpec> pointValueFields(RecordType recordType, EntityKind entity) {
        List<FieldSpec> result = new ArrayList<>();
        for (FieldSpec spec : specs.get(recordType).values()) {
            if (spec.determinedBy() == entity) result.add(spec);
        }
        return result;
    }

    private void registerDefaults() {
        RecordType c = RecordType.CUSTOMER;
        add(FieldSpec.of(c, "nome", FREE_TEXT).asRequired());
        add(FieldSpec.of(c, "cognome", FREE_TEXT).asRequired());
        add(FieldSpec.of(c, "ragione_sociale", FREE_TEXT));
        add(FieldSpec.of(c, "codice_fiscale", FISCAL_CODE).asRequired().identifies(EntityKind.PERSON));
        add(FieldSpec.of(c, "fiscal_code", FISCAL_CODE).identifies(EntityKind.PERSON));
        add(FieldSpec.of(c, "partita_iva", IDENTIFIER));
        add(FieldSpec.of(c, "email", EMAIL).determinedBy(EntityKind.PERSON));
        add(FieldSpec.of(c, "telefono", PHONE));
        add(FieldSpec.of(c, "cellulare", PHONE));
        add(FieldSpec.of(c, "phone", PHONE));
        add(FieldSpec.of(c, "data_nascita", DATE).determinedBy(EntityKind.PERSON).asCritical());
        add(FieldSpec.of(c, "iban", IBAN));
        for (String free : List.of("indirizzo", "citta", "cap", "provincia", "nazione", "luogo_nascita")) {
            add(FieldSpec.of(c, free, FREE_TEXT));
        }

        RecordType p = RecordType.POLICY;
        add(FieldSpec.of(p, "polizza_numero", IDENTIFIER).asRequired().identifies(EntityKind.POLICY));
        add(FieldSpec.of(p, "policy_number", IDENTIFIER).identifies(EntityKind.POLICY));
        add(FieldSpec.of(p, "tipo", FREE_TEXT).asRequired());
        add(FieldSpec.of(p, "data_decorrenza", DATE).determinedBy(EntityKind.POLICY).asCritical());
        add(FieldSpec.of(p, "data_scadenza", DATE).determinedBy(EntityKind.POLICY).asCritical());
        for (String amount : List.of("premio", "premio_annuale", "franchigia", "massimale")) {
            add(FieldSpec.of(p, amount, AMOUNT).determinedBy(EntityKind.POLICY).asCritical());
        }
        for (String free : List.of("stato", "compagnia", "agente", "rata_pagamento")) {
            add(FieldSpec.of(p, free, FREE_TEXT));
        }

        RecordType t = RecordType.TRANSACTION;
        add(FieldSpec.of(t, "transazione_id", IDENTIFIER));
        add(FieldSpec.of(t, "data", DATE).asRequired()
                .determinedBy(EntityKind.POLICY, "transazione_id", "importo").asCritical());
        add(FieldSpec.of(t, "importo", AMOUNT).asRequired()
                .determinedBy(EntityKind.POLICY, "transazione_id").asCritical());
        add(FieldSpec.of(t, "riferimento_polizza", IDENTIFIER).identifies(EntityKind.POLICY));
        add(FieldSpec.of(t, "policy_number", IDENTIFIER).identifies(EntityKind.POLICY));
        add(FieldSpec.of(t, "tipo", FREE_TEXT).asRequired());
        for (String free : List.of("descrizione", "metodo_pagamento", "stato")) {
            add(FieldSpec.of(t, free, FREE_TEXT));
        }

        RecordType k = RecordType.TICKET;
        add(FieldSpec.of(k, "ticket_id", IDENTIFIER).asRequired().identifies(EntityKind.TICKET));
        add(FieldSpec.of(k, "stato", FREE_TEXT).asRequired());
        add(FieldSpec.of(k, "data_apertura", DATE).determinedBy(EntityKind.TICKET));
        add(FieldSpec.of(k, "data_chiusura", DATE));
        for (String free : List.of("priorita", "categoria", "descrizione", "risoluzione", "assegnato_a")) {
            add(FieldSpec.of(k, free, FREE_TEXT));
        }
    }

    private void applyOverrides(Map<String, String> overrides) {
        overrides.forEach((key, typeName) -> {
            int dot = key.indexOf('.');
            RecordType recordType = dot > 0 ? RecordType.fromLabel(key.substring(0, dot)).orElse(null) : null;
            if (recordType == null) {
                log.warn("FieldCatalog: ignoring override '{}' (expected <record_type>.<field>)", key);
                return;
            }
            String field = key.substring(dot + 1);
            FieldType type = FieldType.fromWireName(typeName);
            add(specFor(recordType, field).withType(type));
            log.info("FieldCatalog: {}.{} declared as {}", recordType.wireName(), field, type.wireName());
        });
    }

    private void add(FieldSpec spec) {
        specs.get(spec.recordType()).put(spec.fieldName().toLowerCase(Locale.ROOT), spec);
    }
}
