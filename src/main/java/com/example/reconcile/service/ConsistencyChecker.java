package com.example.reconcile.service;

import com.example.reconcile.field.FieldCatalog;
import com.example.reconcile.field.FieldSpec;
import com.example.reconcile.model.CalendarDate;
import com.example.reconcile.model.CaseRecord;
import com.example.reconcile.model.ConflictVariant;
import com.example.reconcile.model.EntityKey;
import com.example.reconcile.model.Issue;
import com.example.reconcile.model.MonetaryAmount;
import com.example.reconcile.model.NormalizedField;
import com.example.reconcile.model.RecordType;
import com.example.reconcile.model.Severity;
import com.example.reconcile.model.TypedValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.stream.Collectors;

/**
 * Compares records describing the same entity and flags point-value fields on which they disagree.
 * <p>
 * Records are grouped by the identifier fields declared in the {@link FieldCatalog}
 * (policy number, fiscal code, ticket id); records with different identifiers are never compared.
 * Within a group, records of one type are split by event (transactions with the same id, or
 * without an id but with the same amount, describe the same payment) and each point-value field
 * must have a single value per event.
 * <p>
 * The checker never picks a winner: all variants are listed, most frequent first, then by
 * lowest source page, then by value.
 */
@Service
public class ConsistencyChecker {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyChecker.class);

    static final Comparator<ConflictVariant> VARIANT_ORDER = Comparator
            .comparingInt(ConflictVariant::occurrences).reversed()
            .thenComparingInt(ConflictVariant::firstPage)
            .thenComparing(ConflictVariant::value);

    private final FieldCatalog catalog;

    public ConsistencyChecker(FieldCatalog catalog) {
        this.catalog = catalog;
    }

    /**
     * Groups records by entity key. A record holding several identifiers joins several groups;
     * a record without identifiers joins none.
     */
    public Map<EntityKey, List<CaseRecord>> group(List<CaseRecord> records) {
        Map<EntityKey, List<CaseRecord>> groups = new TreeMap<>();
        for (CaseRecord record : records) {
            for (NormalizedField field : record.fields()) {
                FieldSpec spec = catalog.specFor(record.recordType(), field.fieldName());
                if (spec.entityKey() == null || !field.isSuccess()) continue;
                EntityKey key = new EntityKey(spec.entityKey(), field.value().canonical());
                List<CaseRecord> members = groups.computeIfAbsent(key, k -> new ArrayList<>());
                if (!members.contains(record)) members.add(record);
            }
        }
        return groups;
    }

    /** Checks every entity group in key order. */
    public List<Issue> checkAll(List<CaseRecord> records) {
        List<Issue> issues = new ArrayList<>();
        group(records).forEach((key, members) -> issues.addAll(check(key, members)));
        return issues;
    }

    /**
     * Checks one entity group. Requires every member to be fully normalized.
     */
    public List<Issue> check(EntityKey key, List<CaseRecord> members) {
        if (members.size() < 2) return List.of();

        Set<RecordType> types = new LinkedHashSet<>();
        members.forEach(r -> types.add(r.recordType()));

        List<Issue> issues = new ArrayList<>();
        for (RecordType type : types) {
            List<CaseRecord> sameType = members.stream().filter(r -> r.recordType() == type).toList();
            if (sameType.size() < 2) continue;

            for (FieldSpec spec : catalog.pointValueFields(type, key.kind())) {
                Map<String, List<NormalizedField>> events = new LinkedHashMap<>();
                for (CaseRecord record : sameType) {
                    Optional<String> event = eventSignature(record, spec.eventFields());
                    Optional<NormalizedField> field = record.field(spec.fieldName()).filter(NormalizedField::isSuccess);
                    if (event.isEmpty() || field.isEmpty()) continue;
                    events.computeIfAbsent(event.get(), e -> new ArrayList<>()).add(field.get());
                }
                events.values().stream()
                        .filter(fields -> fields.size() >= 2)
                        .map(fields -> compare(key, spec, fields))
                        .flatMap(Optional::stream)
                        .forEach(issues::add);
            }
        }
        if (!issues.isEmpty()) {
            log.info("ConsistencyChecker: {} -> {} inconsistencies across {} records", key, issues.size(), members.size());
        }
        return issues;
    }

    private Optional<Issue> compare(EntityKey key, FieldSpec spec, List<NormalizedField> fields) {
        Map<String, List<NormalizedField>> byValue = new LinkedHashMap<>();
        for (NormalizedField field : fields) {
            byValue.computeIfAbsent(field.value().canonical(), v -> new ArrayList<>()).add(field);
        }
        if (byValue.size() < 2) return Optional.empty();

        List<ConflictVariant> variants = byValue.entrySet().stream()
                .map(e -> new ConflictVariant(
                        e.getKey(),
                        e.getValue().size(),
                        e.getValue().stream().map(NormalizedField::recordId).toList(),
                        e.getValue().stream().map(NormalizedField::evidenceRef).toList(),
                        e.getValue().stream().mapToInt(f -> f.sourceLocation().page()).min().orElse(0)))
                .sorted(VARIANT_ORDER)
                .toList();

        String reason = "%d records for %s report %d different values for '%s'%s".formatted(
                fields.size(), key, variants.size(), spec.fieldName(), describeConflict(fields));
        Severity severity = spec.critical() ? Severity.HIGH : Severity.MEDIUM;
        return Optional.of(Issue.inconsistency(key, spec.fieldName(), severity, reason, variants));
    }

    /** Names the kind of disagreement when it is recognizable. */
    private static String describeConflict(List<NormalizedField> fields) {
        List<TypedValue> values = fields.stream().map(NormalizedField::value).toList();
        if (values.stream().allMatch(v -> v instanceof CalendarDate)) {
            List<CalendarDate> dates = values.stream().map(v -> (CalendarDate) v).toList();
            for (CalendarDate a : dates) {
                for (CalendarDate b : dates) {
                    if (a.granularity() != b.granularity() && a.covers(b)) {
                        return ": granularity conflict (%s vs %s)".formatted(a.canonical(), b.canonical());
                    }
                }
            }
        }
        if (values.stream().allMatch(v -> v instanceof MonetaryAmount)) {
            Set<String> magnitudes = values.stream().map(TypedValue::groupingKey).collect(Collectors.toSet());
            if (magnitudes.size() == 1) return ": sign mismatch";
        }
        return "";
    }

    /**
     * Event a record describes, keyed on the first event field it carries. Records matched on
     * different fields never share an event; without event fields all records share one.
     */
    static Optional<String> eventSignature(CaseRecord record, List<String> eventFields) {
        if (eventFields.isEmpty()) return Optional.of("");
        for (String eventField : eventFields) {
            Optional<TypedValue> value = record.value(eventField);
            if (value.isPresent()) return Optional.of(eventField + "=" + value.get().groupingKey());
        }
        return Optional.empty();
    }
}
