package com.example.reconcile.model;

import java.util.List;

/**
 * One of the distinct values reported for a field that should agree across records.
 *
 * @param value        canonical value
 * @param occurrences  number of records reporting it
 * @param recordRefs   records reporting it, in input order
 * @param evidenceRefs where each occurrence was read
 * @param firstPage    lowest source page among the occurrences
 */
public record ConflictVariant(
        String value,
        int occurrences,
        List<String> recordRefs,
        List<String> evidenceRefs,
        int firstPage
) {
    public ConflictVariant {
        recordRefs = List.copyOf(recordRefs);
        evidenceRefs = List.copyOf(evidenceRefs);
    }
}
