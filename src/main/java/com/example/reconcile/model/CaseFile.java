package com.example.reconcile.model;

import java.util.List;

/**
 * Input of a review run: the ordered records extracted from one case file.
 */
public record CaseFile(
        String documentName,
        List<RecordInput> records
) {
    public CaseFile {
        records = records != null ? List.copyOf(records) : List.of();
        if (documentName == null || documentName.isBlank()) documentName = "case-file";
    }
}
