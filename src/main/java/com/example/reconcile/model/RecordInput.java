package com.example.reconcile.model;

import java.util.Map;

/**
 * One record as delivered by the extraction collaborator.
 * The record type is kept as a label so malformed input can be isolated instead of rejected.
 *
 * @param recordId       record identifier (may be missing on malformed input)
 * @param recordType     record type label (customer, transaction, policy, ticket)
 * @param sourceLocation page/section the record was read from
 * @param fields         field name to raw value, in extraction order
 */
public record RecordInput(
        String recordId,
        String recordType,
        SourceLocation sourceLocation,
        Map<String, String> fields
) {}
