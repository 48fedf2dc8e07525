package com.example.reconcile.model;

/**
 * Where a value was found in the source document.
 *
 * @param page    1-based page number, 0 when unknown
 * @param section section label assigned by the extraction step (may be null)
 */
public record SourceLocation(int page, String section) {

    public static final SourceLocation UNKNOWN = new SourceLocation(0, null);

    public String describe() {
        String where = page > 0 ? "page " + page : "page ?";
        return section == null || section.isBlank() ? where : where + " / " + section;
    }
}
