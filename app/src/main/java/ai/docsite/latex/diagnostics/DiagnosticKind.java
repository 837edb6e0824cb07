package ai.docsite.latex.diagnostics;

/**
 * Non-fatal problems recorded while converting a document.
 */
public enum DiagnosticKind {
    MISSING_IMAGE,
    UNMAPPED_CALLOUT,
    TABLE_SHAPE,
    MALFORMED_TABLE_SPAN,
    DUPLICATE_FOOTNOTE,
    DUPLICATE_LABEL
}
