package ai.docsite.latex.parse;

/**
 * Classification of individual lines, in recognizer priority order.
 */
enum LineKind {
    BLANK,
    CALLOUT_HEADER,
    BLOCK_QUOTE,
    FENCE,
    MATH_DELIMITER,
    HEADING,
    THEMATIC_BREAK,
    LIST_ITEM,
    IMAGE,
    TABLE_ROW,
    TEXT
}
