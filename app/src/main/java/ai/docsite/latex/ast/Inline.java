package ai.docsite.latex.ast;

/**
 * Markup element within a text run.
 */
public sealed interface Inline
        permits Text, Emphasis, InlineCode, Link, Citation, FootnoteRef, CustomMarker, MathSpan, LineBreak {

    <R> R accept(InlineVisitor<R> visitor);
}
