package ai.docsite.latex.ast;

/**
 * Exhaustive dispatch over the inline variants.
 */
public interface InlineVisitor<R> {

    R visitText(Text text);

    R visitEmphasis(Emphasis emphasis);

    R visitInlineCode(InlineCode code);

    R visitLink(Link link);

    R visitCitation(Citation citation);

    R visitFootnoteRef(FootnoteRef ref);

    R visitCustomMarker(CustomMarker marker);

    R visitMath(MathSpan math);

    R visitLineBreak(LineBreak lineBreak);
}
