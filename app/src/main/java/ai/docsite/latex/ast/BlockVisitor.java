package ai.docsite.latex.ast;

/**
 * Exhaustive dispatch over the block variants.
 */
public interface BlockVisitor<R> {

    R visitHeading(Heading heading);

    R visitParagraph(Paragraph paragraph);

    R visitList(ListBlock list);

    R visitCodeBlock(CodeBlock codeBlock);

    R visitCallout(Callout callout);

    R visitTable(Table table);

    R visitImage(Image image);

    R visitHorizontalRule(HorizontalRule rule);
}
