package ai.docsite.latex.ast;

/**
 * Structural element spanning whole source lines.
 */
public sealed interface Block
        permits Heading, Paragraph, ListBlock, CodeBlock, Callout, Table, Image, HorizontalRule {

    <R> R accept(BlockVisitor<R> visitor);
}
