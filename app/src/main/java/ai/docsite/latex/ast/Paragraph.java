package ai.docsite.latex.ast;

import java.util.List;

public record Paragraph(List<Inline> content) implements Block {

    public Paragraph {
        content = List.copyOf(content);
    }

    @Override
    public <R> R accept(BlockVisitor<R> visitor) {
        return visitor.visitParagraph(this);
    }
}
